package com.hamclock.rigdaemon.service;

import com.hamclock.rigdaemon.adapter.RadioAdapter;
import com.hamclock.rigdaemon.adapter.RadioPoller;
import com.hamclock.rigdaemon.config.RigProperties;
import com.hamclock.rigdaemon.dto.ConfigResponse;
import com.hamclock.rigdaemon.exception.RigDaemonException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Write path of the HTTP API.
 *
 * Every write goes to the active adapter. Once the backend accepted it, a poll is scheduled
 * {@code repollDelay} ms later so the broadcast state comes from the radio and not from the request.
 */
@Slf4j
@Service
public class RadioControlService {

    private final RadioAdapter adapter;
    private final RadioPoller poller;
    private final TaskScheduler scheduler;
    private final RigProperties properties;

    public RadioControlService(RadioAdapter adapter, RadioPoller poller, TaskScheduler scheduler,
                               RigProperties properties) {
        this.adapter = adapter;
        this.poller = poller;
        this.scheduler = scheduler;
        this.properties = properties;
    }

    /**
     * Tune to {@code frequencyHz}; with {@code tune} the tuner sequence starts {@code tuneDelay} ms
     * after the backend confirmed the new frequency.
     */
    public CompletableFuture<Void> setFrequency(long frequencyHz, boolean tune) {
        log.info("📻 [API] Setting freq: {} Hz{}", frequencyHz, tune ? " (tune requested)" : "");
        return adapter.setFrequency(frequencyHz).thenRun(() -> {
            scheduleRepoll();
            if (tune) {
                scheduleTune();
            }
        });
    }

    public CompletableFuture<Void> setMode(String mode, int passbandHz) {
        log.info("📻 [API] Setting mode: {} (passband {})", mode, passbandHz);
        return adapter.setMode(mode, passbandHz).thenRun(this::scheduleRepoll);
    }

    /**
     * Key or unkey the transmitter. Keying is refused before any backend call unless
     * {@code rig.radio.ptt-enabled} is set; unkeying is always allowed.
     */
    public CompletableFuture<Void> setPtt(boolean transmit) {
        if (transmit && !properties.pttEnabled()) {
            log.warn("🚫 [API] PTT request blocked by configuration (ptt-enabled: false)");
            return CompletableFuture.failedFuture(RigDaemonException.pttDisabled());
        }
        log.info("📻 [API] Setting PTT: {}", transmit);
        return adapter.setPTT(transmit);
    }

    public ConfigResponse currentConfig() {
        return ConfigResponse.from(properties);
    }

    private void scheduleRepoll() {
        scheduler.schedule(this::repoll, Instant.now().plus(Duration.ofMillis(properties.repollDelay())));
    }

    private void repoll() {
        try {
            poller.poll();
        } catch (RuntimeException e) {
            log.warn("⚠️ Confirming poll failed: {}", e.getMessage());
        }
    }

    private void scheduleTune() {
        long delay = properties.tuneDelay();
        log.info("🎛️ [API] Tune scheduled in {} ms", delay);
        scheduler.schedule(() -> adapter.tune().exceptionally(error -> {
            log.error("❌ Tune sequence failed: {}", RigDaemonException.unwrap(error).getMessage());
            return null;
        }), Instant.now().plus(Duration.ofMillis(delay)));
    }
}
