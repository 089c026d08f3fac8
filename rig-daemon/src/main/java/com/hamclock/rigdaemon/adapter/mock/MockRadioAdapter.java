package com.hamclock.rigdaemon.adapter.mock;

import com.hamclock.rigdaemon.adapter.RadioAdapter;
import com.hamclock.rigdaemon.adapter.RadioPoller;
import com.hamclock.rigdaemon.config.RigProperties;
import com.hamclock.rigdaemon.service.ChangeBroadcaster;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Simulated radio without any I/O.
 *
 * Seeds a 20 m FT8 setup, reports connected at once, and applies writes straight to the shared
 * state. Each poll tick only refreshes {@code lastUpdateAt}.
 */
@Slf4j
public class MockRadioAdapter implements RadioAdapter, RadioPoller {

    public static final long SEED_FREQUENCY_HZ = 14_074_000L;
    public static final String SEED_MODE = "USB";
    public static final int SEED_PASSBAND_HZ = 2400;

    private final ChangeBroadcaster broadcaster;
    private final TaskScheduler scheduler;
    private final long tuneDelayMs;
    private final AtomicBoolean tuning = new AtomicBoolean(false);

    public MockRadioAdapter(ChangeBroadcaster broadcaster, TaskScheduler scheduler, RigProperties properties) {
        this.broadcaster = broadcaster;
        this.scheduler = scheduler;
        this.tuneDelayMs = properties.tuneDelay();
    }

    @Override
    public void connect() {
        log.info("🧪 [Mock] Simulated radio online: {} Hz {} {} Hz", SEED_FREQUENCY_HZ, SEED_MODE, SEED_PASSBAND_HZ);
        broadcaster.updateFrequency(SEED_FREQUENCY_HZ);
        broadcaster.updateMode(SEED_MODE);
        broadcaster.updatePassband(SEED_PASSBAND_HZ);
        broadcaster.updatePtt(false);
        broadcaster.updateConnected(true);
        broadcaster.touch();
    }

    @Override
    public void poll() {
        broadcaster.touch();
    }

    @Override
    public CompletableFuture<String> sendCommand(String command) {
        log.debug("🧪 [Mock] Command ignored: {}", command);
        return CompletableFuture.completedFuture("RPRT 0");
    }

    @Override
    public CompletableFuture<Void> setFrequency(long frequencyHz) {
        broadcaster.updateFrequency(frequencyHz);
        broadcaster.touch();
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> setMode(String mode, int passbandHz) {
        broadcaster.updateMode(mode);
        if (passbandHz > 0) {
            broadcaster.updatePassband(passbandHz);
        }
        broadcaster.touch();
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> setPTT(boolean transmit) {
        broadcaster.updatePtt(transmit);
        broadcaster.touch();
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> tune() {
        if (!tuning.compareAndSet(false, true)) {
            log.warn("⚠️ [Mock] Tune already in progress, request ignored");
            return CompletableFuture.completedFuture(null);
        }
        log.info("🎛️ [Mock] Simulating tuner cycle for {} ms", tuneDelayMs);
        CompletableFuture<Void> done = new CompletableFuture<>();
        scheduler.schedule(() -> {
            tuning.set(false);
            log.info("✅ [Mock] Tune completed");
            done.complete(null);
        }, Instant.now().plus(Duration.ofMillis(tuneDelayMs)));
        return done;
    }

    public boolean isTuning() {
        return tuning.get();
    }
}
