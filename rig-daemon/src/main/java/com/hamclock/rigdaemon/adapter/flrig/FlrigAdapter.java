package com.hamclock.rigdaemon.adapter.flrig;

import com.hamclock.rigdaemon.adapter.RadioAdapter;
import com.hamclock.rigdaemon.adapter.RadioPoller;
import com.hamclock.rigdaemon.adapter.TuneStateMachine;
import com.hamclock.rigdaemon.config.RigProperties;
import com.hamclock.rigdaemon.exception.RigDaemonException;
import com.hamclock.rigdaemon.service.ChangeBroadcaster;
import lombok.extern.slf4j.Slf4j;
import org.apache.xmlrpc.XmlRpcException;
import org.springframework.scheduling.TaskScheduler;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * flrig adapter over XML-RPC.
 *
 * XML-RPC is connectionless, so there is no queue and no reconnect loop: every poll tick issues
 * {@code rig.get_vfo}, {@code rig.get_mode} and {@code rig.get_ptt} as three independent calls that
 * may complete in any order. The frequency read doubles as the health probe: its success marks the
 * radio connected, its failure marks it disconnected until a later tick succeeds.
 * <p>
 * A tick is skipped while any read of the previous one is still outstanding, so a slow or
 * unreachable flrig never has more than one round of reads queued on the I/O executor.
 */
@Slf4j
public class FlrigAdapter implements RadioAdapter, RadioPoller {

    // flrig only accepts <double> for set_frequency; the fraction keeps integral Hz values typed as double
    static final double FREQUENCY_EPSILON = 0.1;

    private final FlrigClient client;
    private final ChangeBroadcaster broadcaster;
    private final Executor executor;
    private final TuneStateMachine tuneStateMachine;
    private final AtomicBoolean pollInFlight = new AtomicBoolean(false);

    public FlrigAdapter(FlrigClient client, ChangeBroadcaster broadcaster, Executor executor,
                        TaskScheduler scheduler, RigProperties properties) {
        this.client = client;
        this.broadcaster = broadcaster;
        this.executor = executor;
        this.tuneStateMachine = new TuneStateMachine(
            "Flrig",
            () -> call("rig.tune", 1),
            this::setPTT,
            scheduler,
            properties::tuneDelay);
    }

    @Override
    public void connect() {
        log.info("🔧 [Flrig] Client initialized (XML-RPC is connectionless)");
        call("rig.get_modes").whenComplete((modes, error) -> {
            if (error != null) {
                log.warn("⚠️ [Flrig] Could not fetch modes: {}", RigDaemonException.unwrap(error).getMessage());
            } else {
                log.info("📋 [Flrig] Supported modes: {}", describe(modes));
            }
        });
    }

    @Override
    public void poll() {
        if (!pollInFlight.compareAndSet(false, true)) {
            log.debug("⏳ [Flrig] Previous poll still running, skipping tick");
            return;
        }
        CompletableFuture<Object> frequency = call("rig.get_vfo");
        CompletableFuture<Object> mode = call("rig.get_mode");
        CompletableFuture<Object> ptt = call("rig.get_ptt");
        CompletableFuture.allOf(frequency, mode, ptt).whenComplete((ignored, error) -> pollInFlight.set(false));

        frequency.whenComplete((value, error) -> {
            if (error != null) {
                if (broadcaster.isConnected()) {
                    log.error("❌ [Flrig] Poll error: {}", RigDaemonException.unwrap(error).getMessage());
                }
                broadcaster.updateConnected(false);
                return;
            }
            if (!broadcaster.isConnected()) {
                log.info("✅ [Flrig] Backend reachable");
            }
            broadcaster.updateConnected(true);
            try {
                broadcaster.updateFrequency(parseFrequency(value));
                broadcaster.touch();
            } catch (RuntimeException e) {
                log.warn("⚠️ [Flrig] Bad frequency value '{}': {}", value, e.getMessage());
            }
        });

        mode.whenComplete((value, error) -> {
            if (error == null && value != null) {
                broadcaster.updateMode(String.valueOf(value));
            }
        });

        ptt.whenComplete((value, error) -> {
            if (error == null) {
                broadcaster.updatePtt(toBoolean(value));
            }
        });
    }

    @Override
    public CompletableFuture<String> sendCommand(String command) {
        return call(command).thenApply(FlrigAdapter::describe);
    }

    @Override
    public CompletableFuture<Void> setFrequency(long frequencyHz) {
        return call("rig.set_frequency", frequencyHz + FREQUENCY_EPSILON).thenAccept(ignored -> broadcaster.touch());
    }

    @Override
    public CompletableFuture<Void> setMode(String mode, int passbandHz) {
        // flrig set_mode takes only the mode name
        return call("rig.set_mode", mode).thenAccept(ignored -> broadcaster.touch());
    }

    @Override
    public CompletableFuture<Void> setPTT(boolean transmit) {
        return call("rig.set_ptt", transmit ? 1 : 0)
            .thenAccept(ignored -> {
                broadcaster.updatePtt(transmit);
                broadcaster.touch();
            });
    }

    @Override
    public CompletableFuture<Void> tune() {
        return tuneStateMachine.start();
    }

    /**
     * Run one XML-RPC call on the I/O executor. Faults, and a full executor, complete the future
     * with a {@link RigDaemonException}; this method never throws.
     */
    CompletableFuture<Object> call(String method, Object... params) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return client.call(method, params);
                } catch (XmlRpcException e) {
                    throw new CompletionException(RigDaemonException.rigError(method + " failed: " + e.getMessage(), e));
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            log.warn("⚠️ [Flrig] I/O executor saturated, {} not sent", method);
            return CompletableFuture.failedFuture(RigDaemonException.rigError("flrig busy: " + method + " not sent", e));
        }
    }

    static long parseFrequency(Object value) {
        if (value instanceof Number number) {
            return Math.round(number.doubleValue());
        }
        return new BigDecimal(String.valueOf(value).trim()).longValue();
    }

    static boolean toBoolean(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            return number.intValue() != 0;
        }
        if (value == null) {
            return false;
        }
        String text = String.valueOf(value).trim();
        return "1".equals(text) || "true".equalsIgnoreCase(text);
    }

    static String describe(Object value) {
        if (value instanceof Object[] array) {
            return Arrays.toString(array);
        }
        return String.valueOf(value);
    }
}
