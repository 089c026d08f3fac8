package com.hamclock.rigdaemon.adapter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Tuner cycle with a momentary-key fallback.
 *
 * <pre>
 *   IDLE → TRY_NATIVE ──ok──────────────────────────────────────────────→ IDLE
 *                     └─error→ FALLBACK_KEY_DOWN ─(tuneDelay)→ FALLBACK_KEY_UP → IDLE
 * </pre>
 *
 * The native attempt uses the backend's own tune command. When that fails, PTT is asserted,
 * held for {@code tuneDelay} ms and released, which is enough for rigs with an automatic tuner that
 * starts on carrier. A start request while a cycle is running is ignored.
 */
@Slf4j
public class TuneStateMachine {

    public enum TuneState {
        IDLE,
        TRY_NATIVE,
        FALLBACK_KEY_DOWN,
        FALLBACK_KEY_UP
    }

    private final String name;
    private final Supplier<CompletableFuture<?>> nativeTune;
    private final Function<Boolean, CompletableFuture<Void>> keyer;
    private final TaskScheduler scheduler;
    private final LongSupplier tuneDelayMs;

    private final AtomicReference<TuneState> state = new AtomicReference<>(TuneState.IDLE);

    public TuneStateMachine(String name,
                            Supplier<CompletableFuture<?>> nativeTune,
                            Function<Boolean, CompletableFuture<Void>> keyer,
                            TaskScheduler scheduler,
                            LongSupplier tuneDelayMs) {
        this.name = name;
        this.nativeTune = nativeTune;
        this.keyer = keyer;
        this.scheduler = scheduler;
        this.tuneDelayMs = tuneDelayMs;
    }

    public TuneState state() {
        return state.get();
    }

    public CompletableFuture<Void> start() {
        if (!state.compareAndSet(TuneState.IDLE, TuneState.TRY_NATIVE)) {
            log.warn("⚠️ [{}] Tune already in progress ({}), request ignored", name, state.get());
            return CompletableFuture.completedFuture(null);
        }

        log.info("🎛️ [{}] Sending tune command...", name);
        CompletableFuture<Void> done = new CompletableFuture<>();

        invokeNative().whenComplete((ignored, error) -> {
            if (error == null) {
                log.info("✅ [{}] Tune command sent successfully", name);
                finish(done, null);
            } else {
                log.warn("⚠️ [{}] Native tune failed, trying fallback (PTT toggle): {}", name, rootMessage(error));
                keyDown(done);
            }
        });
        return done;
    }

    private CompletableFuture<?> invokeNative() {
        try {
            return nativeTune.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void keyDown(CompletableFuture<Void> done) {
        state.set(TuneState.FALLBACK_KEY_DOWN);
        keyer.apply(true).whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("❌ [{}] Fallback tune could not key transmitter: {}", name, rootMessage(error));
                finish(done, error);
                return;
            }
            long delay = tuneDelayMs.getAsLong();
            scheduler.schedule(() -> keyUp(done), Instant.now().plus(Duration.ofMillis(delay)));
        });
    }

    private void keyUp(CompletableFuture<Void> done) {
        state.set(TuneState.FALLBACK_KEY_UP);
        keyer.apply(false).whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("❌ [{}] Fallback tune could not release transmitter: {}", name, rootMessage(error));
            } else {
                log.info("✅ [{}] Fallback tune (PTT) completed", name);
            }
            finish(done, error);
        });
    }

    private void finish(CompletableFuture<Void> done, Throwable error) {
        state.set(TuneState.IDLE);
        if (error == null) {
            done.complete(null);
        } else {
            done.completeExceptionally(error);
        }
    }

    static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
