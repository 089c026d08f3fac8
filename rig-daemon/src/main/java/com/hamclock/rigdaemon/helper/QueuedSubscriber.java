package com.hamclock.rigdaemon.helper;

import com.hamclock.rigdaemon.dto.RigEvent;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Per-client outbox in front of a blocking {@link Subscriber}.
 *
 * {@link #send} only appends to a bounded backlog and never blocks; a single drain task on the
 * delivery executor writes the backlog to the client in order. A client whose write fails, or that
 * falls {@code capacity} events behind, is retired: its backlog is discarded, its stream is closed from
 * the delivery executor and {@code onFailure} receives its id.
 */
@Slf4j
public final class QueuedSubscriber implements Subscriber {

    private final Subscriber delegate;
    private final Executor executor;
    private final int capacity;
    private final Consumer<String> onFailure;

    // guarded by this
    private final Deque<RigEvent> backlog = new ArrayDeque<>();
    private boolean draining;
    private boolean retired;

    public QueuedSubscriber(Subscriber delegate, Executor executor, int capacity, Consumer<String> onFailure) {
        this.delegate = delegate;
        this.executor = executor;
        this.capacity = capacity;
        this.onFailure = onFailure;
    }

    @Override
    public String id() {
        return delegate.id();
    }

    @Override
    public void send(RigEvent event) throws IOException {
        boolean overflow = false;
        synchronized (this) {
            if (retired) {
                throw new IOException("Subscriber " + id() + " is closed");
            }
            if (backlog.size() >= capacity) {
                overflow = true;
            } else {
                backlog.addLast(event);
                if (draining) {
                    return;
                }
                draining = true;
            }
        }
        if (overflow) {
            log.warn("🐢 Stream client {} is {} events behind, dropping it", id(), capacity);
            retire();
            throw new IOException("Subscriber " + id() + " backlog full");
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            synchronized (this) {
                draining = false;
            }
            retire();
            throw new IOException("Delivery executor rejected subscriber " + id(), e);
        }
    }

    /**
     * Stop delivery and close the underlying stream without blocking the caller.
     */
    @Override
    public void close() {
        retire();
    }

    public synchronized int backlogSize() {
        return backlog.size();
    }

    public synchronized boolean isRetired() {
        return retired;
    }

    private void drain() {
        while (true) {
            RigEvent next;
            synchronized (this) {
                next = retired ? null : backlog.pollFirst();
                if (next == null) {
                    draining = false;
                    if (!retired) {
                        return;
                    }
                }
            }
            if (next == null) {
                // retired while this task was writing; the stream is closed here
                delegate.close();
                return;
            }
            try {
                delegate.send(next);
            } catch (IOException | IllegalStateException e) {
                log.debug("📭 Dropping subscriber {}: {}", id(), e.getMessage());
                synchronized (this) {
                    retired = true;
                    backlog.clear();
                    draining = false;
                }
                delegate.close();
                onFailure.accept(id());
                return;
            }
        }
    }

    private void retire() {
        boolean closeNow;
        synchronized (this) {
            if (retired) {
                return;
            }
            retired = true;
            backlog.clear();
            closeNow = !draining;
        }
        if (closeNow) {
            try {
                executor.execute(delegate::close);
            } catch (RejectedExecutionException e) {
                log.debug("📭 Could not close subscriber {}: {}", id(), e.getMessage());
            }
        }
    }
}
