package com.hamclock.rigdaemon.adapter.rigctld;

import com.hamclock.rigdaemon.exception.RigDaemonException;
import io.netty.channel.Channel;
import io.netty.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * FIFO of rigctld commands over the single backend socket.
 * <p>
 * rigctld replies carry no request id, so a reply line always belongs to the one command that is
 * in flight. The queue keeps that invariant: the head is written only when nothing is pending and
 * a channel is attached, and the next command goes out only after the current reply completed.
 * <p>
 * Futures are completed outside the queue lock, so callbacks may enqueue further commands.
 */
@Slf4j
public class CommandQueue {

    private final long commandTimeoutMs;

    private final Deque<CommandRequest> queue = new ArrayDeque<>();
    private CommandRequest pending;
    private ScheduledFuture<?> pendingTimeout;
    private Channel channel;

    /**
     * @param commandTimeoutMs time a command may stay in flight; {@code 0} waits forever
     */
    public CommandQueue(long commandTimeoutMs) {
        this.commandTimeoutMs = commandTimeoutMs;
    }

    /**
     * Start writing queued commands to a freshly connected channel.
     */
    public void attach(Channel channel) {
        synchronized (this) {
            this.channel = channel;
            processNext();
        }
    }

    /**
     * Drop the channel and fail everything that was waiting on it.
     */
    public void detach(Throwable cause) {
        List<CommandRequest> failed = new ArrayList<>();
        synchronized (this) {
            channel = null;
            cancelTimeout();
            if (pending != null) {
                failed.add(pending);
                pending = null;
            }
            failed.addAll(queue);
            queue.clear();
        }
        if (!failed.isEmpty()) {
            log.warn("⚠️ Discarding {} rigctld command(s): {}", failed.size(), cause.getMessage());
        }
        failed.forEach(request -> request.getResponse().completeExceptionally(cause));
    }

    public CompletableFuture<String> submit(String command) {
        CommandRequest request = new CommandRequest(command);
        synchronized (this) {
            if (channel == null) {
                return CompletableFuture.failedFuture(RigDaemonException.notConnected());
            }
            queue.addLast(request);
            processNext();
        }
        return request.getResponse();
    }

    /**
     * Feed one reply line from the socket.
     */
    public void onLine(String line) {
        CommandRequest completed;
        synchronized (this) {
            if (pending == null) {
                log.debug("📭 Unsolicited rigctld line dropped: {}", line);
                return;
            }
            if (!pending.accept(line)) {
                return;
            }
            completed = pending;
            pending = null;
            cancelTimeout();
            processNext();
        }
        completed.getResponse().complete(completed.reply());
    }

    public synchronized boolean hasPending() {
        return pending != null;
    }

    public synchronized int queuedCount() {
        return queue.size();
    }

    // Caller holds the lock
    private void processNext() {
        if (pending != null || queue.isEmpty() || channel == null || !channel.isActive()) {
            return;
        }
        CommandRequest request = queue.pollFirst();
        pending = request;
        Channel target = channel;
        log.trace("➡️ rigctld << {}", request.getCommand());

        target.writeAndFlush(request.getCommand() + "\n").addListener(future -> {
            if (!future.isSuccess()) {
                log.error("❌ Failed to write '{}' to rigctld: {}", request.getCommand(), future.cause().getMessage());
                target.close();
            }
        });

        if (commandTimeoutMs > 0) {
            pendingTimeout = target.eventLoop().schedule(
                () -> onTimeout(request, target), commandTimeoutMs, TimeUnit.MILLISECONDS);
        }
    }

    private void onTimeout(CommandRequest request, Channel target) {
        synchronized (this) {
            if (pending != request) {
                return;
            }
            pending = null;
            pendingTimeout = null;
        }
        log.warn("⏱️ rigctld did not answer '{}' within {} ms, resetting link", request.getCommand(), commandTimeoutMs);
        request.getResponse().completeExceptionally(RigDaemonException.timeout(request.getCommand(), commandTimeoutMs));
        // A late reply would be matched to the next command, so the session is rebuilt
        target.close();
    }

    private void cancelTimeout() {
        if (pendingTimeout != null) {
            pendingTimeout.cancel(false);
            pendingTimeout = null;
        }
    }
}
