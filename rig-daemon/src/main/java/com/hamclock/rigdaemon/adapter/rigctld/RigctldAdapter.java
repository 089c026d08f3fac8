package com.hamclock.rigdaemon.adapter.rigctld;

import com.hamclock.rigdaemon.adapter.RadioAdapter;
import com.hamclock.rigdaemon.adapter.RadioPoller;
import com.hamclock.rigdaemon.adapter.TuneStateMachine;
import com.hamclock.rigdaemon.config.RigProperties;
import com.hamclock.rigdaemon.exception.RigDaemonException;
import com.hamclock.rigdaemon.service.ChangeBroadcaster;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * rigctld (Hamlib) adapter over one persistent TCP connection.
 *
 * - Netty client with a line-based pipeline: LineBasedFrameDecoder → StringDecoder → response handler
 * - Every command goes through the {@link CommandQueue}: one in flight, replies matched in FIFO order
 * - Link loss marks the radio disconnected and re-dials after a fixed delay (not exponential)
 * - Reads: {@code f} frequency, {@code m} mode + passband, {@code t} PTT
 * - Writes: {@code F <hz>}, {@code M <mode> <passband>}, {@code T 0|1}, tune via {@code U TUNER 1}
 */
@Slf4j
public class RigctldAdapter implements RadioAdapter, RadioPoller {

    private static final int MAX_LINE_LENGTH = 1024;

    // ==================== Configuration ====================

    private final String host;
    private final int port;
    private final long reconnectDelayMs;
    private final int connectTimeoutMs;

    // ==================== Dependencies ====================

    private final ChangeBroadcaster broadcaster;
    private final CommandQueue queue;
    private final TuneStateMachine tuneStateMachine;

    // ==================== Link State ====================

    private EventLoopGroup workerGroup;
    private Bootstrap bootstrap;
    private volatile Channel channel;
    private final AtomicBoolean connecting = new AtomicBoolean(false);
    private final AtomicBoolean reconnectScheduled = new AtomicBoolean(false);
    private volatile boolean closing = false;

    // ==================== Constructor ====================

    public RigctldAdapter(RigProperties properties, ChangeBroadcaster broadcaster, TaskScheduler scheduler) {
        this.host = properties.host();
        this.port = properties.effectivePort();
        this.reconnectDelayMs = properties.reconnectDelay();
        this.connectTimeoutMs = properties.connectTimeout();
        this.broadcaster = broadcaster;
        this.queue = new CommandQueue(properties.commandTimeout());
        this.tuneStateMachine = new TuneStateMachine(
            "Rigctld",
            () -> sendCommand("U TUNER 1").thenAccept(RigctldReplies::requireOk),
            this::setPTT,
            scheduler,
            properties::tuneDelay);
        validateConfiguration();
    }

    // ==================== Link Lifecycle ====================

    @Override
    public void connect() {
        if (closing || channel != null || !connecting.compareAndSet(false, true)) {
            return;
        }
        if (workerGroup == null) {
            workerGroup = new NioEventLoopGroup(1);
            bootstrap = createBootstrap(workerGroup);
        }

        log.info("🔌 [Rigctld] Connecting to {}:{}...", host, port);
        ChannelFuture future = bootstrap.connect(host, port);
        future.addListener(f -> {
            connecting.set(false);
            if (f.isSuccess()) {
                onConnected(future.channel());
            } else {
                log.warn("⚠️ [Rigctld] Connect to {}:{} failed: {}", host, port, f.cause().getMessage());
                scheduleReconnect();
            }
        });
    }

    private Bootstrap createBootstrap(EventLoopGroup group) {
        return new Bootstrap()
            .group(group)
            .channel(NioSocketChannel.class)
            .option(ChannelOption.TCP_NODELAY, true)
            .option(ChannelOption.SO_KEEPALIVE, true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .option(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT)
            .handler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    setupPipeline(ch.pipeline());
                }
            });
    }

    /**
     * Setup the channel pipeline for the backend connection
     */
    void setupPipeline(ChannelPipeline pipeline) {
        pipeline.addLast("frameDecoder", new LineBasedFrameDecoder(MAX_LINE_LENGTH));
        pipeline.addLast("stringDecoder", new StringDecoder(StandardCharsets.US_ASCII));
        pipeline.addLast("stringEncoder", new StringEncoder(StandardCharsets.US_ASCII));
        pipeline.addLast("responseHandler", new RigctldResponseHandler(queue, this));
        log.debug("✅ Pipeline configured: {}", pipeline.names());
    }

    void onConnected(Channel connected) {
        log.info("✅ [Rigctld] Connected to {}:{}", host, port);
        channel = connected;
        queue.attach(connected);
        broadcaster.updateConnected(true);
        broadcaster.touch();
    }

    void onDisconnected(Channel lost) {
        if (channel != lost) {
            return;
        }
        log.warn("🔌 [Rigctld] Disconnected");
        channel = null;
        broadcaster.updateConnected(false);
        queue.detach(RigDaemonException.connectionLost());
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (closing || workerGroup == null || !reconnectScheduled.compareAndSet(false, true)) {
            return;
        }
        log.info("🔁 [Rigctld] Reconnecting in {} ms", reconnectDelayMs);
        workerGroup.schedule(() -> {
            reconnectScheduled.set(false);
            connect();
        }, reconnectDelayMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Close the link and stop reconnecting
     */
    public void close() {
        closing = true;
        log.info("🛑 [Rigctld] Shutting down...");
        Channel current = channel;
        try {
            if (current != null) {
                current.close().sync();
            }
        } catch (InterruptedException e) {
            log.warn("⚠️ Interrupted while closing rigctld channel", e);
            Thread.currentThread().interrupt();
        } finally {
            queue.detach(RigDaemonException.connectionLost());
            if (workerGroup != null) {
                workerGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            }
            log.info("✅ [Rigctld] Shutdown completed");
        }
    }

    public boolean isConnected() {
        Channel current = channel;
        return current != null && current.isActive();
    }

    // ==================== Commands ====================

    @Override
    public CompletableFuture<String> sendCommand(String command) {
        if (!isConnected()) {
            return CompletableFuture.failedFuture(RigDaemonException.notConnected());
        }
        return queue.submit(command);
    }

    @Override
    public void poll() {
        if (!isConnected()) {
            return;
        }
        if (queue.hasPending() && queue.queuedCount() > 0) {
            // backend is not keeping up; the reads already queued will refresh the state
            log.debug("⏳ [Rigctld] {} commands waiting, skipping poll", queue.queuedCount());
            return;
        }
        sendCommand("f").thenAccept(this::applyFrequency).exceptionally(this::pollFailed);
        sendCommand("m").thenAccept(this::applyMode).exceptionally(this::pollFailed);
        sendCommand("t").thenAccept(this::applyPtt).exceptionally(this::pollFailed);
    }

    @Override
    public CompletableFuture<Void> setFrequency(long frequencyHz) {
        return sendCommand("F " + frequencyHz).thenAccept(this::confirmWrite);
    }

    @Override
    public CompletableFuture<Void> setMode(String mode, int passbandHz) {
        return sendCommand("M " + mode + " " + passbandHz).thenAccept(this::confirmWrite);
    }

    @Override
    public CompletableFuture<Void> setPTT(boolean transmit) {
        return sendCommand(transmit ? "T 1" : "T 0")
            .thenAccept(reply -> {
                confirmWrite(reply);
                broadcaster.updatePtt(transmit);
            });
    }

    @Override
    public CompletableFuture<Void> tune() {
        return tuneStateMachine.start();
    }

    // ==================== Reply Handling ====================

    private void confirmWrite(String reply) {
        RigctldReplies.requireOk(reply);
        broadcaster.touch();
    }

    private void applyFrequency(String reply) {
        broadcaster.updateFrequency(RigctldReplies.parseFrequency(reply));
        broadcaster.touch();
    }

    private void applyMode(String reply) {
        RigctldReplies.ModeReply mode = RigctldReplies.parseMode(reply);
        broadcaster.updateMode(mode.mode());
        broadcaster.updatePassband(mode.passbandHz());
        broadcaster.touch();
    }

    private void applyPtt(String reply) {
        broadcaster.updatePtt(RigctldReplies.parsePtt(reply));
        broadcaster.touch();
    }

    private Void pollFailed(Throwable error) {
        log.debug("⚠️ [Rigctld] Poll read failed: {}", RigDaemonException.unwrap(error).getMessage());
        return null;
    }

    // Validate configuration parameters
    private void validateConfiguration() {
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Port must be between 1 and 65535, got: " + port);
        }
        if (reconnectDelayMs < 1) {
            throw new IllegalArgumentException("Reconnect delay must be at least 1 ms, got: " + reconnectDelayMs);
        }
    }
}
