package com.hamclock.rigdaemon.adapter.rigctld;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import lombok.extern.slf4j.Slf4j;

/**
 * Last inbound handler of the rigctld pipeline: hands decoded reply lines to the command queue and
 * reports link loss back to the adapter.
 */
@Slf4j
public class RigctldResponseHandler extends SimpleChannelInboundHandler<String> {

    private final CommandQueue queue;
    private final RigctldAdapter adapter;

    public RigctldResponseHandler(CommandQueue queue, RigctldAdapter adapter) {
        this.queue = queue;
        this.adapter = adapter;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String msg) {
        String line = msg.trim();
        if (line.isEmpty()) {
            return;
        }
        log.trace("⬅️ rigctld >> {}", line);
        queue.onLine(line);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        adapter.onDisconnected(ctx.channel());
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("❌ rigctld link error: {}", cause.getMessage());
        ctx.close();
    }
}
