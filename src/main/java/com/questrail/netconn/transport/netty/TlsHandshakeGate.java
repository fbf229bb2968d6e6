package com.questrail.netconn.transport.netty;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.ssl.SslHandshakeCompletionEvent;
import io.netty.util.ReferenceCountUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * TlsHandshakeGate
 * =============================================================================
 * Holds a TLS channel back from the connection layer until the handshake has
 * finished.
 *
 * <p>Installed directly after the {@code SslHandler}. On success it runs the
 * ready callback, which is expected to install the connection's own handler
 * behind the gate, then replays any decrypted data that arrived early and
 * removes itself. On failure the channel is closed and the data dropped.</p>
 */
public final class TlsHandshakeGate extends ChannelInboundHandlerAdapter
{
    private final Consumer<Channel> onReady;
    private final BiConsumer<Channel, Throwable> onFailure;
    private final List<Object> held = new ArrayList<>();
    private boolean settled;

    public TlsHandshakeGate(Consumer<Channel> onReady, BiConsumer<Channel, Throwable> onFailure)
    {
        this.onReady = Objects.requireNonNull(onReady, "onReady");
        this.onFailure = Objects.requireNonNull(onFailure, "onFailure");
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg)
    {
        if (settled) {
            ctx.fireChannelRead(msg);
            return;
        }
        held.add(msg);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt)
    {
        if (!(evt instanceof SslHandshakeCompletionEvent handshake) || settled) {
            ctx.fireUserEventTriggered(evt);
            return;
        }
        settled = true;

        if (!handshake.isSuccess()) {
            releaseHeld();
            onFailure.accept(ctx.channel(), handshake.cause());
            ctx.close();
            return;
        }

        try {
            onReady.accept(ctx.channel());
        }
        catch (RuntimeException e) {
            releaseHeld();
            onFailure.accept(ctx.channel(), e);
            ctx.close();
            return;
        }

        for (Object msg : held) {
            ctx.fireChannelRead(msg);
        }
        held.clear();
        ctx.fireChannelReadComplete();
        ctx.fireUserEventTriggered(evt);
        ctx.pipeline().remove(this);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        if (settled) {
            ctx.fireExceptionCaught(cause);
            return;
        }
        settled = true;
        releaseHeld();
        onFailure.accept(ctx.channel(), cause);
        ctx.close();
    }

    @Override
    public void handlerRemoved(ChannelHandlerContext ctx)
    {
        releaseHeld();
    }

    private void releaseHeld()
    {
        for (Object msg : held) {
            ReferenceCountUtil.release(msg);
        }
        held.clear();
    }
}
