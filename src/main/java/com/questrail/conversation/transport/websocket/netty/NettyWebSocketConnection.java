package com.questrail.conversation.transport.websocket.netty;

import com.questrail.conversation.transport.WebSocketConnection;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;

import java.util.Objects;

/**
 * {@link WebSocketConnection} over an upgraded Netty channel.
 *
 * <p>Only touched from the channel's event loop, so the closed flag needs no
 * synchronization.</p>
 */
final class NettyWebSocketConnection implements WebSocketConnection
{
    private final Channel channel;
    private boolean closed;

    NettyWebSocketConnection(Channel channel)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    @Override
    public void sendBinary(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");
        if (!closed) {
            channel.writeAndFlush(new BinaryWebSocketFrame(Unpooled.wrappedBuffer(payload)));
        }
    }

    @Override
    public void sendPing()
    {
        if (!closed) {
            channel.writeAndFlush(new PingWebSocketFrame());
        }
    }

    @Override
    public void close(int code, String reason)
    {
        if (closed) {
            return;
        }
        closed = true;
        channel.writeAndFlush(new CloseWebSocketFrame(code, reason == null ? "" : reason))
                .addListener(ChannelFutureListener.CLOSE);
    }

    @Override
    public void pauseInbound()
    {
        channel.config().setAutoRead(false);
    }

    @Override
    public void resumeInbound()
    {
        channel.config().setAutoRead(true);
    }

    /**
     * The peer started the close handshake and the handler answered it; later
     * {@link #close(int, String)} calls must not send a second close frame.
     */
    void markClosedByPeer()
    {
        closed = true;
    }
}
