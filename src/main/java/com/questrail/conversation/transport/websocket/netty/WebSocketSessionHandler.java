package com.questrail.conversation.transport.websocket.netty;

import com.questrail.conversation.api.HandshakeRequest;
import com.questrail.conversation.api.SessionAuthenticator;
import com.questrail.conversation.transport.WebSocketConnectionListener;
import com.questrail.conversation.transport.WebSocketSessionFactory;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshakerFactory;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * WebSocketSessionHandler
 * =============================================================================
 * Per-channel handler that upgrades {@code GET <prefix>/<id>/socket} requests
 * and then forwards WebSocket frames to the session's
 * {@link WebSocketConnectionListener}.
 *
 * <h2>Upgrade</h2>
 * <ul>
 *   <li>Unknown path or non-numeric id: {@code 404}</li>
 *   <li>Method other than {@code GET}: {@code 405}</li>
 *   <li>Authenticator rejects the request: {@code 403}</li>
 *   <li>Unsupported WebSocket version: Netty's {@code 426} response</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Frame payloads are copied into {@code byte[]} / {@code String} before they
 * reach the listener. Pings and close frames are answered here.
 */
final class WebSocketSessionHandler extends SimpleChannelInboundHandler<Object>
{
    private static final int NO_STATUS_CODE = 1005;

    private final String socketPathPrefix;
    private final int maxFramePayloadLength;
    private final SessionAuthenticator authenticator;
    private final WebSocketSessionFactory sessionFactory;

    private WebSocketServerHandshaker handshaker;
    private NettyWebSocketConnection connection;
    private WebSocketConnectionListener listener;

    WebSocketSessionHandler(String socketPathPrefix,
                            int maxFramePayloadLength,
                            SessionAuthenticator authenticator,
                            WebSocketSessionFactory sessionFactory)
    {
        this.socketPathPrefix = Objects.requireNonNull(socketPathPrefix, "socketPathPrefix");
        this.maxFramePayloadLength = maxFramePayloadLength;
        this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg)
    {
        if (msg instanceof FullHttpRequest request) {
            handleUpgrade(ctx, request);
        }
        else if (listener == null) {
            // Frames can only follow a successful upgrade.
            ctx.close();
        }
        else if (msg instanceof BinaryWebSocketFrame frame) {
            ByteBuf content = frame.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);
            listener.onBinary(bytes);
        }
        else if (msg instanceof TextWebSocketFrame frame) {
            listener.onText(frame.text());
        }
        else if (msg instanceof PingWebSocketFrame frame) {
            ctx.writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
            listener.onPing();
        }
        else if (msg instanceof PongWebSocketFrame) {
            listener.onPong();
        }
        else if (msg instanceof CloseWebSocketFrame frame) {
            int code = frame.statusCode() < 0 ? NO_STATUS_CODE : frame.statusCode();
            connection.markClosedByPeer();
            handshaker.close(ctx.channel(), frame.retain());
            listener.onClose(code);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx)
    {
        WebSocketConnectionListener l = listener;
        if (l != null) {
            l.onTransportDown(null);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        WebSocketConnectionListener l = listener;
        if (l != null) {
            l.onTransportDown(cause);
        }
        ctx.close();
    }

    private void handleUpgrade(ChannelHandlerContext ctx, FullHttpRequest request)
    {
        if (listener != null) {
            ctx.close();
            return;
        }

        String path = new QueryStringDecoder(request.uri()).path();
        OptionalLong conversation = parseConversation(path);
        if (conversation.isEmpty()) {
            respond(ctx, request, HttpResponseStatus.NOT_FOUND);
            return;
        }
        if (!HttpMethod.GET.equals(request.method())) {
            respond(ctx, request, HttpResponseStatus.METHOD_NOT_ALLOWED);
            return;
        }
        if (!request.headers().containsValue(HttpHeaderNames.UPGRADE, HttpHeaderValues.WEBSOCKET, true)) {
            respond(ctx, request, HttpResponseStatus.BAD_REQUEST);
            return;
        }

        Map<String, String> headers = new HashMap<>();
        for (Map.Entry<String, String> header : request.headers()) {
            headers.put(header.getKey(), header.getValue());
        }

        Optional<Long> user = authenticator.authenticate(
                new HandshakeRequest(conversation.getAsLong(), headers));
        if (user.isEmpty()) {
            respond(ctx, request, HttpResponseStatus.FORBIDDEN);
            return;
        }

        String host = request.headers().get(HttpHeaderNames.HOST, "localhost");
        WebSocketServerHandshakerFactory factory = new WebSocketServerHandshakerFactory(
                "ws://" + host + path, null, true, maxFramePayloadLength);
        handshaker = factory.newHandshaker(request);
        if (handshaker == null) {
            WebSocketServerHandshakerFactory.sendUnsupportedVersionResponse(ctx.channel());
            return;
        }

        handshaker.handshake(ctx.channel(), request);
        ctx.pipeline().addBefore(ctx.name(), "ws-aggregator",
                new WebSocketFrameAggregator(maxFramePayloadLength));

        connection = new NettyWebSocketConnection(ctx.channel());
        listener = sessionFactory.open(
                conversation.getAsLong(), user.get(), connection, ctx.channel().eventLoop());
    }

    /**
     * Extract the conversation id from {@code <prefix>/<id>/socket}.
     */
    OptionalLong parseConversation(String path)
    {
        String expectedSuffix = "/socket";
        if (!path.startsWith(socketPathPrefix + "/") || !path.endsWith(expectedSuffix)) {
            return OptionalLong.empty();
        }

        String id = path.substring(socketPathPrefix.length() + 1, path.length() - expectedSuffix.length());
        if (id.isEmpty() || id.length() > 18 || !id.chars().allMatch(Character::isDigit)) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(Long.parseLong(id));
    }

    private static void respond(ChannelHandlerContext ctx, FullHttpRequest request, HttpResponseStatus status)
    {
        FullHttpResponse response = new DefaultFullHttpResponse(
                request.protocolVersion(),
                status,
                Unpooled.copiedBuffer(status.toString(), StandardCharsets.UTF_8));
        HttpUtil.setContentLength(response, response.content().readableBytes());
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }
}
