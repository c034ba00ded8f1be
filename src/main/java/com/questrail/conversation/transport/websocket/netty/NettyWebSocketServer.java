package com.questrail.conversation.transport.websocket.netty;

import com.questrail.conversation.api.SessionAuthenticator;
import com.questrail.conversation.transport.WebSocketSessionFactory;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyWebSocketServer
 * =============================================================================
 * Netty-backed WebSocket server accepting conversation connections.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT decode
 * envelopes, talk to the broker, or schedule keep-alive pings; all of that
 * lives in the session the {@link WebSocketSessionFactory} creates.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds the listening socket and returns once it is bound.
 * - {@link #stop()} closes the listening socket and every accepted connection.
 */
public final class NettyWebSocketServer
{
    private final InetSocketAddress bindAddress;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ServerBootstrap bootstrap;

    private volatile Channel serverChannel;

    public NettyWebSocketServer(InetSocketAddress bindAddress,
                                String socketPathPrefix,
                                int maxFramePayloadLength,
                                SessionAuthenticator authenticator,
                                WebSocketSessionFactory sessionFactory)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(socketPathPrefix, "socketPathPrefix");
        Objects.requireNonNull(authenticator, "authenticator");
        Objects.requireNonNull(sessionFactory, "sessionFactory");

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(8 * 1024));
                        p.addLast(new WebSocketSessionHandler(
                                socketPathPrefix, maxFramePayloadLength, authenticator, sessionFactory));
                    }
                });
    }

    /**
     * Bind the listening socket.
     *
     * @throws IllegalStateException if the address cannot be bound
     */
    public void start()
    {
        ChannelFuture bound = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!bound.isSuccess()) {
            shutdownGroups();
            throw new IllegalStateException("cannot bind " + bindAddress, bound.cause());
        }
        serverChannel = bound.channel();
    }

    public void stop()
    {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().syncUninterruptibly();
            serverChannel = null;
        }
        shutdownGroups();
    }

    /**
     * The bound address; useful when binding to port 0.
     *
     * @throws IllegalStateException if the server is not started
     */
    public InetSocketAddress localAddress()
    {
        Channel ch = serverChannel;
        if (ch == null) {
            throw new IllegalStateException("server not started");
        }
        return (InetSocketAddress) ch.localAddress();
    }

    private void shutdownGroups()
    {
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
    }
}
