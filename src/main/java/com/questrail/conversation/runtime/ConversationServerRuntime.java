package com.questrail.conversation.runtime;

import com.questrail.conversation.api.MemberNotifier;
import com.questrail.conversation.api.MessageStore;
import com.questrail.conversation.api.SessionAuthenticator;
import com.questrail.conversation.broker.ConversationBroker;
import com.questrail.conversation.broker.DefaultConversationBroker;
import com.questrail.conversation.config.ConversationServerConfig;
import com.questrail.conversation.internal.time.MonotonicClock;
import com.questrail.conversation.internal.time.MonotonicScheduler;
import com.questrail.conversation.internal.time.ScheduledExecutorScheduler;
import com.questrail.conversation.internal.time.SystemMonotonicClock;
import com.questrail.conversation.internal.time.SystemWallClock;
import com.questrail.conversation.observability.ConversationObservabilitySink;
import com.questrail.conversation.observability.NullObservabilitySink;
import com.questrail.conversation.session.ClientSession;
import com.questrail.conversation.transport.WebSocketSessionFactory;
import com.questrail.conversation.transport.websocket.netty.NettyWebSocketServer;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * ConversationServerRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the production conversation stack:
 * broker thread, keep-alive scheduler and Netty WebSocket server.
 *
 * <pre>
 *   ConversationServerRuntime runtime = ConversationServerRuntime.builder()
 *           .withMessageStore(store)
 *           .withAuthenticator(authenticator)
 *           .build();
 *   runtime.start();
 * </pre>
 */
public final class ConversationServerRuntime {
    private final DefaultConversationBroker broker;
    private final NettyWebSocketServer server;
    private final ScheduledExecutorService schedulerExecutor;
    private final ConversationServerConfig config;

    private ConversationServerRuntime(
            DefaultConversationBroker broker,
            NettyWebSocketServer server,
            ScheduledExecutorService schedulerExecutor,
            ConversationServerConfig config) {
        this.broker = broker;
        this.server = server;
        this.schedulerExecutor = schedulerExecutor;
        this.config = config;
    }

    public void start() {
        broker.start();
        try {
            server.start();
        } catch (RuntimeException e) {
            broker.stop();
            schedulerExecutor.shutdownNow();
            throw e;
        }
    }

    public void stop() {
        // Closing the server closes every connection, which stops their sessions.
        server.stop();
        broker.stop();
        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /** Address the WebSocket server is bound to. */
    public InetSocketAddress localAddress() {
        return server.localAddress();
    }

    public ConversationBroker broker() {
        return broker;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ConversationServerConfig config = ConversationServerConfig.defaults();
        private MessageStore messageStore;
        private SessionAuthenticator authenticator;
        private MemberNotifier memberNotifier = MemberNotifier.NONE;
        private ConversationObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withConfig(ConversationServerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withMessageStore(MessageStore store) {
            this.messageStore = store;
            return this;
        }

        public Builder withAuthenticator(SessionAuthenticator authenticator) {
            this.authenticator = authenticator;
            return this;
        }

        public Builder withMemberNotifier(MemberNotifier notifier) {
            this.memberNotifier = notifier;
            return this;
        }

        public Builder withObservabilitySink(ConversationObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public ConversationServerRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(messageStore, "messageStore");
            Objects.requireNonNull(authenticator, "authenticator");

            // 1. Core dependencies
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            ScheduledExecutorService schedulerExec = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "conversation-keepalive");
                t.setDaemon(true);
                return t;
            });
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            // 2. Broker
            DefaultConversationBroker broker = new DefaultConversationBroker(
                messageStore,
                memberNotifier,
                observabilitySink,
                SystemWallClock.INSTANCE,
                config.shutdownTimeout()
            );

            // 3. One session per upgraded connection
            ConversationServerConfig cfg = config;
            ConversationObservabilitySink sink = observabilitySink;
            WebSocketSessionFactory sessions = (conversation, user, connection, executor) -> {
                ClientSession session = new ClientSession(
                    conversation,
                    user,
                    connection,
                    broker,
                    executor,
                    scheduler,
                    clock,
                    cfg.keepAliveInterval(),
                    sink,
                    SystemWallClock.INSTANCE
                );
                session.start();
                return session;
            };

            // 4. Transport
            NettyWebSocketServer server = new NettyWebSocketServer(
                config.bindAddress(),
                config.socketPathPrefix(),
                config.maxFramePayloadLength(),
                authenticator,
                sessions
            );

            return new ConversationServerRuntime(broker, server, schedulerExec, config);
        }
    }
}
