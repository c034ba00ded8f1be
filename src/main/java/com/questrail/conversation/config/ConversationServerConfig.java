package com.questrail.conversation.config;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for the conversation server runtime.
 *
 * @param bindAddress           address the WebSocket server listens on; port 0 picks a free port
 * @param socketPathPrefix      path prefix of the upgrade endpoint; sockets live at
 *                              {@code <prefix>/<conversation id>/socket}
 * @param maxFramePayloadLength largest WebSocket message accepted, after reassembly
 * @param keepAliveInterval     time between keep-alive pings on an idle or busy connection
 * @param shutdownTimeout       how long {@code stop()} waits for the broker thread
 */
public record ConversationServerConfig(
    InetSocketAddress bindAddress,
    String socketPathPrefix,
    int maxFramePayloadLength,
    Duration keepAliveInterval,
    Duration shutdownTimeout
) {
    public ConversationServerConfig {
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(socketPathPrefix, "socketPathPrefix");
        Objects.requireNonNull(keepAliveInterval, "keepAliveInterval");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");

        if (!socketPathPrefix.startsWith("/") || socketPathPrefix.endsWith("/")) {
            throw new IllegalArgumentException(
                "socketPathPrefix must start with '/' and not end with '/': " + socketPathPrefix);
        }
        if (maxFramePayloadLength <= 0) {
            throw new IllegalArgumentException("maxFramePayloadLength must be > 0");
        }
        if (keepAliveInterval.isNegative() || keepAliveInterval.isZero()) {
            throw new IllegalArgumentException("keepAliveInterval must be > 0");
        }
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must be >= 0");
        }
    }

    public static ConversationServerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress bindAddress = new InetSocketAddress(0);
        private String socketPathPrefix = "/conversations";
        private int maxFramePayloadLength = 64 * 1024;
        private Duration keepAliveInterval = Duration.ofSeconds(30);
        private Duration shutdownTimeout = Duration.ofSeconds(5);

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withSocketPathPrefix(String socketPathPrefix) {
            this.socketPathPrefix = socketPathPrefix;
            return this;
        }

        public Builder withMaxFramePayloadLength(int maxFramePayloadLength) {
            this.maxFramePayloadLength = maxFramePayloadLength;
            return this;
        }

        public Builder withKeepAliveInterval(Duration keepAliveInterval) {
            this.keepAliveInterval = keepAliveInterval;
            return this;
        }

        public Builder withShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public ConversationServerConfig build() {
            return new ConversationServerConfig(
                bindAddress, socketPathPrefix, maxFramePayloadLength, keepAliveInterval, shutdownTimeout);
        }
    }
}
