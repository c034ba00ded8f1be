package com.questrail.conversation.transport;

/**
 * WebSocketConnection
 * -----------------------------------------------------------------------------
 * Minimal port for one accepted WebSocket connection.
 *
 * <p>Sessions see only whole binary messages, ping frames and a close
 * handshake carrying a numeric code. Implementations may be backed by Netty or
 * a test harness.</p>
 *
 * <p>All methods may be called from the connection's own execution context
 * only. Calls after {@link #close(int, String)} are ignored.</p>
 */
public interface WebSocketConnection
{
    /**
     * Send one complete binary message.
     */
    void sendBinary(byte[] payload);

    /**
     * Send a keep-alive ping with an empty payload.
     */
    void sendPing();

    /**
     * Start the close handshake and release the connection. Only the first
     * call has any effect, including when the peer closed first.
     *
     * @param code   WebSocket close code
     * @param reason optional human-readable reason, may be empty
     */
    void close(int code, String reason);

    /**
     * Hint that the session is not consuming inbound messages for now.
     *
     * <p>Implementations should stop reading from the network. Messages that
     * are already in flight may still be delivered.</p>
     */
    void pauseInbound();

    /**
     * Undo {@link #pauseInbound()}.
     */
    void resumeInbound();
}
