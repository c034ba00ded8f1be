package com.questrail.conversation.transport;

/**
 * WebSocketConnectionListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link WebSocketConnection}.
 *
 * <p>All callbacks are delivered serialized, on the connection's execution
 * context. Netty connections deliver them on the channel's event loop.</p>
 */
public interface WebSocketConnectionListener
{
    /**
     * Called for every complete binary message. Fragmented messages are
     * reassembled before delivery.
     *
     * @param payload message bytes, owned by the listener
     */
    void onBinary(byte[] payload);

    /**
     * Called for every complete text message.
     */
    void onText(String text);

    /**
     * Called when the peer pinged. The transport has already answered.
     */
    void onPing();

    /**
     * Called when the peer answered a ping.
     */
    void onPong();

    /**
     * Called when the peer started the close handshake. The transport has
     * already answered it.
     *
     * @param code close code sent by the peer, or {@code 1005} if none
     */
    void onClose(int code);

    /**
     * Called when the connection became unusable without a close handshake,
     * or after the close handshake completed.
     *
     * @param cause an exception, or {@code null} for an orderly shutdown
     */
    void onTransportDown(Throwable cause);
}
