package com.questrail.conversation.broker;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * ConversationBroker
 * =============================================================================
 * Process-wide registry of live listeners per conversation, and the single
 * path by which new messages enter a conversation.
 *
 * <h2>Ordering</h2>
 * All operations are applied one at a time in submission order, across all
 * conversations. Returned futures complete on the broker's own thread;
 * callers that care about their execution context must hop off it
 * ({@code whenCompleteAsync(..., executor)}).
 *
 * <h2>Delivery</h2>
 * Delivery is best-effort and at-most-once. A listener that fails to accept
 * an event is disconnected; the sender of the message is not told.
 */
public interface ConversationBroker
{
    /**
     * Register {@code listener} for events of {@code conversation}.
     *
     * <p>The future fails with {@link ConversationAccessException} if the
     * conversation does not exist or {@code user} is not a member, and with
     * {@link com.questrail.conversation.api.MessageStoreException} if the
     * membership could not be loaded. Registering the same listener twice
     * registers it twice.</p>
     */
    CompletableFuture<Void> connect(long user, long conversation, ConversationListener listener);

    /**
     * Remove every registration of {@code listener} for {@code conversation}.
     * Unknown listeners and conversations are ignored.
     */
    CompletableFuture<Void> disconnect(long conversation, ConversationListener listener);

    /**
     * Validate, persist and broadcast a message.
     *
     * <p>The future completes with the persisted event id, or fails with
     * {@link com.questrail.conversation.format.MessageValidationException}
     * (nothing persisted, nothing delivered) or
     * {@link com.questrail.conversation.api.MessageStoreException}.</p>
     */
    CompletableFuture<Long> newMessage(long conversation, long user, byte[] body);

    /**
     * Number of registered listeners per conversation. Conversations without
     * listeners are absent.
     */
    CompletableFuture<Map<Long, Integer>> snapshot();
}
