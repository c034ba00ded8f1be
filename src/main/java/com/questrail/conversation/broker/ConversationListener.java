package com.questrail.conversation.broker;

import com.questrail.conversation.api.ConversationEvent;

/**
 * Mailbox through which the broker hands events to a live connection.
 *
 * <p>Listeners are identified by object identity: disconnecting a listener
 * removes every registration of that same instance.</p>
 */
public interface ConversationListener
{
    /**
     * Hand {@code event} to the listener without blocking.
     *
     * <p>Called on the broker thread. Implementations enqueue the event onto
     * their own execution context and return immediately.</p>
     *
     * @return {@code false} if the listener can no longer accept events; the
     *         broker then disconnects it
     */
    boolean deliver(ConversationEvent event);
}
