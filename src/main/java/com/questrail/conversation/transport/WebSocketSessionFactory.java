package com.questrail.conversation.transport;

import java.util.concurrent.Executor;

/**
 * Creates the listener for a freshly upgraded, authenticated connection.
 */
@FunctionalInterface
public interface WebSocketSessionFactory
{
    /**
     * @param conversation conversation named in the upgrade request path
     * @param user         user the authenticator identified
     * @param connection   the new connection
     * @param executor     the connection's execution context; listener
     *                     callbacks arrive on it and connection methods must
     *                     be called from it
     * @return listener for the connection's inbound traffic
     */
    WebSocketConnectionListener open(long conversation,
                                     long user,
                                     WebSocketConnection connection,
                                     Executor executor);
}
