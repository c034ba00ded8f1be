package com.questrail.conversation.api;

import java.util.Optional;

/**
 * Identifies the user behind a WebSocket upgrade request.
 *
 * <p>Called on a Netty event loop thread; implementations must not block.
 * Membership of the conversation is checked later by the broker, so an
 * authenticator only answers "who is this".</p>
 */
@FunctionalInterface
public interface SessionAuthenticator
{
    /**
     * @return the authenticated user id, or empty to reject the upgrade
     */
    Optional<Long> authenticate(HandshakeRequest request);
}
