package com.questrail.conversation.api;

/**
 * Out-of-band notification for conversation members without a live
 * connection (mail digests, push notifications).
 *
 * <p>Called on the broker thread once per offline member and message.
 * Implementations should hand the notice off rather than doing slow work
 * inline. Exceptions are logged and otherwise ignored.</p>
 */
@FunctionalInterface
public interface MemberNotifier
{
    MemberNotifier NONE = notice -> {};

    void notifyNewMessage(NewMessageNotice notice);
}
