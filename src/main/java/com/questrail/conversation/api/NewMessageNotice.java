package com.questrail.conversation.api;

import java.util.List;
import java.util.Objects;

/**
 * Tells a member who is not connected that a message was posted.
 *
 * @param recipient member to notify
 * @param event     the new message
 * @param mentioned whether {@code recipient} is mentioned in the message
 */
public record NewMessageNotice(long recipient, ConversationEvent event, boolean mentioned)
{
    public NewMessageNotice
    {
        Objects.requireNonNull(event, "event");
    }

    public static NewMessageNotice of(long recipient, ConversationEvent event, List<Long> mentions)
    {
        return new NewMessageNotice(recipient, event, mentions.contains(recipient));
    }
}
