package com.questrail.conversation.broker;

import java.util.Objects;

/**
 * A user may not join a conversation.
 */
public final class ConversationAccessException extends RuntimeException
{
    public enum Reason
    {
        /** The conversation does not exist. */
        NOT_FOUND,
        /** The user is not a member of the conversation. */
        NOT_A_MEMBER
    }

    private final Reason reason;
    private final long conversation;
    private final long user;

    public ConversationAccessException(Reason reason, long conversation, long user)
    {
        super(reason == Reason.NOT_FOUND
                ? "no such conversation: " + conversation
                : "user " + user + " is not a member of conversation " + conversation);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.conversation = conversation;
        this.user = user;
    }

    public Reason reason()
    {
        return reason;
    }

    public long conversation()
    {
        return conversation;
    }

    public long user()
    {
        return user;
    }
}
