package com.questrail.conversation.api;

/**
 * The referenced conversation does not exist.
 */
public final class ConversationNotFoundException extends MessageStoreException
{
    private final long conversation;

    public ConversationNotFoundException(long conversation)
    {
        super("no such conversation: " + conversation);
        this.conversation = conversation;
    }

    public long conversation()
    {
        return conversation;
    }
}
