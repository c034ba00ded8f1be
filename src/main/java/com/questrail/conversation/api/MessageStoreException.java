package com.questrail.conversation.api;

/**
 * The message store could not complete an operation.
 */
public class MessageStoreException extends Exception
{
    public MessageStoreException(String message)
    {
        super(message);
    }

    public MessageStoreException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
