package com.questrail.conversation.api;

import java.util.Set;

/**
 * MessageStore
 * -----------------------------------------------------------------------------
 * Persistence and membership collaborator of the broker.
 *
 * <p>The conversation core never creates conversation or user ids; it only
 * references ids this store owns.</p>
 *
 * <h2>Threading</h2>
 * Both methods are called from the broker thread and may block it. A slow
 * store therefore delays every conversation on the broker.
 */
public interface MessageStore
{
    /**
     * Durably record a validated message body.
     *
     * @param conversation target conversation
     * @param user         author
     * @param body         validated body, exactly one root frame
     * @return the id and timestamp assigned to the new event
     * @throws ConversationNotFoundException if the conversation does not exist
     * @throws MessageStoreException         if the message could not be stored
     */
    PersistedMessage persist(long conversation, long user, byte[] body) throws MessageStoreException;

    /**
     * Users allowed to take part in {@code conversation}.
     *
     * @throws ConversationNotFoundException if the conversation does not exist
     * @throws MessageStoreException         on any other failure
     */
    Set<Long> members(long conversation) throws MessageStoreException;
}
