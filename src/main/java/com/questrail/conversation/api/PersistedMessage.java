package com.questrail.conversation.api;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of {@link MessageStore#persist(long, long, byte[])}.
 *
 * @param id        event id, unique within the store
 * @param timestamp time the store recorded for the message
 */
public record PersistedMessage(long id, Instant timestamp)
{
    public PersistedMessage
    {
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
