package com.questrail.conversation.api;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * ConversationEvent
 * -----------------------------------------------------------------------------
 * A validated, persisted message, as broadcast to a conversation's listeners.
 *
 * <p>Created once by the broker per accepted message and shared read-only by
 * every listener it is delivered to. The body is copied on construction and
 * on every read, so no listener can affect what another one sees.</p>
 */
public final class ConversationEvent
{
    private final long conversation;
    private final long id;
    private final long user;
    private final Instant timestamp;
    private final byte[] body;

    public ConversationEvent(long conversation, long id, long user, Instant timestamp, byte[] body)
    {
        this.conversation = conversation;
        this.id = id;
        this.user = user;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.body = Objects.requireNonNull(body, "body").clone();
    }

    public long conversation()
    {
        return conversation;
    }

    /** Event id assigned by the {@link MessageStore}. */
    public long id()
    {
        return id;
    }

    /** Author of the message. */
    public long user()
    {
        return user;
    }

    public Instant timestamp()
    {
        return timestamp;
    }

    /** The validated message body, exactly one root frame. */
    public byte[] body()
    {
        return body.clone();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConversationEvent other)) {
            return false;
        }
        return conversation == other.conversation
                && id == other.id
                && user == other.user
                && timestamp.equals(other.timestamp)
                && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(conversation, id, user, timestamp) * 31 + Arrays.hashCode(body);
    }

    @Override
    public String toString()
    {
        return "ConversationEvent[conversation=" + conversation + ", id=" + id + ", user=" + user
                + ", timestamp=" + timestamp + ", body=" + body.length + " bytes]";
    }
}
