package com.questrail.conversation.protocol.model;

import com.questrail.conversation.protocol.envelope.Cookie;
import com.questrail.conversation.protocol.envelope.MessageKind;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * A message was added to the conversation.
 *
 * <p>The timestamp travels with second precision; sub-second parts are
 * dropped by the encoder.</p>
 */
public record NewMessage(Cookie cookie, long id, long user, Instant timestamp, byte[] body)
        implements WireMessage
{
    public NewMessage
    {
        Objects.requireNonNull(cookie, "cookie");
        Objects.requireNonNull(timestamp, "timestamp");
        body = Objects.requireNonNull(body, "body").clone();
    }

    @Override
    public byte[] body()
    {
        return body.clone();
    }

    @Override
    public MessageKind kind()
    {
        return MessageKind.NEW_MESSAGE;
    }

    @Override
    public boolean equals(Object o)
    {
        return o instanceof NewMessage other
                && id == other.id
                && user == other.user
                && cookie.equals(other.cookie)
                && timestamp.equals(other.timestamp)
                && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(cookie, id, user, timestamp) * 31 + Arrays.hashCode(body);
    }

    @Override
    public String toString()
    {
        return "NewMessage[cookie=" + cookie + ", id=" + id + ", user=" + user
                + ", timestamp=" + timestamp + ", body=" + body.length + " bytes]";
    }
}
