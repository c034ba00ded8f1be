package com.questrail.conversation.protocol.model;

import com.questrail.conversation.protocol.envelope.Cookie;
import com.questrail.conversation.protocol.envelope.MessageKind;

import java.util.Arrays;
import java.util.Objects;

/**
 * The client asks to add {@code body} to the conversation.
 *
 * <p>The body is not validated at this level; the broker checks it against
 * the message grammar before persisting it.</p>
 */
public record SendMessage(Cookie cookie, byte[] body) implements WireMessage
{
    public SendMessage
    {
        Objects.requireNonNull(cookie, "cookie");
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
        return MessageKind.SEND_MESSAGE;
    }

    @Override
    public boolean equals(Object o)
    {
        return o instanceof SendMessage other
                && cookie.equals(other.cookie)
                && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode()
    {
        return cookie.hashCode() * 31 + Arrays.hashCode(body);
    }

    @Override
    public String toString()
    {
        return "SendMessage[cookie=" + cookie + ", body=" + body.length + " bytes]";
    }
}
