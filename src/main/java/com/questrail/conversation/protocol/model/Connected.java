package com.questrail.conversation.protocol.model;

import com.questrail.conversation.protocol.envelope.Cookie;
import com.questrail.conversation.protocol.envelope.MessageKind;

import java.util.Objects;

/**
 * The server accepted the connection and joined it to its conversation.
 */
public record Connected(Cookie cookie) implements WireMessage
{
    public Connected
    {
        Objects.requireNonNull(cookie, "cookie");
    }

    @Override
    public MessageKind kind()
    {
        return MessageKind.CONNECTED;
    }
}
