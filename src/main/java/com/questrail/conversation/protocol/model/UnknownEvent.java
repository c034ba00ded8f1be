package com.questrail.conversation.protocol.model;

import com.questrail.conversation.protocol.envelope.Cookie;
import com.questrail.conversation.protocol.envelope.MessageKind;

import java.util.Objects;

/**
 * The sender did not understand the envelope carrying {@code cookie}.
 */
public record UnknownEvent(Cookie cookie) implements WireMessage
{
    public UnknownEvent
    {
        Objects.requireNonNull(cookie, "cookie");
    }

    @Override
    public MessageKind kind()
    {
        return MessageKind.UNKNOWN_EVENT;
    }
}
