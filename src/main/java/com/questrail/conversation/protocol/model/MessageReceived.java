package com.questrail.conversation.protocol.model;

import com.questrail.conversation.protocol.envelope.Cookie;
import com.questrail.conversation.protocol.envelope.MessageKind;

import java.util.Objects;

/**
 * Reply to {@link SendMessage}: the message was persisted as event {@code id}.
 */
public record MessageReceived(Cookie cookie, long id) implements WireMessage
{
    public MessageReceived
    {
        Objects.requireNonNull(cookie, "cookie");
    }

    @Override
    public MessageKind kind()
    {
        return MessageKind.MESSAGE_RECEIVED;
    }
}
