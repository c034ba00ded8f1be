package com.questrail.conversation.protocol.model;

import com.questrail.conversation.protocol.envelope.Cookie;
import com.questrail.conversation.protocol.envelope.MessageKind;

import java.util.Objects;
import java.util.Optional;

/**
 * Reply to {@link SendMessage}: the body was not accepted.
 *
 * @param diagnostic human-readable reason, if the server gave one
 */
public record MessageInvalid(Cookie cookie, Optional<String> diagnostic) implements WireMessage
{
    public MessageInvalid
    {
        Objects.requireNonNull(cookie, "cookie");
        Objects.requireNonNull(diagnostic, "diagnostic");
    }

    public static MessageInvalid of(Cookie cookie, String diagnostic)
    {
        return new MessageInvalid(cookie, Optional.of(diagnostic));
    }

    @Override
    public MessageKind kind()
    {
        return MessageKind.MESSAGE_INVALID;
    }
}
