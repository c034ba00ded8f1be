package com.questrail.conversation.protocol.model;

import com.questrail.conversation.protocol.envelope.Cookie;
import com.questrail.conversation.protocol.envelope.MessageKind;

/**
 * Semantic form of an envelope of a known {@link MessageKind}.
 *
 * <p>Sessions and client tooling reason about {@code WireMessage}s; byte
 * layout, flag bits and kind codes stay below this line, in the codec and in
 * {@code internal.decode} / {@code internal.encode}.</p>
 */
public sealed interface WireMessage
        permits Connected, NewMessage, SendMessage, UnknownEvent, MessageReceived, MessageInvalid
{
    Cookie cookie();

    MessageKind kind();
}
