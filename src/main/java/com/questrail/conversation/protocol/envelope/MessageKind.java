package com.questrail.conversation.protocol.envelope;

import java.util.Optional;

/**
 * Envelope kinds understood by this implementation.
 *
 * <p>Bit 15 of the code separates events (clear) from responses (set). Codes
 * that do not appear here are legal on the wire; how a receiver treats them
 * depends on {@link EnvelopeFlag#MUST_PROCESS}.</p>
 */
public enum MessageKind
{
    /** Sent once to a client after it joined its conversation. */
    CONNECTED(0x0000),
    /** A message was added to the conversation. */
    NEW_MESSAGE(0x0001),
    /** The client asks to add a message to the conversation. */
    SEND_MESSAGE(0x0002),
    /** Reply to an envelope whose kind the receiver does not understand. */
    UNKNOWN_EVENT(0x8000),
    /** Reply to {@link #SEND_MESSAGE}: the message was persisted. */
    MESSAGE_RECEIVED(0x8001),
    /** Reply to {@link #SEND_MESSAGE}: the body was rejected. */
    MESSAGE_INVALID(0x8002);

    private static final int RESPONSE_BIT = 0x8000;

    private final int code;

    MessageKind(int code)
    {
        this.code = code;
    }

    public int code()
    {
        return code;
    }

    public boolean isEvent()
    {
        return (code & RESPONSE_BIT) == 0;
    }

    public boolean isResponse()
    {
        return (code & RESPONSE_BIT) != 0;
    }

    public static Optional<MessageKind> fromCode(int code)
    {
        for (MessageKind kind : values()) {
            if (kind.code == code) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
