package com.questrail.conversation.protocol.codec;

import java.util.Objects;

/**
 * Raised by {@link Leb128#read(java.nio.ByteBuffer)} when the input does not
 * hold a well-formed unsigned 64-bit varint.
 */
public final class Leb128Exception extends Exception
{
    public enum Kind {
        /** The value needs more than 64 bits. */
        OVERFLOW,
        /** The input ended before the final (non-continuation) byte. */
        TRUNCATED
    }

    private final Kind kind;

    public Leb128Exception(Kind kind)
    {
        super(kind == Kind.OVERFLOW
                ? "LEB128 value greater than 2^64 - 1"
                : "input ends in the middle of a LEB128 value");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind kind()
    {
        return kind;
    }
}
