package com.questrail.conversation.protocol.codec;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Leb128
 * -----------------------------------------------------------------------------
 * Unsigned LEB128 ("varint") codec shared by the message-body grammar and the
 * wire envelope.
 *
 * <p>Values are written as little-endian groups of 7 bits. Every byte except
 * the last carries the continuation bit {@code 0x80}. Java has no unsigned
 * 64-bit type, so values are carried in a {@code long} and interpreted as
 * unsigned (use {@link Long#toUnsignedString(long)} for display).</p>
 *
 * <p>Decoding is strict: a value needing more than 64 bits fails with
 * {@link Leb128Exception.Kind#OVERFLOW} and a buffer that ends inside a value
 * fails with {@link Leb128Exception.Kind#TRUNCATED}. On failure the buffer
 * position is left wherever decoding stopped; callers treat the buffer as
 * unusable.</p>
 */
public final class Leb128
{
    /** Largest number of bytes an unsigned 64-bit value can occupy. */
    public static final int MAX_LENGTH = 10;

    private static final int CONTINUATION = 0x80;
    private static final int PAYLOAD_MASK = 0x7F;

    private Leb128() {}

    /**
     * Read one unsigned value from the current position of {@code buffer}.
     *
     * @throws Leb128Exception if the value overflows 64 bits or the buffer ends
     *         before the final byte
     */
    public static long read(ByteBuffer buffer) throws Leb128Exception
    {
        Objects.requireNonNull(buffer, "buffer");

        long value = 0;
        int shift = 0;

        while (true) {
            if (!buffer.hasRemaining()) {
                throw new Leb128Exception(Leb128Exception.Kind.TRUNCATED);
            }

            final int b = buffer.get() & 0xFF;
            final long group = b & PAYLOAD_MASK;

            // Bit 63 is the last one we can hold: at shift 63 only the lowest
            // payload bit may be set, and nothing may follow it.
            if (shift > 63 || (shift == 63 && group > 1)) {
                throw new Leb128Exception(Leb128Exception.Kind.OVERFLOW);
            }

            value |= group << shift;

            if ((b & CONTINUATION) == 0) {
                return value;
            }
            shift += 7;
        }
    }

    /**
     * Write {@code value} (interpreted as unsigned) at the current position of
     * {@code buffer}.
     *
     * @throws java.nio.BufferOverflowException if fewer than
     *         {@link #encodedLength(long)} bytes remain
     */
    public static void write(ByteBuffer buffer, long value)
    {
        Objects.requireNonNull(buffer, "buffer");

        long v = value;
        while (Long.compareUnsigned(v, CONTINUATION) >= 0) {
            buffer.put((byte) ((v & PAYLOAD_MASK) | CONTINUATION));
            v >>>= 7;
        }
        buffer.put((byte) v);
    }

    /**
     * Encode {@code value} into a freshly allocated array of exactly
     * {@link #encodedLength(long)} bytes.
     */
    public static byte[] encode(long value)
    {
        final ByteBuffer buffer = ByteBuffer.allocate(encodedLength(value));
        write(buffer, value);
        return buffer.array();
    }

    /**
     * Number of bytes {@link #write(ByteBuffer, long)} produces for
     * {@code value}.
     */
    public static int encodedLength(long value)
    {
        int length = 1;
        long v = value >>> 7;
        while (v != 0) {
            length++;
            v >>>= 7;
        }
        return length;
    }
}
