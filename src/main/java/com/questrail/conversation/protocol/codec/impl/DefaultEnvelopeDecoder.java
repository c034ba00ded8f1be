package com.questrail.conversation.protocol.codec.impl;

import com.questrail.conversation.protocol.codec.EnvelopeDecoder;
import com.questrail.conversation.protocol.codec.Leb128;
import com.questrail.conversation.protocol.codec.Leb128Exception;
import com.questrail.conversation.protocol.envelope.Cookie;
import com.questrail.conversation.protocol.envelope.Envelope;
import com.questrail.conversation.protocol.envelope.EnvelopeFlag;
import com.questrail.conversation.protocol.envelope.EnvelopeParseException;
import com.questrail.conversation.protocol.envelope.EnvelopeParseException.Reason;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * DefaultEnvelopeDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link EnvelopeDecoder}.
 *
 * <p>Checks are applied in this order, and the first failure wins:</p>
 * <ol>
 *   <li>Fixed header present ({@link Reason#UNDERFLOW})</li>
 *   <li>Flags known ({@link Reason#BAD_FLAGS})</li>
 *   <li>Length varint complete ({@link Reason#UNDERFLOW})</li>
 *   <li>Declared length equals the remaining bytes ({@link Reason#LENGTH_MISMATCH})</li>
 * </ol>
 */
public final class DefaultEnvelopeDecoder implements EnvelopeDecoder
{
    @Override
    public Envelope decode(byte[] message) throws EnvelopeParseException
    {
        Objects.requireNonNull(message, "message");

        if (message.length < EnvelopeLayout.FIXED_HEADER_LENGTH) {
            throw new EnvelopeParseException(Reason.UNDERFLOW,
                    "envelope header needs " + EnvelopeLayout.FIXED_HEADER_LENGTH
                            + " bytes, got " + message.length);
        }

        final ByteBuffer in = ByteBuffer.wrap(message).order(ByteOrder.LITTLE_ENDIAN);

        final long cookie = in.getLong(EnvelopeLayout.COOKIE_OFFSET);
        final int kind = Short.toUnsignedInt(in.getShort(EnvelopeLayout.KIND_OFFSET));
        final int flags = Short.toUnsignedInt(in.getShort(EnvelopeLayout.FLAGS_OFFSET));

        if ((flags & ~EnvelopeFlag.KNOWN_BITS) != 0) {
            throw new EnvelopeParseException(Reason.BAD_FLAGS,
                    "unknown envelope flags 0x" + Integer.toHexString(flags & ~EnvelopeFlag.KNOWN_BITS));
        }

        in.position(EnvelopeLayout.FIXED_HEADER_LENGTH);

        final long declared;
        try {
            declared = Leb128.read(in);
        }
        catch (Leb128Exception e) {
            // An overlong varint is as broken as a missing one.
            throw new EnvelopeParseException(Reason.UNDERFLOW, "envelope payload length: " + e.getMessage());
        }

        if (declared != in.remaining()) {
            throw new EnvelopeParseException(Reason.LENGTH_MISMATCH,
                    "envelope declares " + Long.toUnsignedString(declared)
                            + " payload bytes, " + in.remaining() + " present");
        }

        final byte[] payload = new byte[in.remaining()];
        in.get(payload);

        return new Envelope(new Cookie(cookie), kind, EnvelopeFlag.fromBits(flags), payload);
    }
}
