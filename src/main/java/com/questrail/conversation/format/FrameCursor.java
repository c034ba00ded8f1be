package com.questrail.conversation.format;

import com.questrail.conversation.protocol.codec.Leb128;
import com.questrail.conversation.protocol.codec.Leb128Exception;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * FrameCursor
 * -----------------------------------------------------------------------------
 * Byte-level primitives of the message-body grammar, shared by
 * {@link MessageValidator} and {@link MessageRendering}.
 *
 * <p>Every method consumes from the supplied buffer and reports structural
 * problems as {@link MessageValidationException}. Nothing here knows which
 * frames may nest inside which; that is the caller's job.</p>
 */
final class FrameCursor
{
    /** One frame header plus a view of its body. The body shares the input bytes. */
    record RawFrame(FrameType type, ByteBuffer body) {}

    /** A decoded hyperlink; an empty label is reported as absent. */
    record Hyperlink(Optional<String> label, String url) {}

    private FrameCursor() {}

    /**
     * Read {@code [varint type][varint length]} and slice off {@code length}
     * bytes of body, advancing {@code in} past the whole frame.
     */
    static RawFrame next(ByteBuffer in) throws MessageValidationException
    {
        final long code = readVarint(in);
        final FrameType type = FrameType.fromCode(code)
                .orElseThrow(() -> MessageValidationException.unknownFrame(code));

        final long size = readVarint(in);
        if (Long.compareUnsigned(size, in.remaining()) > 0) {
            throw MessageValidationException.frameOverflow(type, size, in.remaining());
        }

        final ByteBuffer body = in.slice(in.position(), (int) size);
        in.position(in.position() + (int) size);
        return new RawFrame(type, body);
    }

    static long readVarint(ByteBuffer in) throws MessageValidationException
    {
        try {
            return Leb128.read(in);
        }
        catch (Leb128Exception e) {
            throw e.kind() == Leb128Exception.Kind.OVERFLOW
                    ? MessageValidationException.leb128Overflow()
                    : MessageValidationException.truncated();
        }
    }

    /** Decode the rest of {@code body} as strict UTF-8. */
    static String readText(FrameType frame, ByteBuffer body) throws MessageValidationException
    {
        try {
            CharBuffer chars = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(body);
            return chars.toString();
        }
        catch (CharacterCodingException e) {
            throw MessageValidationException.text(frame, e);
        }
    }

    /**
     * Read a two-byte little-endian format bitset filling the whole body.
     *
     * @return the bitset, guaranteed to contain only known {@link FormatFlag} bits
     */
    static int readFormat(FrameType frame, ByteBuffer body) throws MessageValidationException
    {
        if (body.remaining() != 2) {
            throw MessageValidationException.frameLength(frame, 2, body.remaining());
        }

        final int bits = (body.get() & 0xFF) | ((body.get() & 0xFF) << 8);
        final int unknown = FormatFlag.unknownBits(bits);
        if (unknown != 0) {
            throw MessageValidationException.unknownFormat(unknown);
        }
        return bits;
    }

    static Hyperlink readHyperlink(ByteBuffer body) throws MessageValidationException
    {
        final long labelLength = readVarint(body);
        if (Long.compareUnsigned(labelLength, body.remaining()) > 0) {
            throw MessageValidationException.frameOverflow(FrameType.HYPERLINK, labelLength, body.remaining());
        }

        Optional<String> label = Optional.empty();
        if (labelLength != 0) {
            ByteBuffer labelBytes = body.slice(body.position(), (int) labelLength);
            body.position(body.position() + (int) labelLength);
            label = Optional.of(readText(FrameType.HYPERLINK, labelBytes));
        }

        final byte[] url = new byte[body.remaining()];
        body.get(url);
        for (byte b : url) {
            if ((b & 0x80) != 0) {
                throw MessageValidationException.nonAsciiUrl();
            }
        }

        return new Hyperlink(label, new String(url, StandardCharsets.US_ASCII));
    }

    /** Read a mention: exactly one varint user id. */
    static long readMention(ByteBuffer body) throws MessageValidationException
    {
        final long user = readVarint(body);
        if (body.hasRemaining()) {
            throw MessageValidationException.frameTooLong(FrameType.MENTION, body.remaining());
        }
        return user;
    }
}
