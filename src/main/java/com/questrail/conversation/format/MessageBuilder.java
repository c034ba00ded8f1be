package com.questrail.conversation.format;

import com.questrail.conversation.protocol.codec.Leb128;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * MessageBuilder
 * -----------------------------------------------------------------------------
 * Writes well-formed message bodies.
 *
 * <p>The builder is the mechanical inverse of {@link MessageValidator}: every
 * body it produces validates. Inline content is only accepted inside an open
 * paragraph.</p>
 *
 * <pre>
 *   byte[] body = MessageBuilder.message()
 *           .paragraph()
 *               .text("hi ")
 *               .mention(5)
 *           .build();
 * </pre>
 */
public final class MessageBuilder
{
    private final ByteArrayOutputStream paragraphs = new ByteArrayOutputStream();
    private ByteArrayOutputStream paragraph;

    private MessageBuilder() {}

    public static MessageBuilder message()
    {
        return new MessageBuilder();
    }

    /** Close the current paragraph, if any, and open a new one. */
    public MessageBuilder paragraph()
    {
        closeParagraph();
        paragraph = new ByteArrayOutputStream();
        return this;
    }

    public MessageBuilder text(String text)
    {
        Objects.requireNonNull(text, "text");
        writeFrame(requireParagraph(), FrameType.TEXT, text.getBytes(StandardCharsets.UTF_8));
        return this;
    }

    public MessageBuilder pushFormat(FormatFlag first, FormatFlag... rest)
    {
        writeFrame(requireParagraph(), FrameType.PUSH_FORMAT, formatBytes(EnumSet.of(first, rest)));
        return this;
    }

    public MessageBuilder popFormat(FormatFlag first, FormatFlag... rest)
    {
        writeFrame(requireParagraph(), FrameType.POP_FORMAT, formatBytes(EnumSet.of(first, rest)));
        return this;
    }

    public MessageBuilder hyperlink(String label, String url)
    {
        Objects.requireNonNull(url, "url");
        for (int i = 0; i < url.length(); i++) {
            if (url.charAt(i) > 0x7F) {
                throw new IllegalArgumentException("url must be ASCII: " + url);
            }
        }

        byte[] labelBytes = label == null ? new byte[0] : label.getBytes(StandardCharsets.UTF_8);
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        body.writeBytes(Leb128.encode(labelBytes.length));
        body.writeBytes(labelBytes);
        body.writeBytes(url.getBytes(StandardCharsets.US_ASCII));

        writeFrame(requireParagraph(), FrameType.HYPERLINK, body.toByteArray());
        return this;
    }

    public MessageBuilder mention(long user)
    {
        writeFrame(requireParagraph(), FrameType.MENTION, Leb128.encode(user));
        return this;
    }

    public byte[] build()
    {
        closeParagraph();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeFrame(out, FrameType.MESSAGE, paragraphs.toByteArray());
        return out.toByteArray();
    }

    /**
     * Write a single frame with an arbitrary body. Exposed for tools that need
     * to produce frames the builder's fluent API does not cover.
     */
    public static byte[] frame(int typeCode, byte[] body)
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(Leb128.encode(typeCode));
        out.writeBytes(Leb128.encode(body.length));
        out.writeBytes(body);
        return out.toByteArray();
    }

    private ByteArrayOutputStream requireParagraph()
    {
        if (paragraph == null) {
            throw new IllegalStateException("inline content must be inside a paragraph");
        }
        return paragraph;
    }

    private void closeParagraph()
    {
        if (paragraph != null) {
            writeFrame(paragraphs, FrameType.PARAGRAPH, paragraph.toByteArray());
            paragraph = null;
        }
    }

    private static void writeFrame(ByteArrayOutputStream out, FrameType type, byte[] body)
    {
        out.writeBytes(frame(type.code(), body));
    }

    private static byte[] formatBytes(Set<FormatFlag> flags)
    {
        int bits = FormatFlag.toBits(flags);
        return new byte[] { (byte) bits, (byte) (bits >>> 8) };
    }
}
