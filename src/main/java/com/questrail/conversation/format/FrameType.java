package com.questrail.conversation.format;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Frame types of the message-body grammar.
 *
 * <p>A message body is a tree of frames laid out as
 * {@code [varint type][varint length][length bytes of body]}. Each container
 * frame declares which frame types may appear directly inside it; leaves
 * contain no frames at all.</p>
 *
 * <pre>
 *   MESSAGE    → PARAGRAPH
 *   PARAGRAPH  → TEXT, PUSH_FORMAT, POP_FORMAT, HYPERLINK, MENTION
 * </pre>
 */
public enum FrameType
{
    MESSAGE(0),
    PARAGRAPH(1),
    /** UTF-8 text. */
    TEXT(2),
    /** Two-byte little-endian {@link FormatFlag} bitset. */
    PUSH_FORMAT(3),
    /** Two-byte little-endian {@link FormatFlag} bitset. */
    POP_FORMAT(4),
    /** {@code [varint label length][label][ASCII url]}. */
    HYPERLINK(5),
    /** A single varint user id. */
    MENTION(6);

    private static final FrameType[] BY_CODE = values();

    private final int code;

    FrameType(int code)
    {
        this.code = code;
    }

    /** Code of this frame type on the wire. */
    public int code()
    {
        return code;
    }

    /** Frame types legal as direct children of this one. */
    public Set<FrameType> allowedChildren()
    {
        return switch (this) {
            case MESSAGE -> BLOCK_CONTEXT;
            case PARAGRAPH -> LINE_CONTEXT;
            default -> Collections.emptySet();
        };
    }

    public boolean canContain(FrameType child)
    {
        return allowedChildren().contains(child);
    }

    /**
     * Look up a frame type by wire code. Codes are unsigned varints, so any
     * value outside the table (including "negative" ones) is unknown.
     */
    public static Optional<FrameType> fromCode(long code)
    {
        if (code < 0 || code >= BY_CODE.length) {
            return Optional.empty();
        }
        return Optional.of(BY_CODE[(int) code]);
    }

    private static final Set<FrameType> BLOCK_CONTEXT =
            Collections.unmodifiableSet(EnumSet.of(PARAGRAPH));

    private static final Set<FrameType> LINE_CONTEXT =
            Collections.unmodifiableSet(EnumSet.of(TEXT, PUSH_FORMAT, POP_FORMAT, HYPERLINK, MENTION));
}
