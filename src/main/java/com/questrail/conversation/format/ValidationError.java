package com.questrail.conversation.format;

/**
 * Classes of structural failure reported by {@link MessageValidator}.
 *
 * <p>All of these are recoverable from the connection's point of view: the
 * sender is told its message was invalid and the connection stays open.</p>
 */
public enum ValidationError
{
    /** A varint needs more than 64 bits. */
    LEB128_OVERFLOW,
    /** The input ends in the middle of a varint. */
    TRUNCATED,
    /** A frame (or hyperlink label) declares more bytes than remain. */
    FRAME_OVERFLOW,
    /** A fixed-size frame has the wrong size. */
    FRAME_LENGTH,
    /** A frame holds bytes after its last field. */
    FRAME_TOO_LONG,
    /** Frame type code outside the grammar. */
    UNKNOWN_FRAME,
    /** The outermost frame is not {@link FrameType#MESSAGE}. */
    BAD_ROOT,
    /** A frame appears inside a parent that does not allow it. */
    BAD_CHILD,
    /** Text is not valid UTF-8. */
    TEXT,
    /** A format bitset carries bits with no known meaning. */
    UNKNOWN_FORMAT,
    /** A hyperlink URL contains non-ASCII bytes. */
    NON_ASCII_URL,
    /** Bytes follow the root frame where a single message was expected. */
    TRAILING_BYTES
}
