package com.questrail.conversation.format;

import java.util.Objects;
import java.util.Optional;

/**
 * Indicates that a candidate message body does not conform to the frame
 * grammar.
 *
 * <p>The exception message is suitable for reporting back to the sender; it
 * never contains message content, only structural facts.</p>
 */
public final class MessageValidationException extends Exception
{
    private final ValidationError error;
    private final FrameType frame;
    private final FrameType child;

    private MessageValidationException(ValidationError error,
                                       FrameType frame,
                                       FrameType child,
                                       String message,
                                       Throwable cause)
    {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error");
        this.frame = frame;
        this.child = child;
    }

    public ValidationError error()
    {
        return error;
    }

    /**
     * The frame the failure was detected in: the offending frame for size and
     * content errors, the parent for {@link ValidationError#BAD_CHILD}.
     */
    public Optional<FrameType> frame()
    {
        return Optional.ofNullable(frame);
    }

    /** The disallowed child, for {@link ValidationError#BAD_CHILD} only. */
    public Optional<FrameType> child()
    {
        return Optional.ofNullable(child);
    }

    static MessageValidationException leb128Overflow()
    {
        return of(ValidationError.LEB128_OVERFLOW, null, null,
                "message contains a LEB128 value greater than 2^64 - 1");
    }

    static MessageValidationException truncated()
    {
        return of(ValidationError.TRUNCATED, null, null,
                "message ends in the middle of a value");
    }

    static MessageValidationException frameOverflow(FrameType frame, long declared, int available)
    {
        return of(ValidationError.FRAME_OVERFLOW, frame, null,
                "frame " + frame + " declares length " + Long.toUnsignedString(declared)
                        + " greater than message length " + available);
    }

    static MessageValidationException frameLength(FrameType frame, int expected, int actual)
    {
        return of(ValidationError.FRAME_LENGTH, frame, null,
                "expected frame type " + frame + " to have " + expected
                        + " bytes, but found " + actual);
    }

    static MessageValidationException frameTooLong(FrameType frame, int extra)
    {
        return of(ValidationError.FRAME_TOO_LONG, frame, null,
                "frame " + frame + " contains " + extra + " extra bytes");
    }

    static MessageValidationException unknownFrame(long code)
    {
        return of(ValidationError.UNKNOWN_FRAME, null, null,
                "message contains unknown frame " + Long.toUnsignedString(code));
    }

    static MessageValidationException badRoot(FrameType root)
    {
        return of(ValidationError.BAD_ROOT, root, null,
                root + " is not a valid root frame");
    }

    static MessageValidationException badChild(FrameType parent, FrameType child)
    {
        return of(ValidationError.BAD_CHILD, parent, child,
                "frame " + parent + " cannot contain frame " + child);
    }

    static MessageValidationException text(FrameType frame, Throwable cause)
    {
        return new MessageValidationException(ValidationError.TEXT, frame, null,
                "frame " + frame + " contains invalid UTF-8", cause);
    }

    static MessageValidationException unknownFormat(int bits)
    {
        return of(ValidationError.UNKNOWN_FORMAT, null, null,
                "message contains unknown formatting " + bits);
    }

    static MessageValidationException nonAsciiUrl()
    {
        return of(ValidationError.NON_ASCII_URL, FrameType.HYPERLINK, null,
                "message contains a non-ASCII URL");
    }

    static MessageValidationException trailingBytes(int count)
    {
        return of(ValidationError.TRAILING_BYTES, FrameType.MESSAGE, null,
                "message is followed by " + count + " unexpected bytes");
    }

    private static MessageValidationException of(ValidationError error,
                                                 FrameType frame,
                                                 FrameType child,
                                                 String message)
    {
        return new MessageValidationException(error, frame, child, message, null);
    }
}
