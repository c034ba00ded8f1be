package com.questrail.conversation.format;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * MessageValidator
 * =============================================================================
 * Recursive-descent validator for user-submitted message bodies.
 *
 * <h2>Grammar</h2>
 * A body is a single {@link FrameType#MESSAGE} frame whose body is a sequence
 * of child frames, each laid out as {@code [varint type][varint length][body]}.
 * Children must appear in their parent's {@link FrameType#allowedChildren()};
 * leaves are checked according to their type:
 *
 * <ul>
 *   <li>{@code TEXT}: strict UTF-8</li>
 *   <li>{@code PUSH_FORMAT} / {@code POP_FORMAT}: exactly two bytes, known bits only</li>
 *   <li>{@code HYPERLINK}: UTF-8 label, ASCII url</li>
 *   <li>{@code MENTION}: one varint user id, collected into the result</li>
 * </ul>
 *
 * <h2>Side effects</h2>
 * None. A failed validation leaves no trace; nothing downstream (persistence,
 * listeners) may be touched until this returns successfully.
 *
 * <p>Instances are stateless and safe to share between threads.</p>
 */
public final class MessageValidator
{
    /**
     * Validate the first message in {@code message}.
     *
     * <p>Bytes following the root frame are returned in
     * {@link Validation#rest()} and are not themselves an error. Use
     * {@link #validateComplete(byte[])} when the input must hold exactly one
     * message.</p>
     *
     * @throws MessageValidationException if the root frame is not a
     *         well-formed message
     */
    public Validation validate(byte[] message) throws MessageValidationException
    {
        Objects.requireNonNull(message, "message");

        final ByteBuffer in = ByteBuffer.wrap(message);
        final FrameCursor.RawFrame root = FrameCursor.next(in);

        if (root.type() != FrameType.MESSAGE) {
            throw MessageValidationException.badRoot(root.type());
        }

        final List<Long> mentions = new ArrayList<>();
        validateChildren(root.type(), root.body(), mentions);

        final int consumed = in.position();
        return new Validation(
                mentions,
                Arrays.copyOfRange(message, 0, consumed),
                Arrays.copyOfRange(message, consumed, message.length));
    }

    /**
     * Validate {@code message} and require that it holds nothing but the root
     * frame.
     *
     * @throws MessageValidationException with
     *         {@link ValidationError#TRAILING_BYTES} if bytes follow the root
     *         frame, or any error {@link #validate(byte[])} reports
     */
    public Validation validateComplete(byte[] message) throws MessageValidationException
    {
        final Validation validation = validate(message);
        if (validation.hasRest()) {
            throw MessageValidationException.trailingBytes(validation.rest().length);
        }
        return validation;
    }

    private void validateChildren(FrameType parent, ByteBuffer body, List<Long> mentions)
            throws MessageValidationException
    {
        while (body.hasRemaining()) {
            final FrameCursor.RawFrame child = FrameCursor.next(body);

            if (!parent.canContain(child.type())) {
                throw MessageValidationException.badChild(parent, child.type());
            }

            switch (child.type()) {
                case PARAGRAPH -> validateChildren(child.type(), child.body(), mentions);
                case TEXT -> FrameCursor.readText(child.type(), child.body());
                case PUSH_FORMAT, POP_FORMAT -> FrameCursor.readFormat(child.type(), child.body());
                case HYPERLINK -> FrameCursor.readHyperlink(child.body());
                case MENTION -> mentions.add(FrameCursor.readMention(child.body()));
                // No frame may contain MESSAGE, so canContain() already rejected it.
                case MESSAGE -> throw new IllegalStateException("MESSAGE frame passed containment check");
            }
        }
    }
}
