package com.questrail.conversation.format;

import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;

/**
 * Walks a message body and drives a {@link MessageRenderer}.
 *
 * <p>The walk applies the same structural rules as {@link MessageValidator},
 * so rendering an invalid body fails with the same
 * {@link MessageValidationException}. Renderer callbacks already issued before
 * the failure are not rolled back. Trailing bytes after the root frame are
 * ignored.</p>
 */
public final class MessageRendering
{
    private MessageRendering() {}

    public static <R> R render(byte[] message, MessageRenderer<R> renderer)
            throws MessageValidationException
    {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(renderer, "renderer");

        final FrameCursor.RawFrame root = FrameCursor.next(ByteBuffer.wrap(message));
        if (root.type() != FrameType.MESSAGE) {
            throw MessageValidationException.badRoot(root.type());
        }

        final ByteBuffer blocks = root.body();
        while (blocks.hasRemaining()) {
            final FrameCursor.RawFrame block = FrameCursor.next(blocks);
            if (!FrameType.MESSAGE.canContain(block.type())) {
                throw MessageValidationException.badChild(FrameType.MESSAGE, block.type());
            }
            renderParagraph(block.body(), renderer);
        }

        return renderer.finish();
    }

    private static void renderParagraph(ByteBuffer body, MessageRenderer<?> renderer)
            throws MessageValidationException
    {
        renderer.beginParagraph();

        // Formatting is scoped to the paragraph.
        final EnumSet<FormatFlag> format = EnumSet.noneOf(FormatFlag.class);

        while (body.hasRemaining()) {
            final FrameCursor.RawFrame inline = FrameCursor.next(body);
            if (!FrameType.PARAGRAPH.canContain(inline.type())) {
                throw MessageValidationException.badChild(FrameType.PARAGRAPH, inline.type());
            }

            switch (inline.type()) {
                case TEXT -> renderer.text(FrameCursor.readText(inline.type(), inline.body()));
                case PUSH_FORMAT -> {
                    EnumSet<FormatFlag> applied = FormatFlag.fromBits(
                            FrameCursor.readFormat(inline.type(), inline.body()));
                    if (!format.containsAll(applied)) {
                        format.addAll(applied);
                        renderer.pushFormat(Collections.unmodifiableSet(applied),
                                Collections.unmodifiableSet(EnumSet.copyOf(format)));
                    }
                }
                case POP_FORMAT -> {
                    EnumSet<FormatFlag> removed = FormatFlag.fromBits(
                            FrameCursor.readFormat(inline.type(), inline.body()));
                    removed.retainAll(format);
                    if (!removed.isEmpty()) {
                        format.removeAll(removed);
                        renderer.popFormat(Collections.unmodifiableSet(removed),
                                Collections.unmodifiableSet(EnumSet.copyOf(format)));
                    }
                }
                case HYPERLINK -> {
                    FrameCursor.Hyperlink link = FrameCursor.readHyperlink(inline.body());
                    renderer.hyperlink(link.label(), link.url());
                }
                case MENTION -> renderer.mention(FrameCursor.readMention(inline.body()));
                default -> throw new IllegalStateException(inline.type() + " passed paragraph containment check");
            }
        }

        renderer.endParagraph();
    }
}
