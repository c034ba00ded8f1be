package com.questrail.conversation.format;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PlainTextRendererTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link MessageRendering} and {@link PlainTextRenderer}.
 */
final class PlainTextRendererTest
{
    @Test
    void rendersParagraphsLinksAndMentions() throws Exception
    {
        byte[] body = MessageBuilder.message()
                .paragraph()
                    .text("hello ")
                    .mention(7)
                .paragraph()
                    .pushFormat(FormatFlag.EMPHASIS)
                    .text("read ")
                    .popFormat(FormatFlag.EMPHASIS)
                    .hyperlink("this", "https://example.com")
                    .text(" or ")
                    .hyperlink(null, "https://example.org")
                .build();

        String text = MessageRendering.render(body, new PlainTextRenderer(user -> user == 7 ? "alice" : "?"));

        assertEquals("hello @alice\n\nread this <https://example.com> or <https://example.org>", text);
    }

    @Test
    void defaultRendererUsesUserIds() throws Exception
    {
        byte[] body = MessageBuilder.message().paragraph().mention(42).build();

        assertEquals("@42", MessageRendering.render(body, new PlainTextRenderer()));
    }

    @Test
    void redundantFormatChangesAreNotReported() throws Exception
    {
        byte[] body = MessageBuilder.message()
                .paragraph()
                    .pushFormat(FormatFlag.STRONG)
                    .pushFormat(FormatFlag.STRONG)
                    .popFormat(FormatFlag.EMPHASIS)
                    .pushFormat(FormatFlag.EMPHASIS)
                    .popFormat(FormatFlag.EMPHASIS)
                    .popFormat(FormatFlag.EMPHASIS)
                .build();

        List<String> calls = MessageRendering.render(body, new RecordingRenderer());

        assertEquals(List.of(
                "begin",
                "push [STRONG] -> [STRONG]",
                "push [EMPHASIS] -> [EMPHASIS, STRONG]",
                "pop [EMPHASIS] -> [STRONG]",
                "end"), calls);
    }

    @Test
    void pushReportsEveryFlagOfTheFrame() throws Exception
    {
        byte[] body = MessageBuilder.message()
                .paragraph()
                    .pushFormat(FormatFlag.STRONG)
                    .pushFormat(FormatFlag.STRONG, FormatFlag.EMPHASIS)
                    .popFormat(FormatFlag.STRONG, FormatFlag.EMPHASIS)
                .build();

        List<String> calls = MessageRendering.render(body, new RecordingRenderer());

        assertEquals(List.of(
                "begin",
                "push [STRONG] -> [STRONG]",
                "push [EMPHASIS, STRONG] -> [EMPHASIS, STRONG]",
                "pop [EMPHASIS, STRONG] -> []",
                "end"), calls);
    }

    @Test
    void formattingDoesNotLeakAcrossParagraphs() throws Exception
    {
        byte[] body = MessageBuilder.message()
                .paragraph()
                    .pushFormat(FormatFlag.STRONG)
                .paragraph()
                    .popFormat(FormatFlag.STRONG)
                .build();

        List<String> calls = MessageRendering.render(body, new RecordingRenderer());

        assertEquals(List.of("begin", "push [STRONG] -> [STRONG]", "end", "begin", "end"), calls);
    }

    @Test
    void invalidBodyFailsLikeValidation()
    {
        byte[] body = MessageBuilder.frame(FrameType.MESSAGE.code(),
                MessageBuilder.frame(FrameType.TEXT.code(), new byte[] { 'x' }));

        MessageValidationException ex = assertThrows(MessageValidationException.class,
                () -> MessageRendering.render(body, new PlainTextRenderer()));
        assertEquals(ValidationError.BAD_CHILD, ex.error());
    }

    private static final class RecordingRenderer implements MessageRenderer<List<String>>
    {
        private final List<String> calls = new ArrayList<>();

        @Override
        public void beginParagraph() { calls.add("begin"); }

        @Override
        public void endParagraph() { calls.add("end"); }

        @Override
        public void text(String text) {}

        @Override
        public void pushFormat(Set<FormatFlag> applied, Set<FormatFlag> current)
        {
            calls.add("push " + applied + " -> " + current);
        }

        @Override
        public void popFormat(Set<FormatFlag> removed, Set<FormatFlag> current)
        {
            calls.add("pop " + removed + " -> " + current);
        }

        @Override
        public void hyperlink(Optional<String> label, String url) {}

        @Override
        public void mention(long user) {}

        @Override
        public List<String> finish() { return calls; }
    }
}
