package com.questrail.conversation.format;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MessageBuilderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link MessageBuilder}.
 */
final class MessageBuilderTest
{
    private final MessageValidator validator = new MessageValidator();

    @Test
    void minimalMessageHasExpectedBytes()
    {
        byte[] body = MessageBuilder.message().paragraph().text("hi").build();

        // MESSAGE(6) { PARAGRAPH(4) { TEXT(2) "hi" } }
        assertArrayEquals(new byte[] { 0x00, 0x06, 0x01, 0x04, 0x02, 0x02, 'h', 'i' }, body);
    }

    @Test
    void builtMessagesValidate() throws Exception
    {
        byte[] body = MessageBuilder.message()
                .paragraph()
                    .text("see ")
                    .hyperlink("docs", "https://example.com/docs")
                    .pushFormat(FormatFlag.STRONG)
                    .text(" now")
                    .popFormat(FormatFlag.STRONG)
                .paragraph()
                    .mention(12)
                    .hyperlink(null, "https://example.com")
                .build();

        Validation validation = validator.validateComplete(body);

        assertEquals(List.of(12L), validation.mentions());
    }

    @Test
    void inlineContentOutsideParagraphFails()
    {
        MessageBuilder builder = MessageBuilder.message();

        assertThrows(IllegalStateException.class, () -> builder.text("loose"));
    }

    @Test
    void nonAsciiUrlFails()
    {
        MessageBuilder builder = MessageBuilder.message().paragraph();

        assertThrows(IllegalArgumentException.class, () -> builder.hyperlink("x", "https://ü.example"));
    }
}
