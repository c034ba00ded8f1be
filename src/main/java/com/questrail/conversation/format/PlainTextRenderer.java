package com.questrail.conversation.format;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.LongFunction;

/**
 * Renders a message as plain text, for notification mails and logs.
 *
 * <p>Paragraphs are separated by a blank line, formatting is dropped,
 * hyperlinks become {@code label <url>} (or {@code <url>} without a label) and
 * mentions become {@code @name}. Instances are single-use.</p>
 */
public final class PlainTextRenderer implements MessageRenderer<String>
{
    private final LongFunction<String> userNames;
    private final StringBuilder out = new StringBuilder();
    private boolean firstParagraph = true;

    /** Render mentions as {@code @<user id>}. */
    public PlainTextRenderer()
    {
        this(Long::toString);
    }

    public PlainTextRenderer(LongFunction<String> userNames)
    {
        this.userNames = Objects.requireNonNull(userNames, "userNames");
    }

    @Override
    public void beginParagraph()
    {
        if (!firstParagraph) {
            out.append("\n\n");
        }
        firstParagraph = false;
    }

    @Override
    public void endParagraph() {}

    @Override
    public void text(String text)
    {
        out.append(text);
    }

    @Override
    public void pushFormat(Set<FormatFlag> applied, Set<FormatFlag> current) {}

    @Override
    public void popFormat(Set<FormatFlag> removed, Set<FormatFlag> current) {}

    @Override
    public void hyperlink(Optional<String> label, String url)
    {
        label.ifPresent(l -> out.append(l).append(' '));
        out.append('<').append(url).append('>');
    }

    @Override
    public void mention(long user)
    {
        out.append('@').append(userNames.apply(user));
    }

    @Override
    public String finish()
    {
        return out.toString();
    }
}
