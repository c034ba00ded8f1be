package com.questrail.conversation.format;

import java.util.Optional;
import java.util.Set;

/**
 * Callback target for {@link MessageRendering#render(byte[], MessageRenderer)}.
 *
 * <p>Calls arrive in document order. Format callbacks receive the flags of
 * the frame together with the effective set after it. A push whose flags are
 * all active already, or a pop whose flags are all inactive, produces no
 * callback.</p>
 *
 * @param <R> type of the finished rendering
 */
public interface MessageRenderer<R>
{
    void beginParagraph();

    void endParagraph();

    void text(String text);

    /**
     * @param applied every flag the push frame carries, including any that
     *                were already active
     * @param current effective formatting after applying them
     */
    void pushFormat(Set<FormatFlag> applied, Set<FormatFlag> current);

    /**
     * @param removed flags of the pop frame that were active and no longer
     *                apply to subsequent text
     * @param current effective formatting after removing them
     */
    void popFormat(Set<FormatFlag> removed, Set<FormatFlag> current);

    void hyperlink(Optional<String> label, String url);

    void mention(long user);

    R finish();
}
