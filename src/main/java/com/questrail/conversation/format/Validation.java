package com.questrail.conversation.format;

import java.util.List;

/**
 * Validation
 * -----------------------------------------------------------------------------
 * Immutable result of a successful {@link MessageValidator} run.
 *
 * <ul>
 *   <li>{@link #mentions()}: user ids of every {@link FrameType#MENTION}
 *       frame, in encounter order, duplicates preserved</li>
 *   <li>{@link #body()}: exactly the bytes consumed by the root frame</li>
 *   <li>{@link #rest()}: whatever followed the root frame in the input</li>
 * </ul>
 *
 * Byte arrays are defensively copied in both directions.
 */
public final class Validation
{
    private final List<Long> mentions;
    private final byte[] body;
    private final byte[] rest;

    public Validation(List<Long> mentions, byte[] body, byte[] rest)
    {
        this.mentions = List.copyOf(mentions);
        this.body = body.clone();
        this.rest = rest.clone();
    }

    public List<Long> mentions()
    {
        return mentions;
    }

    public byte[] body()
    {
        return body.clone();
    }

    public byte[] rest()
    {
        return rest.clone();
    }

    public boolean hasRest()
    {
        return rest.length != 0;
    }

    @Override
    public String toString()
    {
        return "Validation[" +
                "mentions=" + mentions +
                ", bodyLength=" + body.length +
                ", restLength=" + rest.length +
                ']';
    }
}
