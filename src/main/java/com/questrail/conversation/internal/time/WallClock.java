package com.questrail.conversation.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for observability timestamps only.
 *
 * <p>This clock may jump. It must not drive keep-alive or any other timing.</p>
 */
public interface WallClock
{
    Instant now();
}
