package com.questrail.conversation.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for keep-alive cadence and any other elapsed-time logic.
 *
 * <p>Wall-clock time ({@link WallClock}) is only used for timestamps in
 * observability events. Message timestamps come from the message store.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Values are
     * only meaningful relative to each other.
     */
    long nowNanos();
}
