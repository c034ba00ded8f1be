package com.questrail.conversation.internal.time;

/**
 * Production {@link MonotonicClock} backed by {@link System#nanoTime()}.
 * Tests use a manually advanced clock instead.
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
