package com.questrail.conversation.internal.time;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a
 * {@link ScheduledExecutorService}.
 *
 * <p>Monotonic deadlines are converted into relative delays with the given
 * {@link MonotonicClock} at scheduling time, so callers must compute their
 * deadlines with the same clock (normally {@link SystemMonotonicClock#INSTANCE}).
 * A deadline in the past runs the task immediately.</p>
 *
 * <p>The executor is not owned by this class. Once it has been shut down,
 * scheduling returns an already-cancelled handle instead of throwing, so that
 * sessions stopping during server shutdown do not fail.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private static final Cancellable REJECTED = () -> false;

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());

        final ScheduledFuture<?> future;
        try {
            future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            if (executor.isShutdown()) {
                return REJECTED;
            }
            throw e;
        }

        return () -> future.cancel(false);
    }
}
