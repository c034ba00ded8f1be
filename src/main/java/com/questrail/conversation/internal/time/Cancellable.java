package com.questrail.conversation.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a scheduled task, such as a session's pending
 * keep-alive ping.
 *
 * <p>Implemented by the production {@link ScheduledExecutorScheduler} and by
 * the deterministic scheduler the tests use.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if the task will not run; {@code false} if it
     *         already ran or was cancelled before
     */
    boolean cancel();
}
