package com.questrail.spooltag.bridge.internal.time;

/**
 * Cancellation handle for a scheduled task (request deadline, reconnect delay).
 */
public interface Cancellable
{
    /**
     * @return {@code true} if the task was cancelled before running;
     *         {@code false} if it already ran or was cancelled earlier
     */
    boolean cancel();
}
