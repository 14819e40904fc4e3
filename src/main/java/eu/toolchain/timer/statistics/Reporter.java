package eu.toolchain.timer.statistics;

import eu.toolchain.timer.TaskHandle;

public interface Reporter {
    void reportFired(TaskHandle task);

    void reportFailed(TaskHandle task, Throwable cause);

    /**
     * A cancelled task reached the head of the queue and was thrown away.
     */
    void reportDiscarded(TaskHandle task);

    /**
     * A task was submitted ahead of the one currently being waited for.
     */
    void reportPreempted(TaskHandle task);

    void reportExpired(String key);

    /**
     * The expiration of a key could not be cancelled since it was already running.
     */
    void reportCancelMissed(String key);

    void reportRescheduleFailed(String key, Throwable cause);
}
