package eu.toolchain.timer;

/**
 * Opaque reference to a submitted task, used to cancel it.
 *
 * A task starts out pending and ends up either fired or cancelled, it never becomes pending again.
 */
public interface TaskHandle {
    /**
     * Absolute time in milliseconds since the epoch at which the task becomes eligible to run.
     */
    public long getDueAt();

    public boolean isPending();

    public boolean isCancelled();

    public boolean isFired();
}
