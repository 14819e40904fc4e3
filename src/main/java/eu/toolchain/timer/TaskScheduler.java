package eu.toolchain.timer;

public interface TaskScheduler {
    /**
     * Submit a task to run at the given absolute time.
     *
     * @param task Task to run, must not be null.
     * @param dueAt Milliseconds since the epoch, a time in the past means as soon as possible.
     * @return A handle which can be used to cancel the task.
     * @throws ManagerStoppedException If the scheduler no longer accepts tasks.
     */
    TaskHandle submit(final Task task, final long dueAt) throws ManagerStoppedException;

    /**
     * Submit a task to run after the given delay, in milliseconds.
     */
    TaskHandle schedule(final long delay, final Task task) throws ManagerStoppedException;

    /**
     * Cancel a pending task.
     *
     * @return true if the task was pending and will now never run, false if it already fired or was cancelled.
     */
    boolean cancel(final TaskHandle handle);

    long now();
}
