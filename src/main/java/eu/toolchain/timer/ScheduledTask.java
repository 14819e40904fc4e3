package eu.toolchain.timer;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import eu.toolchain.async.ResolvableFuture;

/**
 * A task living in the queue of a {@link TaskManager}.
 *
 * The future tracks the state of the task, resolved means fired and cancelled means cancelled. State transitions are
 * only performed while holding the lock of the owning manager.
 */
@RequiredArgsConstructor
@ToString(of = { "dueAt" })
class ScheduledTask implements TaskHandle {
    private static final Comparator comparator = new Comparator();

    public static Comparator comparator() {
        return comparator;
    }

    @Getter(AccessLevel.PACKAGE)
    private final TaskManager manager;
    @Getter
    private final long dueAt;
    private final Task task;
    private final ResolvableFuture<Void> future;

    /**
     * Move the task into the fired state.
     *
     * @return false if the task was cancelled before it could fire.
     */
    boolean fire() {
        return future.resolve(null);
    }

    boolean cancel() {
        return future.cancel();
    }

    void run() throws Exception {
        task.run();
    }

    @Override
    public boolean isPending() {
        return !future.isDone();
    }

    @Override
    public boolean isCancelled() {
        return future.isCancelled();
    }

    @Override
    public boolean isFired() {
        return future.isDone() && !future.isCancelled();
    }

    public static final class Comparator implements java.util.Comparator<ScheduledTask> {
        private Comparator() {
        }

        @Override
        public int compare(final ScheduledTask o1, final ScheduledTask o2) {
            return Long.compare(o1.dueAt, o2.dueAt);
        }
    }
}
