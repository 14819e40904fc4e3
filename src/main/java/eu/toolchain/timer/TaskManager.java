package eu.toolchain.timer;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import lombok.extern.slf4j.Slf4j;
import eu.toolchain.async.AsyncFramework;
import eu.toolchain.async.TinyAsync;
import eu.toolchain.timer.queue.BinaryHeapQueue;
import eu.toolchain.timer.queue.OrderedQueue;
import eu.toolchain.timer.statistics.NoopReporter;
import eu.toolchain.timer.statistics.Reporter;

/**
 * Runs submitted tasks at their due time on a single background thread.
 *
 * The background thread sleeps until the earliest task is due, then runs it. Submitting a task which is due earlier
 * than the one currently being waited for interrupts the sleep so that the wait can be recomputed.
 *
 * Cancellation is lazy, a cancelled task stays in the queue until it reaches the head, at which point it is thrown
 * away. Whether a task fires or is discarded is decided under the same lock as cancellation, so a task never runs
 * after a successful {@link #cancel(TaskHandle)}.
 */
@Slf4j
public class TaskManager implements TaskScheduler {
    public static final String DEFAULT_THREAD_NAME = "task-manager";
    public static final boolean DEFAULT_DAEMON = true;

    private static final Object WAKEUP = new Object();

    private final String name;
    private final Reporter reporter;
    private final AsyncFramework async;

    private final OrderedQueue<ScheduledTask> queue = new BinaryHeapQueue<>(ScheduledTask.comparator());

    private final ReentrantLock lock = new ReentrantLock();
    /* signalled when the head of the queue changes, or when the manager stops */
    private final Condition available = lock.newCondition();
    /* signalled when the queue is empty and no task is running */
    private final Condition drained = lock.newCondition();

    /* single slot used to abort a sleep in progress */
    private final BlockingQueue<Object> interrupt = new ArrayBlockingQueue<>(1);

    private final Thread thread;

    /* guarded by lock */
    private boolean stopped = false;
    private boolean running = false;

    private TaskManager(final String name, final boolean daemon, final Reporter reporter,
            final AsyncFramework async) {
        this.name = name;
        this.reporter = reporter;
        this.async = async;

        this.thread = new Thread(new Runnable() {
            @Override
            public void run() {
                watch();
            }
        }, name);

        this.thread.setDaemon(daemon);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create and start a manager with the default configuration.
     */
    public static TaskManager create() {
        return builder().build();
    }

    @Override
    public TaskHandle submit(final Task task, final long dueAt) throws ManagerStoppedException {
        if (task == null)
            throw new IllegalArgumentException("task must not be null");

        final ScheduledTask scheduled = new ScheduledTask(this, dueAt, task, async.<Void> future());

        lock.lock();

        try {
            if (stopped)
                throw new ManagerStoppedException(name + ": manager is stopped");

            final boolean wasEmpty = queue.isEmpty();

            queue.insert(scheduled);

            if (wasEmpty) {
                available.signalAll();
                return scheduled;
            }

            // a new head means that the current sleep is too long.
            if (queue.peekMin() == scheduled) {
                interrupt.offer(WAKEUP);
                reporter.reportPreempted(scheduled);
            }

            return scheduled;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public TaskHandle schedule(final long delay, final Task task) throws ManagerStoppedException {
        return submit(task, deadline(now(), delay));
    }

    /**
     * Add a delay to a point in time, clamping to the range of a long instead of overflowing.
     */
    public static long deadline(final long now, final long delay) {
        try {
            return Math.addExact(now, delay);
        } catch (final ArithmeticException e) {
            return delay > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
    }

    @Override
    public boolean cancel(final TaskHandle handle) {
        final ScheduledTask task = own(handle);

        lock.lock();

        try {
            if (!task.cancel())
                return false;

            // wake up the background thread so that a cancelled head does not hold up a drain.
            if (!queue.isEmpty() && queue.peekMin() == task)
                interrupt.offer(WAKEUP);

            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait for all queued tasks to run, then stop the manager.
     *
     * Tasks may still be submitted while the queue is draining, once this method returns all submissions fail with
     * {@link ManagerStoppedException}. Calling it more than once is harmless.
     *
     * @throws InterruptedException If the calling thread was interrupted while waiting for the queue to drain.
     */
    public void shutdown() throws InterruptedException {
        if (Thread.currentThread() == thread)
            throw new IllegalStateException(name + ": shutdown called from a task, this would wait forever");

        lock.lock();

        try {
            while (!queue.isEmpty() || running)
                drained.await();

            if (stopped)
                return;

            stopped = true;
            available.signalAll();
        } finally {
            lock.unlock();
        }

        log.info("{}: stopped", name);
    }

    /**
     * Wait for the background thread to exit, which happens after {@link #shutdown()}.
     *
     * @return true if the thread exited within the given time.
     */
    public boolean awaitTermination(final long timeout, final TimeUnit unit) throws InterruptedException {
        thread.join(Math.max(1, unit.toMillis(timeout)));
        return !thread.isAlive();
    }

    public boolean isStopped() {
        lock.lock();

        try {
            return stopped;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of queued tasks, including cancelled tasks which have not yet been thrown away.
     */
    public int size() {
        lock.lock();

        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long now() {
        return System.currentTimeMillis();
    }

    private void start() {
        thread.start();
        log.info("{}: started", name);
    }

    private ScheduledTask own(final TaskHandle handle) {
        if (!(handle instanceof ScheduledTask))
            throw new IllegalArgumentException("not a handle from this manager: " + handle);

        final ScheduledTask task = (ScheduledTask) handle;

        if (task.getManager() != this)
            throw new IllegalArgumentException("not a handle from this manager: " + handle);

        return task;
    }

    private void watch() {
        while (true) {
            final ScheduledTask fire;
            final long sleep;

            lock.lock();

            try {
                while (queue.isEmpty()) {
                    if (stopped)
                        return;

                    available.awaitUninterruptibly();
                }

                final ScheduledTask head = queue.peekMin();

                if (head.isCancelled()) {
                    queue.removeMin();
                    reporter.reportDiscarded(head);
                    signalIfDrained();
                    continue;
                }

                final long now = now();

                if (head.getDueAt() > now) {
                    fire = null;
                    sleep = head.getDueAt() - now;
                } else {
                    queue.removeMin();

                    // lost against a concurrent cancel.
                    if (!head.fire()) {
                        reporter.reportDiscarded(head);
                        signalIfDrained();
                        continue;
                    }

                    running = true;
                    fire = head;
                    sleep = 0;
                }
            } finally {
                lock.unlock();
            }

            if (fire != null) {
                execute(fire);
                continue;
            }

            await(sleep);
        }
    }

    private void execute(final ScheduledTask task) {
        try {
            report(task, run(task));
        } finally {
            lock.lock();

            try {
                running = false;
                signalIfDrained();
            } finally {
                lock.unlock();
            }
        }
    }

    /**
     * Run a single task, isolating its failure from the loop.
     *
     * @return The failure of the task, or null if it completed.
     */
    private Throwable run(final ScheduledTask task) {
        try {
            task.run();
            return null;
        } catch (final VirtualMachineError e) {
            throw e;
        } catch (final Throwable e) {
            log.error("{}: failed to run task {}", name, task, e);
            return e;
        }
    }

    private void report(final ScheduledTask task, final Throwable cause) {
        try {
            if (cause == null) {
                reporter.reportFired(task);
            } else {
                reporter.reportFailed(task, cause);
            }
        } catch (final Exception e) {
            log.error("{}: reporter failed for task {}", name, task, e);
        }
    }

    /**
     * Sleep until the given number of milliseconds has passed, or until an earlier task shows up.
     *
     * The background thread does not stop on interrupts, it is only stopped through {@link #shutdown()}. An interrupt
     * cuts the sleep short and the wait is recomputed.
     */
    private void await(final long millis) {
        try {
            interrupt.poll(millis, TimeUnit.MILLISECONDS);
        } catch (final InterruptedException e) {
            log.warn("{}: interrupted while waiting for next task, ignoring", name);
        }
    }

    /* must hold lock */
    private void signalIfDrained() {
        if (queue.isEmpty() && !running)
            drained.signalAll();
    }

    @Override
    public String toString() {
        lock.lock();

        try {
            return "TaskManager(name=" + name + ", queued=" + queue.size() + ", running=" + running + ", stopped="
                    + stopped + ")";
        } finally {
            lock.unlock();
        }
    }

    public static class Builder {
        private String threadName = DEFAULT_THREAD_NAME;
        private boolean daemon = DEFAULT_DAEMON;
        private Reporter reporter = new NoopReporter();
        private AsyncFramework async;

        private Builder() {
        }

        public Builder threadName(final String threadName) {
            if (threadName == null || threadName.isEmpty())
                throw new IllegalArgumentException("threadName must be non-empty");

            this.threadName = threadName;
            return this;
        }

        public Builder daemon(final boolean daemon) {
            this.daemon = daemon;
            return this;
        }

        public Builder reporter(final Reporter reporter) {
            if (reporter == null)
                throw new IllegalArgumentException("reporter must not be null");

            this.reporter = reporter;
            return this;
        }

        /**
         * Framework used to build the futures backing task handles.
         */
        public Builder async(final AsyncFramework async) {
            if (async == null)
                throw new IllegalArgumentException("async must not be null");

            this.async = async;
            return this;
        }

        /**
         * Build the manager and start its background thread.
         */
        public TaskManager build() {
            final AsyncFramework async = this.async != null ? this.async : TinyAsync.builder()
                    .executor(ForkJoinPool.commonPool()).build();

            final TaskManager manager = new TaskManager(threadName, daemon, reporter, async);
            manager.start();
            return manager;
        }
    }
}
