package eu.toolchain.timer.statistics;

import java.util.concurrent.atomic.AtomicLong;

import lombok.ToString;
import eu.toolchain.timer.TaskHandle;

@ToString
public class TallyReporter implements Reporter {
    private final AtomicLong fired = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();
    private final AtomicLong preempted = new AtomicLong();

    private final AtomicLong expired = new AtomicLong();
    private final AtomicLong cancelMissed = new AtomicLong();
    private final AtomicLong rescheduleFailed = new AtomicLong();

    public long getFired() {
        return fired.get();
    }

    public long getFailed() {
        return failed.get();
    }

    public long getDiscarded() {
        return discarded.get();
    }

    public long getPreempted() {
        return preempted.get();
    }

    public long getExpired() {
        return expired.get();
    }

    public long getCancelMissed() {
        return cancelMissed.get();
    }

    public long getRescheduleFailed() {
        return rescheduleFailed.get();
    }

    @Override
    public void reportFired(TaskHandle task) {
        fired.incrementAndGet();
    }

    @Override
    public void reportFailed(TaskHandle task, Throwable cause) {
        failed.incrementAndGet();
    }

    @Override
    public void reportDiscarded(TaskHandle task) {
        discarded.incrementAndGet();
    }

    @Override
    public void reportPreempted(TaskHandle task) {
        preempted.incrementAndGet();
    }

    @Override
    public void reportExpired(String key) {
        expired.incrementAndGet();
    }

    @Override
    public void reportCancelMissed(String key) {
        cancelMissed.incrementAndGet();
    }

    @Override
    public void reportRescheduleFailed(String key, Throwable cause) {
        rescheduleFailed.incrementAndGet();
    }
}
