package eu.toolchain.timer.statistics;

import eu.toolchain.timer.TaskHandle;

public class NoopReporter implements Reporter {
    @Override
    public void reportFired(TaskHandle task) {
    }

    @Override
    public void reportFailed(TaskHandle task, Throwable cause) {
    }

    @Override
    public void reportDiscarded(TaskHandle task) {
    }

    @Override
    public void reportPreempted(TaskHandle task) {
    }

    @Override
    public void reportExpired(String key) {
    }

    @Override
    public void reportCancelMissed(String key) {
    }

    @Override
    public void reportRescheduleFailed(String key, Throwable cause) {
    }
}
