package eu.toolchain.timer.queue;

import java.util.NoSuchElementException;

public class EmptyQueueException extends NoSuchElementException {
    private static final long serialVersionUID = 1L;

    public EmptyQueueException(final String message) {
        super(message);
    }

    public EmptyQueueException() {
        super("queue is empty");
    }
}
