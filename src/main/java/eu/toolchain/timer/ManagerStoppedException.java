package eu.toolchain.timer;

/**
 * Thrown when a task is submitted to a manager that has been shut down.
 */
public class ManagerStoppedException extends Exception {
    private static final long serialVersionUID = 1L;

    public ManagerStoppedException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ManagerStoppedException(final String message) {
        super(message);
    }

    public ManagerStoppedException(final Throwable cause) {
        super(cause);
    }
}
