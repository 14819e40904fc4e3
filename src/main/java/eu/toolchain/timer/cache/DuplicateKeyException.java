package eu.toolchain.timer.cache;

import lombok.Getter;

/**
 * Thrown when adding a key which is already present in a cache.
 */
public class DuplicateKeyException extends Exception {
    private static final long serialVersionUID = 1L;

    @Getter
    private final String key;

    public DuplicateKeyException(final String key) {
        super("key already present: " + key);
        this.key = key;
    }
}
