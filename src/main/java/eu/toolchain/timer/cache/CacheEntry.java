package eu.toolchain.timer.cache;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import eu.toolchain.timer.TaskHandle;

/**
 * A cached value together with the task which will remove it.
 *
 * Entries use identity equality, a deletion task only removes the exact entry it was scheduled for.
 */
@Getter
@AllArgsConstructor
@ToString(exclude = { "value" })
class CacheEntry<V> {
    private final V value;
    private final long ttl;

    /* guarded by the write lock of the owning cache */
    @Setter
    private TaskHandle expire;
}
