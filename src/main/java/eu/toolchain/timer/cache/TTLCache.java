package eu.toolchain.timer.cache;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import lombok.extern.slf4j.Slf4j;
import eu.toolchain.timer.ManagerStoppedException;
import eu.toolchain.timer.Task;
import eu.toolchain.timer.TaskHandle;
import eu.toolchain.timer.TaskManager;
import eu.toolchain.timer.TaskScheduler;
import eu.toolchain.timer.statistics.NoopReporter;
import eu.toolchain.timer.statistics.Reporter;

/**
 * A string keyed cache where every entry expires after a time to live.
 *
 * Expiration is implemented by submitting a deletion task to a {@link TaskScheduler}. Every successful {@link #get}
 * moves the deletion forward by the time to live of the entry.
 *
 * The cache lock is never held while the scheduler waits on anything but its own short critical sections, and the
 * scheduler never holds its lock while running a deletion task.
 */
@Slf4j
public class TTLCache<V> implements AutoCloseable {
    public static final String DEFAULT_THREAD_NAME = "ttl-cache";

    private final TaskScheduler scheduler;
    private final Reporter reporter;
    /* set if this cache created its own manager */
    private final TaskManager owned;

    private final Map<String, CacheEntry<V>> entries = new HashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Lock read = lock.readLock();
    private final Lock write = lock.writeLock();

    public TTLCache(final TaskScheduler scheduler) {
        this(scheduler, new NoopReporter());
    }

    public TTLCache(final TaskScheduler scheduler, final Reporter reporter) {
        this(scheduler, reporter, null);
    }

    private TTLCache(final TaskScheduler scheduler, final Reporter reporter, final TaskManager owned) {
        if (scheduler == null)
            throw new IllegalArgumentException("scheduler must not be null");

        if (reporter == null)
            throw new IllegalArgumentException("reporter must not be null");

        this.scheduler = scheduler;
        this.reporter = reporter;
        this.owned = owned;
    }

    /**
     * Create a cache with a task manager of its own, which is shut down when the cache is closed.
     */
    public static <V> TTLCache<V> create() {
        return create(new NoopReporter());
    }

    public static <V> TTLCache<V> create(final Reporter reporter) {
        final TaskManager manager = TaskManager.builder().threadName(DEFAULT_THREAD_NAME).reporter(reporter).build();
        return new TTLCache<V>(manager, reporter, manager);
    }

    /**
     * Add a new entry.
     *
     * @param ttl Time to live in milliseconds.
     * @throws DuplicateKeyException If the key is already present, use {@link #put} to overwrite.
     * @throws ManagerStoppedException If the expiration could not be scheduled, nothing is stored.
     */
    public void add(final String key, final V value, final long ttl) throws DuplicateKeyException,
            ManagerStoppedException {
        check(key, value, ttl);

        write.lock();

        try {
            if (entries.containsKey(key))
                throw new DuplicateKeyException(key);

            entries.put(key, entry(key, value, ttl));
        } finally {
            write.unlock();
        }
    }

    /**
     * Add or overwrite an entry, cancelling the expiration of the previous one.
     *
     * @param ttl Time to live in milliseconds.
     * @return The previous value, or null if there was none.
     * @throws ManagerStoppedException If the expiration could not be scheduled, the previous entry is kept as is.
     */
    public V put(final String key, final V value, final long ttl) throws ManagerStoppedException {
        check(key, value, ttl);

        write.lock();

        try {
            final CacheEntry<V> entry = entry(key, value, ttl);
            final CacheEntry<V> previous = entries.put(key, entry);

            if (previous == null)
                return null;

            // if this misses, the running deletion will find the new entry and leave it alone.
            cancelExpire(key, previous);
            return previous.getValue();
        } finally {
            write.unlock();
        }
    }

    /**
     * Get a value and extend its life by its time to live.
     *
     * @return The value, or null if the key is not present.
     */
    public V get(final String key) {
        write.lock();

        try {
            final CacheEntry<V> entry = entries.get(key);

            if (entry == null)
                return null;

            refresh(key, entry);
            return entry.getValue();
        } finally {
            write.unlock();
        }
    }

    /**
     * Get a value without extending its life.
     */
    public V peek(final String key) {
        read.lock();

        try {
            final CacheEntry<V> entry = entries.get(key);
            return entry != null ? entry.getValue() : null;
        } finally {
            read.unlock();
        }
    }

    public boolean containsKey(final String key) {
        read.lock();

        try {
            return entries.containsKey(key);
        } finally {
            read.unlock();
        }
    }

    /**
     * Remove an entry right away.
     *
     * @return true if an entry was removed.
     */
    public boolean delete(final String key) {
        write.lock();

        try {
            final CacheEntry<V> entry = entries.remove(key);

            if (entry == null)
                return false;

            cancelExpire(key, entry);
            return true;
        } finally {
            write.unlock();
        }
    }

    /**
     * Remove all entries and cancel their expirations.
     */
    public void clear() {
        write.lock();

        try {
            for (final Map.Entry<String, CacheEntry<V>> e : entries.entrySet())
                cancelExpire(e.getKey(), e.getValue());

            entries.clear();
        } finally {
            write.unlock();
        }
    }

    public int size() {
        read.lock();

        try {
            return entries.size();
        } finally {
            read.unlock();
        }
    }

    /**
     * Snapshot of the current keys, in natural order.
     */
    public Set<String> keys() {
        read.lock();

        try {
            return new TreeSet<>(entries.keySet());
        } finally {
            read.unlock();
        }
    }

    /**
     * Clear the cache, and shut down its task manager if it owns one.
     */
    @Override
    public void close() throws InterruptedException {
        clear();

        if (owned != null)
            owned.shutdown();
    }

    private void check(final String key, final V value, final long ttl) {
        if (key == null)
            throw new IllegalArgumentException("key must not be null");

        if (value == null)
            throw new IllegalArgumentException("value must not be null");

        if (ttl < 0)
            throw new IllegalArgumentException("ttl must not be negative: " + ttl);
    }

    /* must hold write lock */
    private CacheEntry<V> entry(final String key, final V value, final long ttl) throws ManagerStoppedException {
        final CacheEntry<V> entry = new CacheEntry<V>(value, ttl, null);
        entry.setExpire(expireIn(key, entry));
        return entry;
    }

    /* must hold write lock */
    private void refresh(final String key, final CacheEntry<V> entry) {
        final TaskHandle next;

        try {
            next = expireIn(key, entry);
        } catch (final ManagerStoppedException e) {
            log.warn("{}: failed to reschedule expiration, keeping the current one", key, e);
            reporter.reportRescheduleFailed(key, e);
            return;
        }

        if (!scheduler.cancel(entry.getExpire())) {
            // the current expiration is already running, it will remove the entry.
            scheduler.cancel(next);
            log.warn("{}: expiration already fired, returning stale value", key);
            reporter.reportCancelMissed(key);
            return;
        }

        entry.setExpire(next);
    }

    private TaskHandle expireIn(final String key, final CacheEntry<V> entry) throws ManagerStoppedException {
        return scheduler.submit(new Task() {
            @Override
            public void run() throws Exception {
                expire(key, entry);
            }
        }, TaskManager.deadline(scheduler.now(), entry.getTtl()));
    }

    private void expire(final String key, final CacheEntry<V> entry) {
        write.lock();

        try {
            // replaced or deleted since this expiration was scheduled.
            if (entries.get(key) != entry)
                return;

            entries.remove(key);
        } finally {
            write.unlock();
        }

        log.debug("{}: expired", key);
        reporter.reportExpired(key);
    }

    /* must hold write lock */
    private void cancelExpire(final String key, final CacheEntry<V> entry) {
        if (!scheduler.cancel(entry.getExpire()))
            log.debug("{}: expiration already fired", key);
    }

    @Override
    public String toString() {
        final List<String> keys = new ArrayList<>(keys());
        return "TTLCache(size=" + keys.size() + ", keys=" + keys + ", scheduler=" + scheduler + ")";
    }
}
