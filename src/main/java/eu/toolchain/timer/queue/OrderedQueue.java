package eu.toolchain.timer.queue;

/**
 * A queue which always hands out its smallest element first, according to some ordering.
 *
 * Implementations are not required to be thread safe, the owner of a queue is expected to serialize access.
 *
 * @param <T> Type of the queued items.
 */
public interface OrderedQueue<T> {
    public void insert(T item);

    /**
     * Get the smallest item without removing it.
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public T peekMin();

    /**
     * Remove and return the smallest item.
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public T removeMin();

    public int size();

    public boolean isEmpty();
}
