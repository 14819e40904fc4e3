package eu.toolchain.timer.queue;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Array-backed binary min-heap.
 *
 * Every non-root element compares greater than or equal to its parent. Ties are handed out in no particular order.
 */
public class BinaryHeapQueue<T> implements OrderedQueue<T> {
    private static final int DEFAULT_CAPACITY = 11;

    private final Comparator<? super T> comparator;

    private Object[] heap;
    private int size = 0;

    public BinaryHeapQueue(final Comparator<? super T> comparator) {
        this(DEFAULT_CAPACITY, comparator);
    }

    public BinaryHeapQueue(final int capacity, final Comparator<? super T> comparator) {
        if (capacity < 1)
            throw new IllegalArgumentException("capacity must be positive: " + capacity);

        if (comparator == null)
            throw new IllegalArgumentException("comparator must not be null");

        this.heap = new Object[capacity];
        this.comparator = comparator;
    }

    @Override
    public void insert(final T item) {
        if (item == null)
            throw new IllegalArgumentException("item must not be null");

        if (size == heap.length)
            heap = Arrays.copyOf(heap, grow(heap.length));

        siftUp(size, item);
        size++;
    }

    @Override
    public T peekMin() {
        if (size == 0)
            throw new EmptyQueueException();

        return at(0);
    }

    @Override
    public T removeMin() {
        if (size == 0)
            throw new EmptyQueueException();

        final T min = at(0);
        final int last = --size;
        final T moved = at(last);
        heap[last] = null;

        if (last > 0)
            siftDown(0, moved);

        return min;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public boolean isEmpty() {
        return size == 0;
    }

    private void siftUp(int index, final T item) {
        while (index > 0) {
            final int parent = (index - 1) >>> 1;
            final T p = at(parent);

            if (comparator.compare(item, p) >= 0)
                break;

            heap[index] = p;
            index = parent;
        }

        heap[index] = item;
    }

    private void siftDown(int index, final T item) {
        final int half = size >>> 1;

        // only nodes before half have children.
        while (index < half) {
            int child = (index << 1) + 1;
            T c = at(child);

            final int right = child + 1;

            if (right < size && comparator.compare(at(right), c) < 0) {
                child = right;
                c = at(right);
            }

            if (comparator.compare(item, c) <= 0)
                break;

            heap[index] = c;
            index = child;
        }

        heap[index] = item;
    }

    private int grow(final int current) {
        final int next = current < 64 ? current * 2 + 2 : current + (current >> 1);

        if (next < 0)
            throw new IllegalStateException("queue too large");

        return next;
    }

    @SuppressWarnings("unchecked")
    private T at(final int index) {
        return (T) heap[index];
    }

    @Override
    public String toString() {
        return "BinaryHeapQueue(size=" + size + ")";
    }
}
