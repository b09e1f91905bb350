package prodcons;

/**
 * Fixed-capacity FIFO staging area between a producer and a consumer.
 * @param <V> item type, null is never a valid item
 */
public interface BoundedBuffer<V> {
    /**
     * puts an element to back of buffer or blocks caller while buffer is full.
     * @throws IllegalArgumentException if v is null
     * @throws IllegalStateException if the buffer was closed
     */
    void put(V v) throws InterruptedException;

    /**
     * takes an element from the head of buffer or blocks caller while buffer is empty.
     * @return the element, or null once the buffer is closed and drained
     */
    V take() throws InterruptedException;

    /**
     * stops accepting new elements and wakes up everybody blocked in put() or take().
     * Elements already in the buffer can still be taken. Idempotent.
     */
    void close();

    int capacity();

    /**
     * bookkeeping as seen from inside the buffer's critical section
     */
    BufferSnapshot snapshot() throws InterruptedException;
}
