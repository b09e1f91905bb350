package prodcons;

import net.jcip.annotations.GuardedBy;
import net.jcip.annotations.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Classical semaphore solution: "free" counts slots available for writing, "filled" counts
 * slots available for reading, and a separate mutual exclusion region guards the slot array
 * and positions. Their sum equals capacity whenever no thread is in the middle of an operation.
 * <p>
 * Lock ordering: a thread acquires at most one counting semaphore and only then enters the
 * guard. It never blocks on a semaphore while inside the guard.
 * <p>
 * Closing releases one extra unit of each semaphore. Whoever acquires such a unit and finds
 * nothing to do hands it back, so every blocked and future caller wakes up.
 * @param <V>
 */
@ThreadSafe
public class SemaphoreBoundedBuffer<V> implements BoundedBuffer<V> {
    private static final Logger log = LoggerFactory.getLogger(SemaphoreBoundedBuffer.class);

    @GuardedBy("guard")
    private final V[] slots;
    @GuardedBy("guard")
    private int head, tail, count;
    //logical slot indexes, never wrap
    @GuardedBy("guard")
    private long produced, consumed;

    private final Semaphore free;
    private final Semaphore filled;
    private final MutualExclusion guard;
    private final BufferTrace trace;
    private final AtomicBoolean closed = new AtomicBoolean();

    public SemaphoreBoundedBuffer(int capacity) {
        this(capacity, new LockMutualExclusion(), BufferTrace.NONE);
    }

    public SemaphoreBoundedBuffer(int capacity, MutualExclusion guard, BufferTrace trace) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, was " + capacity);
        }
        this.guard = Objects.requireNonNull(guard, "guard");
        this.trace = Objects.requireNonNull(trace, "trace");
        this.slots = allocateSlots(capacity);
        this.free = new Semaphore(capacity);
        this.filled = new Semaphore(0);
        log.debug("Created buffer of capacity {} guarded by {}", capacity, guard.getClass().getSimpleName());
    }

    @SuppressWarnings("unchecked")
    private static <V> V[] allocateSlots(int capacity) {
        try {
            return (V[]) new Object[capacity];
        } catch (OutOfMemoryError e) {
            throw new BufferFailureException("allocate slot storage", e);
        }
    }

    @Override
    public void put(V v) throws InterruptedException {
        if (v == null) {
            throw new IllegalArgumentException("null items are not allowed");
        }
        if (closed.get()) {
            throw new IllegalStateException("buffer is closed");
        }
        free.acquire();
        boolean written = false;
        try {
            written = write(v);
        } finally {
            //on failure or close the free unit goes back, otherwise the slot becomes readable
            if (written) {
                filled.release();
            } else {
                free.release();
            }
        }
        if (!written) {
            throw new IllegalStateException("buffer is closed");
        }
    }

    /**
     * INVARIANT: caller holds a unit of the free semaphore
     * @return false if the buffer got closed meanwhile
     */
    private boolean write(V v) throws InterruptedException {
        guard.enter();
        try {
            if (closed.get()) {
                return false;
            }
            //trace first: if it throws, nothing has been written yet
            trace.produced(produced);
            slots[tail] = v;
            tail = (tail + 1) % slots.length;
            count++;
            produced++;
            return true;
        } finally {
            guard.exit();
        }
    }

    @Override
    public V take() throws InterruptedException {
        filled.acquire();
        V v = null;
        try {
            v = read();
        } finally {
            if (v != null) {
                free.release();
            } else {
                filled.release();
            }
        }
        return v;
    }

    /**
     * INVARIANT: caller holds a unit of the filled semaphore
     * @return null if the buffer is closed and drained
     */
    private V read() throws InterruptedException {
        guard.enter();
        try {
            if (count == 0) {
                if (!closed.get()) {
                    throw new IllegalStateException("filled slot semaphore out of step with buffer contents");
                }
                return null;
            }
            trace.consumed(consumed);
            final V v = slots[head];
            slots[head] = null;
            head = (head + 1) % slots.length;
            count--;
            consumed++;
            return v;
        } finally {
            guard.exit();
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            free.release();
            filled.release();
            log.debug("Buffer closed");
        }
    }

    @Override
    public int capacity() {
        return slots.length;
    }

    /**
     * Reads the bookkeeping under the guard. Semaphore counts are only consistent with it
     * at quiescent points.
     */
    @Override
    public BufferSnapshot snapshot() throws InterruptedException {
        guard.enter();
        try {
            final boolean isClosed = closed.get();
            //hide the wake-up units added by close()
            final int extra = isClosed ? 1 : 0;
            return new BufferSnapshot(slots.length,
                    Math.max(0, free.availablePermits() - extra),
                    Math.max(0, filled.availablePermits() - extra),
                    count, produced, consumed, isClosed);
        } finally {
            guard.exit();
        }
    }
}
