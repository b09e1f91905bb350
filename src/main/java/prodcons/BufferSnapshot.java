package prodcons;

import net.jcip.annotations.Immutable;

/**
 * Point-in-time view of buffer bookkeeping. Only meaningful as a whole when taken at a
 * quiescent point, i.e. no thread is in the middle of put() or take().
 */
@Immutable
public final class BufferSnapshot {
    private final int capacity;
    private final int freeSlots;
    private final int filledSlots;
    private final int outstanding;
    private final long produced;
    private final long consumed;
    private final boolean closed;

    public BufferSnapshot(int capacity, int freeSlots, int filledSlots, int outstanding,
                          long produced, long consumed, boolean closed) {
        this.capacity = capacity;
        this.freeSlots = freeSlots;
        this.filledSlots = filledSlots;
        this.outstanding = outstanding;
        this.produced = produced;
        this.consumed = consumed;
        this.closed = closed;
    }

    public int capacity() {
        return capacity;
    }

    /**
     * units of the free slot resource currently available to put()
     */
    public int freeSlots() {
        return freeSlots;
    }

    /**
     * units of the filled slot resource currently available to take()
     */
    public int filledSlots() {
        return filledSlots;
    }

    /**
     * items written but not yet read
     */
    public int outstanding() {
        return outstanding;
    }

    public long produced() {
        return produced;
    }

    public long consumed() {
        return consumed;
    }

    public boolean closed() {
        return closed;
    }

    @Override
    public String toString() {
        return "BufferSnapshot{capacity=" + capacity
                + ", free=" + freeSlots
                + ", filled=" + filledSlots
                + ", outstanding=" + outstanding
                + ", produced=" + produced
                + ", consumed=" + consumed
                + ", closed=" + closed + '}';
    }
}
