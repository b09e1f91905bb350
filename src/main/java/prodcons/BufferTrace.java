package prodcons;

/**
 * Observer of slot writes and reads. Called from inside the buffer's mutual exclusion
 * region, so calls are totally ordered and implementations must not block. An exception
 * thrown here aborts the put or take before the buffer changes and reaches its caller.
 */
public interface BufferTrace {
    BufferTrace NONE = new BufferTrace() {
        @Override
        public void produced(long slot) {
        }

        @Override
        public void consumed(long slot) {
        }
    };

    /**
     * @param slot logical slot index, i.e. number of puts before this one
     */
    void produced(long slot);

    /**
     * @param slot logical slot index, i.e. number of takes before this one
     */
    void consumed(long slot);
}
