package prodcons;

/**
 * Guard for a critical section: at most one thread is between enter() and exit().
 * Callers pair them in try/finally:
 * <pre>
 *     guard.enter();
 *     try {
 *         ...
 *     } finally {
 *         guard.exit();
 *     }
 * </pre>
 */
public interface MutualExclusion {
    void enter() throws InterruptedException;

    /**
     * @throws IllegalMonitorStateException if the calling thread is not inside the region
     */
    void exit();
}
