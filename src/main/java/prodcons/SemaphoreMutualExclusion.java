package prodcons;

import net.jcip.annotations.ThreadSafe;

import java.util.concurrent.Semaphore;

/**
 * Binary semaphore used as a mutex. A semaphore has no notion of owner and would happily
 * accept a second release(), so the owner is tracked here to turn that into an error.
 */
@ThreadSafe
public class SemaphoreMutualExclusion implements MutualExclusion {
    private final Semaphore permit = new Semaphore(1);
    //written only by the thread holding the permit
    private volatile Thread owner;

    @Override
    public void enter() throws InterruptedException {
        permit.acquire();
        owner = Thread.currentThread();
    }

    @Override
    public void exit() {
        if (owner != Thread.currentThread()) {
            throw new IllegalMonitorStateException(
                    "thread " + Thread.currentThread().getName() + " does not hold the mutual exclusion region");
        }
        owner = null;
        permit.release();
    }
}
