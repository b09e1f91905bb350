package prodcons;

import net.jcip.annotations.ThreadSafe;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Plain mutex. ReentrantLock already rejects unlock() from a non-owner with
 * IllegalMonitorStateException.
 */
@ThreadSafe
public class LockMutualExclusion implements MutualExclusion {
    private final Lock lock = new ReentrantLock();

    @Override
    public void enter() throws InterruptedException {
        lock.lockInterruptibly();
    }

    @Override
    public void exit() {
        lock.unlock();
    }
}
