package prodcons;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;

/**
 * Runs one producer and one consumer over a shared buffer, each on its own thread, and
 * waits for both. Any failure of a role or of the thread lifecycle is reported as a
 * {@link BufferFailureException}; the other role is then interrupted and joined best-effort.
 */
public class ProducerConsumerRun<V> {
    private static final Logger log = LoggerFactory.getLogger(ProducerConsumerRun.class);
    static final long TEARDOWN_JOIN_MILLIS = 5_000L;

    private final BoundedBuffer<V> buffer;
    private final Callable<Long> producer;
    private final Callable<Long> consumer;
    private final ThreadFactory threadFactory;

    public ProducerConsumerRun(BoundedBuffer<V> buffer, ProducerTask<V> producer, ConsumerTask<V> consumer) {
        this(buffer, producer, consumer, Thread::new);
    }

    ProducerConsumerRun(BoundedBuffer<V> buffer, Callable<Long> producer, Callable<Long> consumer,
                        ThreadFactory threadFactory) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.producer = Objects.requireNonNull(producer, "producer");
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
    }

    public RunReport run() throws InterruptedException {
        final var start = Instant.now();
        final BlockingQueue<RoleTask> finished = new LinkedBlockingQueue<>();
        final RoleTask consumerTask = new RoleTask(consumer, "consumer", finished);
        final RoleTask producerTask = new RoleTask(producer, "producer", finished);
        //consumer first, it just parks until something arrives
        consumerTask.thread = start(consumerTask);
        try {
            producerTask.thread = start(producerTask);
        } catch (BufferFailureException e) {
            abort(consumerTask.thread);
            throw e;
        }

        //whichever role ends first is checked first, so a failed consumer cannot leave us
        //waiting on a producer parked in put() forever
        try {
            for (int i = 0; i < 2; i++) {
                await(finished.take());
            }
        } catch (BufferFailureException | InterruptedException e) {
            abort(producerTask.thread);
            abort(consumerTask.thread);
            throw e;
        }
        final var report = new RunReport(producerTask.result(), consumerTask.result(), buffer.snapshot(),
                Duration.between(start, Instant.now()));
        log.info("Finished in {}: {}", report.elapsed(), report);
        return report;
    }

    private Thread start(RoleTask task) {
        final String operation = "create " + task.role + " thread";
        final Thread t;
        try {
            t = threadFactory.newThread(task);
            if (t == null) {
                throw new IllegalStateException("thread factory refused to create a thread");
            }
            t.setName(task.role);
            t.start();
        } catch (RuntimeException | OutOfMemoryError e) {
            throw new BufferFailureException(operation, e);
        }
        log.debug("Started {} thread", task.role);
        return t;
    }

    private static void await(RoleTask task) throws InterruptedException {
        try {
            task.get();
        } catch (ExecutionException e) {
            throw new BufferFailureException("complete " + task.role + " role", e.getCause());
        }
        task.thread.join();
        log.debug("Joined {} thread", task.role);
    }

    /**
     * best-effort teardown after a primary failure; problems here are logged, never thrown,
     * so they cannot hide the original failure
     */
    private static void abort(Thread thread) {
        if (!thread.isAlive()) {
            return;
        }
        thread.interrupt();
        try {
            thread.join(TEARDOWN_JOIN_MILLIS);
            if (thread.isAlive()) {
                log.warn("Could not join {} thread within {} ms during teardown", thread.getName(), TEARDOWN_JOIN_MILLIS);
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while joining {} thread during teardown", thread.getName());
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Role body that reports its own completion, successful or not.
     */
    private static final class RoleTask extends FutureTask<Long> {
        private final String role;
        private final BlockingQueue<RoleTask> finished;
        //set by the coordinating thread right after start, read only by it
        private Thread thread;

        RoleTask(Callable<Long> body, String role, BlockingQueue<RoleTask> finished) {
            super(body);
            this.role = role;
            this.finished = finished;
        }

        @Override
        protected void done() {
            finished.add(this);
        }

        /**
         * INVARIANT: task completed normally
         */
        long result() throws InterruptedException {
            try {
                return get();
            } catch (ExecutionException e) {
                throw new IllegalStateException(role + " role did not complete normally", e);
            }
        }
    }
}
