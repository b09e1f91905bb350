package prodcons;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Consumer;

/**
 * Consumer role: takes either a fixed number of items or everything until the buffer is
 * closed and drained, hands every item to a sink and returns how many it took.
 */
public class ConsumerTask<V> implements Callable<Long> {
    private static final Logger log = LoggerFactory.getLogger(ConsumerTask.class);
    private static final int UNTIL_CLOSED = -1;

    private final BoundedBuffer<V> buf;
    private final int length;
    private final Consumer<? super V> sink;

    public ConsumerTask(BoundedBuffer<V> buf, int length, Consumer<? super V> sink) {
        if (length < 0) {
            throw new IllegalArgumentException("item count must be >= 0, was " + length);
        }
        this.buf = Objects.requireNonNull(buf, "buf");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.length = length;
    }

    private ConsumerTask(BoundedBuffer<V> buf, Consumer<? super V> sink) {
        this.buf = Objects.requireNonNull(buf, "buf");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.length = UNTIL_CLOSED;
    }

    public static <V> ConsumerTask<V> discarding(BoundedBuffer<V> buf, int length) {
        return new ConsumerTask<>(buf, length, v -> {
        });
    }

    /**
     * consumer that does not know the item count up front and stops at end of stream
     */
    public static <V> ConsumerTask<V> untilClosed(BoundedBuffer<V> buf, Consumer<? super V> sink) {
        return new ConsumerTask<>(buf, sink);
    }

    @Override
    public Long call() throws InterruptedException {
        log.info("Consumer thread started");
        long taken = 0;
        while (length == UNTIL_CLOSED || taken < length) {
            final V v = buf.take();
            if (v == null) {
                if (length != UNTIL_CLOSED) {
                    //closed before the agreed number of items arrived
                    throw new IllegalStateException("buffer closed after " + taken + " of " + length + " items");
                }
                break;
            }
            sink.accept(v);
            taken++;
        }
        log.info("Consumer has finished after {} items", taken);
        return taken;
    }
}
