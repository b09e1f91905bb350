package prodcons;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Producer role: generates and puts a fixed number of items, then returns how many it put.
 */
public class ProducerTask<V> implements Callable<Long> {
    private static final Logger log = LoggerFactory.getLogger(ProducerTask.class);

    private final BoundedBuffer<V> buf;
    private final int length;
    private final ItemGenerator<? extends V> generator;
    private final boolean closeWhenDone;

    public ProducerTask(BoundedBuffer<V> buf, int length, ItemGenerator<? extends V> generator) {
        this(buf, length, generator, false);
    }

    /**
     * @param closeWhenDone close the buffer after the last put so that a consumer created with
     *                      {@link ConsumerTask#untilClosed} sees end of stream
     */
    public ProducerTask(BoundedBuffer<V> buf, int length, ItemGenerator<? extends V> generator,
                        boolean closeWhenDone) {
        if (length < 0) {
            throw new IllegalArgumentException("item count must be >= 0, was " + length);
        }
        this.buf = Objects.requireNonNull(buf, "buf");
        this.generator = Objects.requireNonNull(generator, "generator");
        this.length = length;
        this.closeWhenDone = closeWhenDone;
    }

    @Override
    public Long call() throws InterruptedException {
        log.info("Producer thread started");
        long put = 0;
        try {
            for (int i = 0; i < length; i++) {
                buf.put(generator.generate(i));
                put++;
            }
        } finally {
            if (closeWhenDone) {
                buf.close();
            }
        }
        log.info("Producer has finished after {} items", put);
        return put;
    }
}
