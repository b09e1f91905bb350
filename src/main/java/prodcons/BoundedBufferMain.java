package prodcons;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Map;
import java.util.Properties;

/**
 * Runs one producer and one consumer of factorials over a semaphore bounded buffer.
 */
public final class BoundedBufferMain {
    private static final Logger log = LoggerFactory.getLogger(BoundedBufferMain.class);

    private BoundedBufferMain() {
    }

    public static void main(String[] args) {
        System.exit(run(System.getenv(), System.getProperties()));
    }

    static int run(Map<String, String> env, Properties props) {
        final BufferConfig config;
        try {
            config = BufferConfig.load(env, props);
        } catch (BufferConfigException e) {
            log.error("Invalid configuration", e);
            System.err.println("Invalid configuration: " + e.getMessage());
            return ExitCodes.INVALID_CONFIG;
        }
        log.info("Starting with {}", config);
        try {
            final BoundedBuffer<BigInteger> buffer = new SemaphoreBoundedBuffer<>(
                    config.capacity(), config.mutex().newGuard(), new LoggingBufferTrace());
            final var run = new ProducerConsumerRun<>(buffer,
                    new ProducerTask<>(buffer, config.items(), new FactorialItemGenerator()),
                    ConsumerTask.discarding(buffer, config.items()));
            run.run();
            return ExitCodes.SUCCESS;
        } catch (BufferFailureException e) {
            log.error("Run failed in step '{}'", e.getOperation(), e);
            System.err.println(e.getMessage());
            return ExitCodes.FAILURE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while waiting for producer and consumer", e);
            System.err.println("Interrupted while waiting for producer and consumer");
            return ExitCodes.INTERRUPTED;
        }
    }
}
