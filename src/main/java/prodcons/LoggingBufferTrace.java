package prodcons;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Console trace: one line per put/take.
 */
public class LoggingBufferTrace implements BufferTrace {
    private static final Logger log = LoggerFactory.getLogger(LoggingBufferTrace.class);

    @Override
    public void produced(long slot) {
        log.info("Produced {}", slot);
    }

    @Override
    public void consumed(long slot) {
        log.info("Consumed {}", slot);
    }
}
