package prodcons;

import net.jcip.annotations.Immutable;

import java.time.Duration;

/**
 * Outcome of a completed producer/consumer run.
 */
@Immutable
public final class RunReport {
    private final long produced;
    private final long consumed;
    private final BufferSnapshot finalState;
    private final Duration elapsed;

    public RunReport(long produced, long consumed, BufferSnapshot finalState, Duration elapsed) {
        this.produced = produced;
        this.consumed = consumed;
        this.finalState = finalState;
        this.elapsed = elapsed;
    }

    public long produced() {
        return produced;
    }

    public long consumed() {
        return consumed;
    }

    /**
     * buffer state after both roles were joined
     */
    public BufferSnapshot finalState() {
        return finalState;
    }

    public Duration elapsed() {
        return elapsed;
    }

    @Override
    public String toString() {
        return "RunReport{produced=" + produced + ", consumed=" + consumed
                + ", finalState=" + finalState + ", elapsed=" + elapsed + '}';
    }
}
