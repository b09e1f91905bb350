package prodcons;

/**
 * Process exit statuses of {@link BoundedBufferMain}.
 */
public final class ExitCodes {
    public static final int SUCCESS = 0;
    /** initialization, synchronization or thread lifecycle failure */
    public static final int FAILURE = 1;
    public static final int INVALID_CONFIG = 2;
    public static final int INTERRUPTED = 130;

    private ExitCodes() {
    }
}
