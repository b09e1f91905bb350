package prodcons;

/**
 * Unrecoverable failure of an initialization, synchronization or thread lifecycle step.
 * Not retried: the caller reports it and shuts down.
 */
public class BufferFailureException extends RuntimeException {
    private final String operation;

    public BufferFailureException(String operation, Throwable cause) {
        super("Could not " + operation + ": " + cause, cause);
        this.operation = operation;
    }

    /**
     * the step that failed, e.g. "join producer thread"
     */
    public String getOperation() {
        return operation;
    }
}
