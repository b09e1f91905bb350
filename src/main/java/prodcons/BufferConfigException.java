package prodcons;

/**
 * Invalid run setting, e.g. a capacity that is not a positive integer.
 */
public class BufferConfigException extends RuntimeException {
    public BufferConfigException(String message) {
        super(message);
    }

    public BufferConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
