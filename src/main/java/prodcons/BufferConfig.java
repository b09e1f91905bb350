package prodcons;

import net.jcip.annotations.Immutable;

import java.util.Map;
import java.util.Properties;

/**
 * Run settings. Each one is read from an environment variable, a system property of the same
 * meaning wins over it, and a blank or missing value falls back to the default.
 */
@Immutable
public final class BufferConfig {
    public static final String CAPACITY_ENV = "BUFFER_CAPACITY";
    public static final String CAPACITY_PROPERTY = "buffer.capacity";
    public static final String ITEMS_ENV = "BUFFER_ITEMS";
    public static final String ITEMS_PROPERTY = "buffer.items";
    public static final String MUTEX_ENV = "BUFFER_MUTEX";
    public static final String MUTEX_PROPERTY = "buffer.mutex";

    public static final int DEFAULT_CAPACITY = 100;
    public static final int DEFAULT_ITEMS = 100;
    public static final int MAX_CAPACITY = 1_000_000;
    public static final MutexStrategy DEFAULT_MUTEX = MutexStrategy.LOCK;

    private final int capacity;
    private final int items;
    private final MutexStrategy mutex;

    public BufferConfig(int capacity, int items, MutexStrategy mutex) {
        if (capacity < 1 || capacity > MAX_CAPACITY) {
            throw new BufferConfigException("capacity must be in [1, " + MAX_CAPACITY + "], was " + capacity);
        }
        if (items < 0) {
            throw new BufferConfigException("item count must be >= 0, was " + items);
        }
        if (mutex == null) {
            throw new BufferConfigException("mutex strategy must be set");
        }
        this.capacity = capacity;
        this.items = items;
        this.mutex = mutex;
    }

    public static BufferConfig defaults() {
        return new BufferConfig(DEFAULT_CAPACITY, DEFAULT_ITEMS, DEFAULT_MUTEX);
    }

    public static BufferConfig load(Map<String, String> env, Properties props) {
        final int capacity = parseInt(lookup(env, props, CAPACITY_ENV, CAPACITY_PROPERTY), CAPACITY_ENV, DEFAULT_CAPACITY);
        final int items = parseInt(lookup(env, props, ITEMS_ENV, ITEMS_PROPERTY), ITEMS_ENV, DEFAULT_ITEMS);
        final String mutexName = lookup(env, props, MUTEX_ENV, MUTEX_PROPERTY);
        final MutexStrategy mutex;
        try {
            mutex = mutexName == null ? DEFAULT_MUTEX : MutexStrategy.fromName(mutexName);
        } catch (IllegalArgumentException e) {
            throw new BufferConfigException(MUTEX_ENV + ": " + e.getMessage(), e);
        }
        return new BufferConfig(capacity, items, mutex);
    }

    private static String lookup(Map<String, String> env, Properties props, String envName, String propertyName) {
        final String fromProps = props.getProperty(propertyName);
        if (fromProps != null && !fromProps.isBlank()) {
            return fromProps;
        }
        final String fromEnv = env.get(envName);
        return fromEnv == null || fromEnv.isBlank() ? null : fromEnv;
    }

    private static int parseInt(String raw, String name, int defaultValue) {
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new BufferConfigException(name + " is not an integer: '" + raw + "'", e);
        }
    }

    public int capacity() {
        return capacity;
    }

    /**
     * how many items the producer puts and the consumer takes
     */
    public int items() {
        return items;
    }

    public MutexStrategy mutex() {
        return mutex;
    }

    @Override
    public String toString() {
        return "BufferConfig{capacity=" + capacity + ", items=" + items + ", mutex=" + mutex.configName() + '}';
    }
}
