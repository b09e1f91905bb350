package prodcons;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Interchangeable backends of the buffer's mutual exclusion region.
 */
public enum MutexStrategy {
    LOCK(LockMutualExclusion::new),
    SEMAPHORE(SemaphoreMutualExclusion::new);

    private final Supplier<MutualExclusion> factory;

    MutexStrategy(Supplier<MutualExclusion> factory) {
        this.factory = factory;
    }

    public MutualExclusion newGuard() {
        return factory.get();
    }

    /**
     * case-insensitive lookup, e.g. "lock" or "Semaphore"
     */
    public static MutexStrategy fromName(String name) {
        for (MutexStrategy s : values()) {
            if (s.name().equalsIgnoreCase(name.trim())) {
                return s;
            }
        }
        throw new IllegalArgumentException("unknown mutex strategy '" + name + "', expected one of lock, semaphore");
    }

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
