package prodcons;

/**
 * Produces the item with the given zero-based sequence number. Must not touch the buffer.
 */
@FunctionalInterface
public interface ItemGenerator<V> {
    V generate(int sequence);
}
