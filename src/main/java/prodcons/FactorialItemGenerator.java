package prodcons;

import java.math.BigInteger;

/**
 * Placeholder workload simulating an expensive computation: item n is (n mod 100)!, computed
 * recursively. The argument wraps so that long runs keep a bounded cost and recursion depth.
 */
public class FactorialItemGenerator implements ItemGenerator<BigInteger> {
    static final int ARGUMENT_BOUND = 100;

    @Override
    public BigInteger generate(int sequence) {
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be >= 0, was " + sequence);
        }
        return factorial(sequence % ARGUMENT_BOUND);
    }

    private static BigInteger factorial(int n) {
        return n == 0 ? BigInteger.ONE : BigInteger.valueOf(n).multiply(factorial(n - 1));
    }
}
