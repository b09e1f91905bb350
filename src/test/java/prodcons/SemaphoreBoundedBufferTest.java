package prodcons;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SemaphoreBoundedBufferTest {
    private static final long BLOCK_CHECK_MILLIS = 100L;

    private static SemaphoreBoundedBuffer<Integer> newBuffer(int capacity, MutexStrategy mutex) {
        return new SemaphoreBoundedBuffer<>(capacity, mutex.newGuard(), BufferTrace.NONE);
    }

    @Test
    public void testCapacityMustBePositive() {
        assertThatThrownBy(() -> new SemaphoreBoundedBuffer<Integer>(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SemaphoreBoundedBuffer<Integer>(-1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new SemaphoreBoundedBuffer<Integer>(1).capacity()).isEqualTo(1);
    }

    @Test
    public void testPutNullIsRejected() {
        final var buf = new SemaphoreBoundedBuffer<Integer>(2);
        assertThatThrownBy(() -> buf.put(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @EnumSource(MutexStrategy.class)
    public void testFifoAcrossWraparound(MutexStrategy mutex) throws InterruptedException {
        final var buf = newBuffer(3, mutex);
        final Deque<Integer> expected = new ArrayDeque<>();
        int next = 0;
        buf.put(next);
        expected.add(next++);
        //outstanding items oscillate between 1 and 3, positions wrap many times
        for (int round = 0; round < 10; round++) {
            buf.put(next);
            expected.add(next++);
            buf.put(next);
            expected.add(next++);
            assertThat(buf.take()).isEqualTo(expected.poll());
            assertThat(buf.take()).isEqualTo(expected.poll());
        }
        assertThat(buf.take()).isEqualTo(expected.poll());
        final var s = buf.snapshot();
        assertThat(s.produced()).isEqualTo(21);
        assertThat(s.consumed()).isEqualTo(21);
        assertThat(s.outstanding()).isZero();
    }

    @ParameterizedTest
    @EnumSource(MutexStrategy.class)
    public void testCapacityInvariantAtQuiescentPoints(MutexStrategy mutex) throws InterruptedException {
        final var buf = newBuffer(4, mutex);
        assertInvariant(buf.snapshot(), 0);
        buf.put(1);
        buf.put(2);
        buf.put(3);
        assertInvariant(buf.snapshot(), 3);
        buf.take();
        assertInvariant(buf.snapshot(), 2);
        buf.put(4);
        buf.put(5);
        assertInvariant(buf.snapshot(), 4);
    }

    private static void assertInvariant(BufferSnapshot s, int outstanding) {
        assertThat(s.freeSlots() + s.filledSlots()).isEqualTo(s.capacity());
        assertThat(s.filledSlots()).isEqualTo(outstanding);
        assertThat(s.outstanding()).isEqualTo(outstanding);
        assertThat(s.produced() - s.consumed()).isEqualTo(outstanding);
    }

    @ParameterizedTest
    @EnumSource(MutexStrategy.class)
    public void testPutBlocksWhenFullUntilTakeFreesSlot(MutexStrategy mutex) throws Exception {
        final var buf = newBuffer(1, mutex);
        buf.put(111);
        final ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            final CountDownLatch started = new CountDownLatch(1);
            final Future<?> putter = pool.submit(() -> {
                started.countDown();
                buf.put(222);
                return null;
            });
            started.await();
            Thread.sleep(BLOCK_CHECK_MILLIS);
            assertThat(putter.isDone()).as("put should block on a full buffer").isFalse();

            assertThat(buf.take()).isEqualTo(111);
            putter.get(1, TimeUnit.SECONDS);
            assertThat(buf.take()).isEqualTo(222);
        } finally {
            pool.shutdownNow();
        }
    }

    @ParameterizedTest
    @EnumSource(MutexStrategy.class)
    public void testTakeBlocksWhenEmptyUntilPutArrives(MutexStrategy mutex) throws Exception {
        final var buf = newBuffer(2, mutex);
        final ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            final CountDownLatch started = new CountDownLatch(1);
            final Future<Integer> taker = pool.submit(() -> {
                started.countDown();
                return buf.take();
            });
            started.await();
            Thread.sleep(BLOCK_CHECK_MILLIS);
            assertThat(taker.isDone()).as("take should block on an empty buffer").isFalse();

            buf.put(7);
            assertThat(taker.get(1, TimeUnit.SECONDS)).isEqualTo(7);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void testTakeOnClosedEmptyBufferReturnsEndOfStream() throws InterruptedException {
        final var buf = new SemaphoreBoundedBuffer<Integer>(2);
        buf.close();
        assertThat(buf.take()).isNull();
        //and keeps doing so
        assertThat(buf.take()).isNull();
    }

    @ParameterizedTest
    @EnumSource(MutexStrategy.class)
    public void testCloseKeepsAlreadyPutItems(MutexStrategy mutex) throws InterruptedException {
        final var buf = newBuffer(3, mutex);
        buf.put(1);
        buf.put(2);
        buf.put(3);
        buf.close();
        assertThat(buf.take()).isEqualTo(1);
        assertThat(buf.take()).isEqualTo(2);
        assertThat(buf.take()).isEqualTo(3);
        assertThat(buf.take()).isNull();
    }

    @Test
    public void testPutAfterCloseIsRejected() {
        final var buf = new SemaphoreBoundedBuffer<Integer>(2);
        buf.close();
        assertThatThrownBy(() -> buf.put(1)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void testCloseIsIdempotentAndHidesWakeUpUnits() throws InterruptedException {
        final var buf = new SemaphoreBoundedBuffer<Integer>(4);
        buf.put(1);
        buf.close();
        buf.close();
        buf.close();
        final var s = buf.snapshot();
        assertThat(s.closed()).isTrue();
        assertThat(s.freeSlots()).isEqualTo(3);
        assertThat(s.filledSlots()).isEqualTo(1);
        assertThat(s.outstanding()).isEqualTo(1);
    }

    @ParameterizedTest
    @EnumSource(MutexStrategy.class)
    public void testCloseUnblocksWaitingTake(MutexStrategy mutex) throws Exception {
        final var buf = newBuffer(2, mutex);
        final ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            final CountDownLatch started = new CountDownLatch(1);
            final Future<Integer> taker = pool.submit(() -> {
                started.countDown();
                return buf.take();
            });
            started.await();
            Thread.sleep(BLOCK_CHECK_MILLIS);

            buf.close();
            assertThat(taker.get(1, TimeUnit.SECONDS)).isNull();
        } finally {
            pool.shutdownNow();
        }
    }

    @ParameterizedTest
    @EnumSource(MutexStrategy.class)
    public void testCloseUnblocksWaitingPut(MutexStrategy mutex) throws Exception {
        final var buf = newBuffer(1, mutex);
        buf.put(1);
        final ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            final CountDownLatch started = new CountDownLatch(1);
            final Future<?> putter = pool.submit(() -> {
                started.countDown();
                buf.put(2);
                return null;
            });
            started.await();
            Thread.sleep(BLOCK_CHECK_MILLIS);
            assertThat(putter.isDone()).isFalse();

            buf.close();
            assertThatThrownBy(() -> putter.get(1, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(IllegalStateException.class);
            //the item put before close is still there
            assertThat(buf.take()).isEqualTo(1);
            assertThat(buf.take()).isNull();
        } finally {
            pool.shutdownNow();
        }
    }

    @ParameterizedTest
    @EnumSource(MutexStrategy.class)
    public void testInterruptedTakeLeavesBufferConsistent(MutexStrategy mutex) throws Exception {
        final var buf = newBuffer(2, mutex);
        final ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            final CountDownLatch started = new CountDownLatch(1);
            final Future<Integer> taker = pool.submit(() -> {
                started.countDown();
                return buf.take();
            });
            started.await();
            Thread.sleep(BLOCK_CHECK_MILLIS);
            taker.cancel(true);
        } finally {
            pool.shutdownNow();
            assertThat(pool.awaitTermination(1, TimeUnit.SECONDS)).isTrue();
        }
        final var s = buf.snapshot();
        assertThat(s.freeSlots()).isEqualTo(2);
        assertThat(s.filledSlots()).isZero();
        buf.put(5);
        assertThat(buf.take()).isEqualTo(5);
    }

    @Test
    public void testTraceSeesLogicalSlotIndexes() throws InterruptedException {
        final var trace = new RecordingTrace();
        final var buf = new SemaphoreBoundedBuffer<Integer>(2, new LockMutualExclusion(), trace);
        for (int i = 0; i < 5; i++) {
            buf.put(i);
            buf.take();
        }
        assertThat(trace.events().stream().map(e -> e.slot).collect(Collectors.toList()))
                .containsExactly(0L, 0L, 1L, 1L, 2L, 2L, 3L, 3L, 4L, 4L);
    }

    @Test
    public void testThrowingTraceOnPutLeavesBufferUntouched() throws InterruptedException {
        final var trace = new FailOnceTrace(true);
        final var buf = new SemaphoreBoundedBuffer<Integer>(2, new LockMutualExclusion(), trace);
        assertThatThrownBy(() -> buf.put(1)).isInstanceOf(IllegalStateException.class)
                .hasMessage("trace broke");
        assertInvariant(buf.snapshot(), 0);
        assertThat(buf.snapshot().produced()).isZero();

        buf.put(2);
        buf.put(3);
        assertInvariant(buf.snapshot(), 2);
        assertThat(buf.take()).isEqualTo(2);
        assertThat(buf.take()).isEqualTo(3);
    }

    @Test
    public void testThrowingTraceOnTakeKeepsTheItem() throws InterruptedException {
        final var trace = new FailOnceTrace(false);
        final var buf = new SemaphoreBoundedBuffer<Integer>(2, new LockMutualExclusion(), trace);
        buf.put(1);
        assertThatThrownBy(buf::take).isInstanceOf(IllegalStateException.class)
                .hasMessage("trace broke");
        assertInvariant(buf.snapshot(), 1);

        assertThat(buf.take()).isEqualTo(1);
        assertInvariant(buf.snapshot(), 0);
    }

    /**
     * throws on the first produced() or consumed() call, then behaves
     */
    private static final class FailOnceTrace implements BufferTrace {
        private final boolean onPut;
        private boolean failed;

        FailOnceTrace(boolean onPut) {
            this.onPut = onPut;
        }

        @Override
        public void produced(long slot) {
            if (onPut) {
                failOnce();
            }
        }

        @Override
        public void consumed(long slot) {
            if (!onPut) {
                failOnce();
            }
        }

        private void failOnce() {
            if (!failed) {
                failed = true;
                throw new IllegalStateException("trace broke");
            }
        }
    }
}
