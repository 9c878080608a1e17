package net.bulwark;

import net.bulwark.Kafka.Backoff.BackoffPolicy;
import net.bulwark.Kafka.Exceptions.OperationFailedException;
import net.bulwark.Kafka.Exceptions.RetryCancelledException;
import net.bulwark.Kafka.Retry.RetryExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryExecutorTest {

    private final RetryExecutor retryExecutor = new RetryExecutor();
    private final List<Integer> waits = new ArrayList<>();

    private final BackoffPolicy recordingBackoff = new BackoffPolicy() {
        @Override
        public Duration delay(int attempt) {
            return Duration.ofMillis(100L << attempt);
        }

        @Override
        public void await(int attempt) {
            waits.add(attempt);
        }
    };

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void testReturnsFirstSuccessWithoutWaiting() {
        String result = retryExecutor.execute(attempt -> "ok", 3, recordingBackoff);
        assertEquals("ok", result);
        assertTrue(waits.isEmpty());
    }

    @Test
    void testAlwaysFailingOperationIsCalledMaxRetriesPlusOneTimes() {
        AtomicInteger calls = new AtomicInteger();
        RuntimeException failure = new RuntimeException("boom");

        OperationFailedException thrown = assertThrows(OperationFailedException.class,
                () -> retryExecutor.execute(attempt -> {
                    calls.incrementAndGet();
                    throw failure;
                }, 3, recordingBackoff));

        assertEquals(4, calls.get());
        assertEquals(4, thrown.getAttempts());
        assertSame(failure, thrown.getCause());
        // no wait after the last attempt
        assertEquals(List.of(0, 1, 2), waits);
    }

    @Test
    void testSucceedsOnThirdAttempt() {
        AtomicInteger calls = new AtomicInteger();

        String result = retryExecutor.execute(attempt -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("not yet");
            }
            return "done at " + attempt;
        }, 5, recordingBackoff);

        assertEquals("done at 2", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(0, 1), waits);
    }

    @Test
    void testZeroRetriesMeansSingleCall() {
        AtomicInteger calls = new AtomicInteger();
        assertThrows(OperationFailedException.class, () -> retryExecutor.execute(attempt -> {
            calls.incrementAndGet();
            throw new Exception("checked failure");
        }, 0, recordingBackoff));
        assertEquals(1, calls.get());
        assertTrue(waits.isEmpty());
    }

    @Test
    void testNegativeRetriesRejected() {
        assertThrows(IllegalArgumentException.class, () -> retryExecutor.execute(attempt -> "x", -1, recordingBackoff));
    }

    @Test
    void testInterruptedWaitCancelsRetry() {
        AtomicInteger calls = new AtomicInteger();
        BackoffPolicy interrupting = new BackoffPolicy() {
            @Override
            public Duration delay(int attempt) {
                return Duration.ofSeconds(1);
            }

            @Override
            public void await(int attempt) throws InterruptedException {
                throw new InterruptedException("shutdown");
            }
        };

        RetryCancelledException thrown = assertThrows(RetryCancelledException.class,
                () -> retryExecutor.execute(attempt -> {
                    calls.incrementAndGet();
                    throw new RuntimeException("boom");
                }, 3, interrupting));

        assertEquals(1, calls.get());
        assertEquals(0, thrown.getAttempt());
        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    void testInterruptedThreadDoesNotStartAttempt() {
        AtomicInteger calls = new AtomicInteger();
        Thread.currentThread().interrupt();

        assertThrows(RetryCancelledException.class,
                () -> retryExecutor.execute(attempt -> calls.incrementAndGet(), 3, recordingBackoff));
        assertEquals(0, calls.get());
    }

    @Test
    void testOperationThrowingInterruptedExceptionCancels() {
        assertThrows(RetryCancelledException.class, () -> retryExecutor.execute(attempt -> {
            throw new InterruptedException("interrupted inside");
        }, 3, recordingBackoff));
        assertTrue(waits.isEmpty());
    }
}
