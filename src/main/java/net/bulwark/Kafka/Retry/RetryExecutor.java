package net.bulwark.Kafka.Retry;

import net.bulwark.Kafka.Backoff.BackoffPolicy;
import net.bulwark.Kafka.Exceptions.OperationFailedException;
import net.bulwark.Kafka.Exceptions.RetryCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an operation, waiting per {@link BackoffPolicy} between failures, for at most
 * {@code maxRetries + 1} calls.
 *
 * Only retries what it is handed (a single publish, a single business call). It knows nothing
 * about message headers or poison status. Stateless, safe to share.
 */
public class RetryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    /**
     * @param operation  called with the 0-based attempt number
     * @param maxRetries retries after the first call, {@code >= 0}
     * @param backoff    wait between a failed attempt and the next one
     * @return the first successful result
     * @throws OperationFailedException wrapping the last failure once all attempts failed
     * @throws RetryCancelledException  if the thread is interrupted while waiting or before an attempt
     */
    public <T> T execute(RetryableOperation<T> operation, int maxRetries, BackoffPolicy backoff) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries must be greater than or equal to 0");
        }

        Exception lastError = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new RetryCancelledException(attempt, new InterruptedException("interrupted before attempt " + attempt));
            }
            try {
                return operation.call(attempt);
            } catch (RetryCancelledException e) {
                // nested executor was cancelled, do not count it as a failure
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RetryCancelledException(attempt, e);
            } catch (Exception e) {
                lastError = e;
                if (attempt < maxRetries) {
                    logger.warn("Operation failed, retrying... ({}/{}): {}", attempt + 1, maxRetries, e.getMessage());
                    try {
                        backoff.await(attempt);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        logger.info("Retry cancelled while waiting after attempt {}", attempt);
                        throw new RetryCancelledException(attempt, ie);
                    }
                }
            }
        }

        logger.error("Operation failed after {} attempts", maxRetries + 1);
        throw new OperationFailedException(maxRetries + 1, lastError);
    }
}
