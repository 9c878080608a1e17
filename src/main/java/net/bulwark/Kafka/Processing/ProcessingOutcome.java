package net.bulwark.Kafka.Processing;

import net.bulwark.Kafka.DeadLetter.DeadLetterEnvelope;

/**
 * Terminal result of processing one delivery. Exactly one of {@link Acked}, {@link RetrySignaled}
 * or {@link DeadLettered}.
 */
public interface ProcessingOutcome {

    enum Status {
        ACKED,
        RETRY_SIGNALED,
        DEAD_LETTERED
    }

    Status status();

    /**
     * Whether the consumer should commit past the message.
     */
    default boolean shouldAcknowledge() {
        return status() != Status.RETRY_SIGNALED;
    }

    static ProcessingOutcome acked() {
        return Acked.PROCESSED;
    }

    static ProcessingOutcome duplicate() {
        return Acked.DUPLICATE;
    }

    /**
     * The message was handled, now or by an earlier delivery ({@code duplicate}).
     */
    record Acked(boolean duplicate) implements ProcessingOutcome {

        static final Acked PROCESSED = new Acked(false);
        static final Acked DUPLICATE = new Acked(true);

        @Override
        public Status status() {
            return Status.ACKED;
        }
    }

    /**
     * Processing failed below the retry bound. The consumer must not acknowledge so that the
     * broker redelivers the message.
     */
    record RetrySignaled(Exception error) implements ProcessingOutcome {

        @Override
        public Status status() {
            return Status.RETRY_SIGNALED;
        }
    }

    /**
     * The message was published to the dead-letter topic and may be acknowledged.
     */
    record DeadLettered(DeadLetterEnvelope envelope) implements ProcessingOutcome {

        @Override
        public Status status() {
            return Status.DEAD_LETTERED;
        }
    }
}
