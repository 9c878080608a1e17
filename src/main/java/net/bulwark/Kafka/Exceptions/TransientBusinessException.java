package net.bulwark.Kafka.Exceptions;

/**
 * Thrown by business code for a failure that may succeed on a later attempt
 * (downstream timeout, lock contention, ...). The message is redelivered while
 * the retry budget lasts.
 */
public class TransientBusinessException extends BulwarkException {

    public TransientBusinessException(String message) {
        super(message);
    }

    public TransientBusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
