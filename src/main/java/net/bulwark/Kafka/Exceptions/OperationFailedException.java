package net.bulwark.Kafka.Exceptions;

/**
 * Raised by the retry executor once every attempt has failed. The cause is the
 * failure of the last attempt.
 */
public class OperationFailedException extends BulwarkException {

    private final int attempts;

    public OperationFailedException(int attempts, Throwable cause) {
        super("operation failed after " + attempts + " attempt(s): " + cause.getMessage(), cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
