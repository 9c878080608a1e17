package net.bulwark.Kafka.Exceptions;

/**
 * A backoff wait was interrupted (shutdown). Not a processing failure: callers
 * must not count it against the retry budget.
 */
public class RetryCancelledException extends BulwarkException {

    private final int attempt;

    public RetryCancelledException(int attempt, InterruptedException cause) {
        super("retry cancelled while waiting after attempt " + attempt, cause);
        this.attempt = attempt;
    }

    public int getAttempt() {
        return attempt;
    }
}
