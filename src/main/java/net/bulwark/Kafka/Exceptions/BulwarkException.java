package net.bulwark.Kafka.Exceptions;

/**
 * Root of the exceptions raised by the resilience layer.
 */
public class BulwarkException extends RuntimeException {

    public BulwarkException(String message) {
        super(message);
    }

    public BulwarkException(String message, Throwable cause) {
        super(message, cause);
    }
}
