package net.bulwark.Kafka.Exceptions;

/**
 * A record could not be written to the broker.
 */
public class PublishException extends BulwarkException {

    private final String topic;

    public PublishException(String topic, String message, Throwable cause) {
        super(message, cause);
        this.topic = topic;
    }

    public String getTopic() {
        return topic;
    }
}
