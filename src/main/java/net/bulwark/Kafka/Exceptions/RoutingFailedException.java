package net.bulwark.Kafka.Exceptions;

/**
 * The dead-letter publish itself failed. Fatal for the current delivery: the
 * message must stay unacknowledged so it is not lost.
 */
public class RoutingFailedException extends BulwarkException {

    private final String deadLetterTopic;
    private final String eventId;

    public RoutingFailedException(String deadLetterTopic, String eventId, Throwable cause) {
        super("failed to route event " + eventId + " to dead-letter topic " + deadLetterTopic, cause);
        this.deadLetterTopic = deadLetterTopic;
        this.eventId = eventId;
    }

    public String getDeadLetterTopic() {
        return deadLetterTopic;
    }

    public String getEventId() {
        return eventId;
    }
}
