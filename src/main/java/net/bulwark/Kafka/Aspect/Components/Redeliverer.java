package net.bulwark.Kafka.Aspect.Components;

import net.bulwark.Kafka.Aspect.Components.Utility.HeaderUtils;
import net.bulwark.Kafka.Messaging.InboundMessage;
import net.bulwark.Kafka.Messaging.MessagePublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Component responsible for putting a failed message back on its own topic with an incremented
 * retry counter, so the next delivery carries the count forward.
 *
 * The send is synchronous: the original may only be acknowledged once the copy is on the broker.
 */
public class Redeliverer {

    private static final Logger logger = LoggerFactory.getLogger(Redeliverer.class);

    private final MessagePublisher publisher;

    public Redeliverer(MessagePublisher publisher) {
        this.publisher = publisher;
    }

    /**
     * @throws net.bulwark.Kafka.Exceptions.PublishException if the copy could not be sent
     */
    public void redeliver(InboundMessage message, Exception error) {
        int nextRetryCount = message.retryCount() + 1;
        Map<String, String> headers = HeaderUtils.withRetryCount(message.headers(), nextRetryCount);
        headers.put(HeaderUtils.HEADER_LAST_ERROR, HeaderUtils.describe(error));

        publisher.publish(message.topic(), message.key(), message.value(), headers);
        logger.info("redelivered event {} to topic: {} with retryCount: {}",
                message.eventId(), message.topic(), nextRetryCount);
    }
}
