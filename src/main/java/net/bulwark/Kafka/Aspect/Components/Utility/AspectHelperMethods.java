package net.bulwark.Kafka.Aspect.Components.Utility;

import lombok.experimental.UtilityClass;
import net.bulwark.Kafka.Messaging.OutboundEvent;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.slf4j.Logger;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;


/*
    METHODS USED BY ResilientListenerAspect
 */
@UtilityClass
public class AspectHelperMethods {

    private static final Logger logger = org.slf4j.LoggerFactory.getLogger(AspectHelperMethods.class);

    public Acknowledgment extractAcknowledgment(Object[] args) {
        for (Object arg : args) {
            if (arg instanceof Acknowledgment) {
                return (Acknowledgment) arg;
            }
        }
        return null;
    }

    /**
     * Extracts the first ConsumerRecord from the method arguments.
     *
     * @return ConsumerRecord if present, null otherwise
     */
    public ConsumerRecord<?, ?> extractConsumerRecord(Object[] args) {
        for (Object arg : args) {
            if (arg instanceof ConsumerRecord<?, ?>) {
                return (ConsumerRecord<?, ?>) arg;
            }
        }
        return null;
    }

    /**
     * Reads the delivery attempt the listener container adds when
     * {@code ContainerProperties.setDeliveryAttemptHeader(true)} is on. The header is a 4-byte big-endian int.
     *
     * @return the attempt, 1 on first delivery, or 0 when the header is absent or malformed
     */
    public int deliveryAttempt(ConsumerRecord<?, ?> record) {
        Header header = record.headers().lastHeader(KafkaHeaders.DELIVERY_ATTEMPT);
        if (header == null || header.value() == null || header.value().length != Integer.BYTES) {
            return 0;
        }
        return Math.max(0, ByteBuffer.wrap(header.value()).getInt());
    }

    /**
     * Converts a listener return value into the events to publish.
     * Accepts null, a single OutboundEvent or a collection of them; anything else is ignored with a warning.
     */
    public List<OutboundEvent> toOutboundEvents(Object result) {
        if (result == null) {
            return Collections.emptyList();
        }
        if (result instanceof OutboundEvent event) {
            return List.of(event);
        }
        if (result instanceof Collection<?> collection) {
            List<OutboundEvent> events = new ArrayList<>(collection.size());
            for (Object element : collection) {
                if (element instanceof OutboundEvent event) {
                    events.add(event);
                } else if (element != null) {
                    logger.warn("ignoring listener result element of type {}, expected OutboundEvent",
                            element.getClass().getName());
                }
            }
            return events;
        }
        logger.warn("ignoring listener result of type {}, expected OutboundEvent or a collection of them",
                result.getClass().getName());
        return Collections.emptyList();
    }
}
