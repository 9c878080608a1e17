package net.bulwark.Kafka.Processing;

import net.bulwark.Kafka.Messaging.InboundMessage;
import net.bulwark.Kafka.Messaging.OutboundEvent;

import java.util.List;

/**
 * The worker's own transformation of a decoded message. Returns the events to publish downstream
 * (possibly none). Any exception counts as a processing failure.
 */
@FunctionalInterface
public interface BusinessFunction {

    List<OutboundEvent> apply(InboundMessage message) throws Exception;
}
