package net.bulwark.Kafka.Messaging;

import net.bulwark.Kafka.Exceptions.PublishException;

import java.util.Map;

/**
 * Producer side of the broker client. Implementations must only return once the broker has
 * accepted the record, so that callers can acknowledge the input afterwards.
 */
public interface MessagePublisher {

    /**
     * Publishes one record.
     *
     * @param topic   destination topic
     * @param key     partitioning key, may be null
     * @param value   serialized payload
     * @param headers string headers, written in iteration order
     * @throws PublishException if the record could not be written
     */
    void publish(String topic, byte[] key, byte[] value, Map<String, String> headers);
}
