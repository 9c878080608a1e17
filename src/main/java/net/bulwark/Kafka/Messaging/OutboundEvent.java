package net.bulwark.Kafka.Messaging;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event the business function asks to be published downstream once processing succeeds.
 */
public record OutboundEvent(String topic, byte[] key, byte[] value, Map<String, String> headers) {

    public OutboundEvent {
        if (topic == null || topic.isEmpty()) {
            throw new IllegalArgumentException("Topic cannot be null or empty");
        }
        headers = headers == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static OutboundEvent of(String topic, String key, String value, Map<String, String> headers) {
        return new OutboundEvent(topic,
                key == null ? null : key.getBytes(StandardCharsets.UTF_8),
                value == null ? null : value.getBytes(StandardCharsets.UTF_8),
                headers);
    }

    public static OutboundEvent of(String topic, String key, String value) {
        return of(topic, key, value, null);
    }
}
