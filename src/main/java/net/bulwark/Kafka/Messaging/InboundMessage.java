package net.bulwark.Kafka.Messaging;

import net.bulwark.Kafka.Aspect.Components.Utility.HeaderUtils;
import org.apache.kafka.clients.consumer.ConsumerRecord;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One delivery of a record from an assigned partition. Immutable: byte arrays are copied in and out,
 * headers are an unmodifiable ordered map.
 *
 * The retry counter is validated once, at construction, so every consumer of the message sees the
 * same non-negative value.
 */
public final class InboundMessage {

    private final String topic;
    private final int partition;
    private final long offset;
    private final byte[] key;
    private final byte[] value;
    private final Map<String, String> headers;
    private final String eventId;
    private final int retryCount;

    private InboundMessage(Builder builder) {
        if (builder.topic == null || builder.topic.isEmpty()) {
            throw new IllegalArgumentException("Topic cannot be null or empty");
        }
        if (builder.partition < 0) {
            throw new IllegalArgumentException("Partition must be greater than or equal to 0");
        }
        this.topic = builder.topic;
        this.partition = builder.partition;
        this.offset = builder.offset;
        this.key = builder.key == null ? null : builder.key.clone();
        this.value = builder.value == null ? new byte[0] : builder.value.clone();
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.eventId = HeaderUtils.parseEventId(this.headers.get(HeaderUtils.HEADER_EVENT_ID));
        this.retryCount = HeaderUtils.parseRetryCount(this.headers.get(HeaderUtils.HEADER_RETRY_COUNT));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Adapts a consumed Kafka record. Keys and values that are not byte arrays are converted with
     * {@code toString()} as UTF-8, which covers the String and JSON-string deserializers.
     */
    public static InboundMessage fromRecord(ConsumerRecord<?, ?> record) {
        return builder()
                .topic(record.topic())
                .partition(record.partition())
                .offset(record.offset())
                .key(toBytes(record.key()))
                .value(toBytes(record.value()))
                .headers(HeaderUtils.toMap(record.headers()))
                .build();
    }

    private static byte[] toBytes(Object payload) {
        if (payload == null) {
            return null;
        }
        if (payload instanceof byte[] bytes) {
            return bytes;
        }
        return payload.toString().getBytes(StandardCharsets.UTF_8);
    }

    public String topic() {
        return topic;
    }

    public int partition() {
        return partition;
    }

    public long offset() {
        return offset;
    }

    public byte[] key() {
        return key == null ? null : key.clone();
    }

    public byte[] value() {
        return value.clone();
    }

    public Map<String, String> headers() {
        return headers;
    }

    /** The {@code eventId} header, or null when absent or blank. */
    public String eventId() {
        return eventId;
    }

    /** The {@code retryCount} header as a non-negative int (0 when missing or malformed). */
    public int retryCount() {
        return retryCount;
    }

    public String keyAsString() {
        return key == null ? null : new String(key, StandardCharsets.UTF_8);
    }

    public String valueAsString() {
        return new String(value, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InboundMessage that = (InboundMessage) o;
        return partition == that.partition
                && offset == that.offset
                && topic.equals(that.topic)
                && Arrays.equals(key, that.key)
                && Arrays.equals(value, that.value)
                && headers.equals(that.headers);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(topic, partition, offset, headers);
        result = 31 * result + Arrays.hashCode(key);
        result = 31 * result + Arrays.hashCode(value);
        return result;
    }

    @Override
    public String toString() {
        return "InboundMessage{" +
                "topic='" + topic + '\'' +
                ", partition=" + partition +
                ", offset=" + offset +
                ", eventId='" + eventId + '\'' +
                ", retryCount=" + retryCount +
                '}';
    }

    public static final class Builder {

        private String topic;
        private int partition;
        private long offset;
        private byte[] key;
        private byte[] value;
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder topic(String topic) {
            this.topic = topic;
            return this;
        }

        public Builder partition(int partition) {
            this.partition = partition;
            return this;
        }

        public Builder offset(long offset) {
            this.offset = offset;
            return this;
        }

        public Builder key(byte[] key) {
            this.key = key;
            return this;
        }

        public Builder key(String key) {
            this.key = key == null ? null : key.getBytes(StandardCharsets.UTF_8);
            return this;
        }

        public Builder value(byte[] value) {
            this.value = value;
            return this;
        }

        public Builder value(String value) {
            this.value = value == null ? null : value.getBytes(StandardCharsets.UTF_8);
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            if (headers != null) {
                this.headers.putAll(headers);
            }
            return this;
        }

        public InboundMessage build() {
            return new InboundMessage(this);
        }
    }
}
