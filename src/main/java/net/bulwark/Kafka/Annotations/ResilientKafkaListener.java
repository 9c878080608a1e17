package net.bulwark.Kafka.Annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation to run a Kafka listener through the resilience layer: poison check,
 * deduplication, retry signalling and dead-letter routing.
 *
 * Must be used alongside Spring's {@code @KafkaListener} annotation with manual
 * acknowledgment. The method takes a {@code ConsumerRecord<?, ?>} and an
 * {@code Acknowledgment}; it may return {@code List<OutboundEvent>}, a single
 * {@code OutboundEvent} or nothing.
 *
 * String attributes left empty and numeric attributes left negative fall back to the
 * {@code bulwark.kafka.*} properties.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface ResilientKafkaListener {

    /** The Kafka topic this listener consumes from. */
    String topic() default "";

    /** The dead-letter topic for failed messages. */
    String deadLetterTopic() default "";

    /** Written into dead-letter envelopes. */
    String serviceName() default "";

    /** Deliveries allowed to fail before dead-lettering. */
    int maxRetries() default -1;

    /** Skip messages whose eventId was already seen. Default: true */
    boolean deDuplication() default true;

    /** In-process retries of one delivery. */
    int inlineRetries() default -1;

    /**
     * Republish a failed message to its own topic with an incremented retryCount and acknowledge
     * the original. When false the failure is rethrown to the container's error handler instead, and
     * the retry count is taken from the container's delivery attempt header, so the container must
     * have {@code deliveryAttemptHeader} enabled (the auto-configuration does this) and its error
     * handler must allow more than maxRetries attempts for the message to reach the dead-letter topic.
     */
    boolean redeliver() default true;
}
