package net.bulwark.Kafka.DeadLetter;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.bulwark.Kafka.Aspect.Components.Utility.HeaderUtils;
import net.bulwark.Kafka.Exceptions.RoutingFailedException;
import net.bulwark.Kafka.Messaging.InboundMessage;
import net.bulwark.Kafka.Messaging.MessagePublisher;
import net.bulwark.Kafka.Tracing.TracingService;
import net.bulwark.Kafka.Tracing.TracingSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Component responsible for routing failed messages to the dead-letter topic.
 *
 * The envelope is JSON and keyed with the original key so it lands on the same dead-letter
 * partition as its siblings. A failed publish is never swallowed: the caller gets a
 * {@link RoutingFailedException} and must not acknowledge the input.
 */
public class DeadLetterRouter {

    private static final Logger logger = LoggerFactory.getLogger(DeadLetterRouter.class);

    static final int MAX_STACK_TRACE_LENGTH = 4000;

    private final MessagePublisher publisher;
    private final ObjectMapper objectMapper;
    private final TracingService tracingService;
    private final Clock clock;

    public DeadLetterRouter(MessagePublisher publisher, ObjectMapper objectMapper,
                            TracingService tracingService, Clock clock) {
        this.publisher = publisher;
        this.objectMapper = objectMapper;
        this.tracingService = tracingService;
        this.clock = clock;
    }

    /**
     * Publishes {@code message} wrapped in a {@link DeadLetterEnvelope} to {@code destination}.
     *
     * @param message     the delivery being given up on
     * @param error       why it is being given up on
     * @param serviceName written to the envelope and the {@code dlqService} header
     * @param destination the dead-letter topic
     * @return the envelope that was published
     * @throws RoutingFailedException if the envelope could not be serialized or published
     */
    public DeadLetterEnvelope route(InboundMessage message, Throwable error, String serviceName, String destination) {
        DeadLetterEnvelope envelope = buildEnvelope(message, error, serviceName);

        TracingSpan span = tracingService.startDeadLetterSpan(message.topic(), destination,
                message.eventId(), envelope.getRetryCount(), envelope.getErrorMessage());
        try {
            byte[] payload = objectMapper.writeValueAsBytes(envelope);
            publisher.publish(destination, message.key(), payload, buildHeaders(message, envelope));
            span.setSuccess();

            logger.info("sent event {} from topic: {} partition: {} offset: {} to dlq: {} (retryCount={}, reason={})",
                    message.eventId(), message.topic(), message.partition(), message.offset(),
                    destination, envelope.getRetryCount(), envelope.getErrorMessage());
            return envelope;
        } catch (Exception e) {
            span.recordException(e);
            logger.error("failed to send event {} from topic: {} offset: {} to dlq: {}: {}",
                    message.eventId(), message.topic(), message.offset(), destination, e.getMessage());
            throw new RoutingFailedException(destination, message.eventId(), e);
        } finally {
            span.end();
        }
    }

    DeadLetterEnvelope buildEnvelope(InboundMessage message, Throwable error, String serviceName) {
        return DeadLetterEnvelope.builder()
                .originalTopic(message.topic())
                .originalPartition(message.partition())
                .originalOffset(message.offset())
                .originalKey(message.keyAsString())
                .originalValue(message.valueAsString())
                .originalHeaders(message.headers())
                .errorMessage(error != null && error.getMessage() != null ? error.getMessage() : HeaderUtils.describe(error))
                .errorKind(error != null ? error.getClass().getSimpleName() : "Unknown")
                .errorStackTrace(stackTraceOf(error))
                .serviceName(serviceName)
                .dlqTimestamp(Instant.now(clock))
                .retryCount(message.retryCount() + 1)
                .build();
    }

    private static Map<String, String> buildHeaders(InboundMessage message, DeadLetterEnvelope envelope) {
        Map<String, String> headers = new LinkedHashMap<>(message.headers());
        headers.put(HeaderUtils.HEADER_DLQ_REASON, envelope.getErrorMessage());
        headers.put(HeaderUtils.HEADER_DLQ_SERVICE, envelope.getServiceName());
        headers.put(HeaderUtils.HEADER_DLQ_TIMESTAMP, envelope.getDlqTimestamp().toString());
        headers.put(HeaderUtils.HEADER_DLQ_ERROR_KIND, envelope.getErrorKind());
        headers.put(HeaderUtils.HEADER_RETRY_COUNT, String.valueOf(envelope.getRetryCount()));
        return headers;
    }

    private static String stackTraceOf(Throwable error) {
        if (error == null) {
            return null;
        }
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        String trace = writer.toString();
        return trace.length() > MAX_STACK_TRACE_LENGTH ? trace.substring(0, MAX_STACK_TRACE_LENGTH) : trace;
    }
}
