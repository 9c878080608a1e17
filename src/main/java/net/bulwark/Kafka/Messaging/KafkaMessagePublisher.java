package net.bulwark.Kafka.Messaging;

import net.bulwark.Kafka.Aspect.Components.Utility.HeaderUtils;
import net.bulwark.Kafka.Exceptions.PublishException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link MessagePublisher} backed by a byte-array {@link KafkaTemplate}. Sends are synchronous:
 * the call waits for the broker ack so a failure surfaces before the input is acknowledged.
 */
public class KafkaMessagePublisher implements MessagePublisher {

    private static final Logger logger = LoggerFactory.getLogger(KafkaMessagePublisher.class);

    private final KafkaTemplate<byte[], byte[]> kafkaTemplate;
    private final Duration sendTimeout;

    public KafkaMessagePublisher(KafkaTemplate<byte[], byte[]> kafkaTemplate, Duration sendTimeout) {
        this.kafkaTemplate = kafkaTemplate;
        this.sendTimeout = sendTimeout;
    }

    @Override
    public void publish(String topic, byte[] key, byte[] value, Map<String, String> headers) {
        logger.debug("sending to topic: {}", topic);
        ProducerRecord<byte[], byte[]> record =
                new ProducerRecord<>(topic, null, null, key, value, HeaderUtils.toHeaders(headers));
        try {
            SendResult<byte[], byte[]> result = kafkaTemplate.send(record)
                    .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result != null && result.getRecordMetadata() != null) {
                logger.debug("sent to topic: {} partition: {} offset: {}", topic,
                        result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishException(topic, "interrupted while sending to topic: " + topic, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("failed to send to topic: {} with exception: {}", topic, cause.getMessage());
            throw new PublishException(topic, "failed to send to kafka topic: " + topic, cause);
        } catch (TimeoutException e) {
            logger.error("timed out after {} sending to topic: {}", sendTimeout, topic);
            throw new PublishException(topic, "timed out sending to kafka topic: " + topic, e);
        } catch (RuntimeException e) {
            logger.error("failed to send to topic: {} with exception: {}", topic, e.getMessage());
            throw new PublishException(topic, "failed to send to kafka topic: " + topic, e);
        }
    }
}
