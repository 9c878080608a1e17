package net.bulwark;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import net.bulwark.Kafka.Annotations.ResilientKafkaListener;
import net.bulwark.Kafka.Config.BulwarkAutoConfiguration;
import net.bulwark.Kafka.DeadLetter.DeadLetterEnvelope;
import net.bulwark.Kafka.Exceptions.TransientBusinessException;
import net.bulwark.Kafka.Messaging.OutboundEvent;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.test.EmbeddedKafkaBroker;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.stereotype.Component;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SpringExtension.class)
@SpringBootTest(
        classes = {
                ResilientListenerIntegrationTest.TestConfig.class,
                ResilientListenerIntegrationTest.OrderListener.class,
                ResilientListenerIntegrationTest.TopicCollector.class,
                BulwarkAutoConfiguration.class
        },
        properties = {
                "bulwark.kafka.service-name=order-service",
                "bulwark.kafka.max-retries=3"
        }
)
@EmbeddedKafka(
        partitions = 1,
        topics = {"bulwark-it-orders", "bulwark-it-dlq", "bulwark-it-out"},
        bootstrapServersProperty = "spring.kafka.bootstrap-servers"
)
@DirtiesContext
class ResilientListenerIntegrationTest {

    @Autowired
    private KafkaTemplate<String, String> testKafkaTemplate;

    @Autowired
    private OrderListener orderListener;

    @Autowired
    private TopicCollector collector;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    private void send(String eventId, String value) throws Exception {
        ProducerRecord<String, String> record = new ProducerRecord<>("bulwark-it-orders", "order-key", value);
        record.headers().add("eventId", eventId.getBytes(StandardCharsets.UTF_8));
        testKafkaTemplate.send(record).get(10, TimeUnit.SECONDS);
    }

    @Test
    void testPermanentFailureEndsInDeadLetterTopic() throws Exception {
        String eventId = "fail-" + UUID.randomUUID();
        send(eventId, "fail");

        await().atMost(30, TimeUnit.SECONDS)
                .pollInterval(200, TimeUnit.MILLISECONDS)
                .untilAsserted(() -> assertNotNull(collector.deadLetterFor(eventId, objectMapper)));

        DeadLetterEnvelope envelope = collector.deadLetterFor(eventId, objectMapper);
        assertEquals(4, envelope.getRetryCount());
        assertEquals("bulwark-it-orders", envelope.getOriginalTopic());
        assertEquals("order-key", envelope.getOriginalKey());
        assertEquals("fail", envelope.getOriginalValue());
        assertEquals("max retries exceeded", envelope.getErrorMessage());
        assertEquals("order-service", envelope.getServiceName());
        // deliveries with retryCount 0, 1 and 2 reach the business code, the one with 3 does not
        assertEquals(3, orderListener.invocations(eventId));
    }

    @Test
    void testDuplicateEventIsProcessedOnce() throws Exception {
        String eventId = "dup-" + UUID.randomUUID();
        send(eventId, "ok");
        send(eventId, "ok");

        await().atMost(20, TimeUnit.SECONDS)
                .untilAsserted(() -> assertEquals(1, collector.outputsFor(eventId)));

        TimeUnit.SECONDS.sleep(2);
        assertEquals(1, orderListener.invocations(eventId));
        assertEquals(1, collector.outputsFor(eventId));
    }

    @Test
    void testTransientFailureRecoversOnRedelivery() throws Exception {
        String eventId = "flaky-" + UUID.randomUUID();
        send(eventId, "flaky");

        await().atMost(20, TimeUnit.SECONDS)
                .untilAsserted(() -> assertEquals(1, collector.outputsFor(eventId)));

        assertEquals(2, orderListener.invocations(eventId));
        assertNull(collector.deadLetterFor(eventId, objectMapper));
    }

    @Component
    public static class OrderListener {

        private final Map<String, AtomicInteger> invocations = new ConcurrentHashMap<>();

        @ResilientKafkaListener(topic = "bulwark-it-orders", deadLetterTopic = "bulwark-it-dlq")
        @KafkaListener(
                topics = "bulwark-it-orders",
                groupId = "bulwark-it-orders-group",
                containerFactory = "bulwarkTestContainerFactory"
        )
        public OutboundEvent listen(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
            String eventId = new String(record.headers().lastHeader("eventId").value(), StandardCharsets.UTF_8);
            int attempt = invocations.computeIfAbsent(eventId, k -> new AtomicInteger()).incrementAndGet();

            if ("fail".equals(record.value())) {
                throw new TransientBusinessException("order store unavailable");
            }
            if ("flaky".equals(record.value()) && attempt == 1) {
                throw new TransientBusinessException("lock timeout");
            }
            return OutboundEvent.of("bulwark-it-out", record.key(), "processed",
                    Map.of("eventId", eventId));
        }

        public int invocations(String eventId) {
            AtomicInteger count = invocations.get(eventId);
            return count == null ? 0 : count.get();
        }
    }

    @Component
    public static class TopicCollector {

        private final List<ConsumerRecord<String, String>> deadLetters = new CopyOnWriteArrayList<>();
        private final List<ConsumerRecord<String, String>> outputs = new CopyOnWriteArrayList<>();

        @KafkaListener(topics = "bulwark-it-dlq", groupId = "bulwark-it-dlq-group",
                containerFactory = "bulwarkCollectorContainerFactory")
        public void collectDeadLetter(ConsumerRecord<String, String> record) {
            deadLetters.add(record);
        }

        @KafkaListener(topics = "bulwark-it-out", groupId = "bulwark-it-out-group",
                containerFactory = "bulwarkCollectorContainerFactory")
        public void collectOutput(ConsumerRecord<String, String> record) {
            outputs.add(record);
        }

        DeadLetterEnvelope deadLetterFor(String eventId, ObjectMapper objectMapper) throws Exception {
            for (ConsumerRecord<String, String> record : deadLetters) {
                if (eventId.equals(header(record, "eventId"))) {
                    return objectMapper.readValue(record.value(), DeadLetterEnvelope.class);
                }
            }
            return null;
        }

        long outputsFor(String eventId) {
            return outputs.stream().filter(record -> eventId.equals(header(record, "eventId"))).count();
        }

        private static String header(ConsumerRecord<String, String> record, String name) {
            Header header = record.headers().lastHeader(name);
            return header == null ? null : new String(header.value(), StandardCharsets.UTF_8);
        }
    }

    @Configuration
    @EnableKafka
    public static class TestConfig {

        private static Map<String, Object> consumerProps(EmbeddedKafkaBroker embeddedKafka) {
            Map<String, Object> props = new HashMap<>();
            props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, embeddedKafka.getBrokersAsString());
            props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
            props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
            return props;
        }

        @Bean
        public ConsumerFactory<String, String> bulwarkTestConsumerFactory(EmbeddedKafkaBroker embeddedKafka) {
            return new DefaultKafkaConsumerFactory<>(consumerProps(embeddedKafka),
                    new StringDeserializer(), new StringDeserializer());
        }

        @Bean(name = "bulwarkTestContainerFactory")
        public ConcurrentKafkaListenerContainerFactory<String, String> bulwarkTestContainerFactory(
                ConsumerFactory<String, String> bulwarkTestConsumerFactory) {
            ConcurrentKafkaListenerContainerFactory<String, String> factory =
                    new ConcurrentKafkaListenerContainerFactory<>();
            factory.setConsumerFactory(bulwarkTestConsumerFactory);
            factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL);
            return factory;
        }

        @Bean(name = "bulwarkCollectorContainerFactory")
        public ConcurrentKafkaListenerContainerFactory<String, String> bulwarkCollectorContainerFactory(
                ConsumerFactory<String, String> bulwarkTestConsumerFactory) {
            ConcurrentKafkaListenerContainerFactory<String, String> factory =
                    new ConcurrentKafkaListenerContainerFactory<>();
            factory.setConsumerFactory(bulwarkTestConsumerFactory);
            return factory;
        }

        @Bean
        public KafkaTemplate<String, String> testKafkaTemplate(EmbeddedKafkaBroker embeddedKafka) {
            Map<String, Object> props = new HashMap<>();
            props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, embeddedKafka.getBrokersAsString());
            props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
            props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
            return new KafkaTemplate<>(new DefaultKafkaProducerFactory<>(props));
        }
    }
}
