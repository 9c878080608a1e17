package net.bulwark;

import net.bulwark.Kafka.Annotations.ResilientKafkaListener;
import net.bulwark.Kafka.Config.ProcessingConfig;
import net.bulwark.Kafka.Config.ResilienceProperties;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;

import static org.junit.jupiter.api.Assertions.*;

class ProcessingConfigTest {

    @ResilientKafkaListener(topic = "orders")
    void defaultsListener() {
    }

    @ResilientKafkaListener(topic = "orders", deadLetterTopic = "orders-dlq", serviceName = "order-service",
            maxRetries = 5, inlineRetries = 2, deDuplication = false)
    void overridingListener() {
    }

    @ResilientKafkaListener(topic = "orders", deadLetterTopic = "orders")
    void sameTopicListener() {
    }

    private static ResilientKafkaListener annotation(String methodName) throws NoSuchMethodException {
        Method method = ProcessingConfigTest.class.getDeclaredMethod(methodName);
        return method.getAnnotation(ResilientKafkaListener.class);
    }

    @Test
    void testPropertyDefaults() {
        ProcessingConfig config = ProcessingConfig.fromProperties(new ResilienceProperties());

        assertEquals(3, config.getMaxRetries());
        assertEquals("dlq", config.getDeadLetterTopic());
        assertEquals("bulwark-worker", config.getServiceName());
        assertEquals(0, config.getInlineRetries());
        assertTrue(config.isDeDuplication());
    }

    @Test
    void testUnsetAnnotationAttributesFallBackToProperties() throws Exception {
        ResilienceProperties properties = new ResilienceProperties();
        properties.setMaxRetries(7);
        properties.setDeadLetterDestination("global-dlq");

        ProcessingConfig config = ProcessingConfig.fromAnnotation(annotation("defaultsListener"), properties);

        assertEquals(7, config.getMaxRetries());
        assertEquals("global-dlq", config.getDeadLetterTopic());
        assertEquals("bulwark-worker", config.getServiceName());
    }

    @Test
    void testAnnotationOverridesProperties() throws Exception {
        ProcessingConfig config = ProcessingConfig.fromAnnotation(annotation("overridingListener"), new ResilienceProperties());

        assertEquals(5, config.getMaxRetries());
        assertEquals("orders-dlq", config.getDeadLetterTopic());
        assertEquals("order-service", config.getServiceName());
        assertEquals(2, config.getInlineRetries());
        assertFalse(config.isDeDuplication());
    }

    @Test
    void testTopicAndDeadLetterTopicMustDiffer() throws Exception {
        ResilientKafkaListener same = annotation("sameTopicListener");
        assertThrows(IllegalArgumentException.class,
                () -> ProcessingConfig.fromAnnotation(same, new ResilienceProperties()));
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () -> ProcessingConfig.builder().maxRetries(-1));
        assertThrows(IllegalArgumentException.class, () -> ProcessingConfig.builder().deadLetterTopic(""));
        assertThrows(IllegalArgumentException.class, () -> ProcessingConfig.builder().inlineRetries(-1));
    }
}
