package net.bulwark.Kafka.Config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import net.bulwark.Kafka.Aspect.Components.Redeliverer;
import net.bulwark.Kafka.Aspect.Components.Utility.MetricsRecorder;
import net.bulwark.Kafka.Aspect.Components.Utility.MicrometerMetricsRecorder;
import net.bulwark.Kafka.Aspect.Components.Utility.NoOpMetricsRecorder;
import net.bulwark.Kafka.Aspect.ResilientListenerAspect;
import net.bulwark.Kafka.Backoff.BackoffPolicy;
import net.bulwark.Kafka.Backoff.ExponentialBackoff;
import net.bulwark.Kafka.DeadLetter.DeadLetterRouter;
import net.bulwark.Kafka.Deduplication.EventDeduplicator;
import net.bulwark.Kafka.Messaging.KafkaMessagePublisher;
import net.bulwark.Kafka.Messaging.MessagePublisher;
import net.bulwark.Kafka.Processing.ProcessingStateMachine;
import net.bulwark.Kafka.Retry.RetryExecutor;
import net.bulwark.Kafka.Tracing.NoOpTracingService;
import net.bulwark.Kafka.Tracing.OpenTelemetryTracingService;
import net.bulwark.Kafka.Tracing.TracingService;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.kafka.config.ContainerCustomizer;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Auto-configuration for the Bulwark resilience layer.
 * Provides default beans that users can override if needed.
 *
 * Can be disabled by setting: bulwark.kafka.auto-config.enabled=false
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
})
@EnableAspectJAutoProxy
@EnableConfigurationProperties(ResilienceProperties.class)
@ConditionalOnProperty(
        prefix = "bulwark.kafka.auto-config",
        name = "enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class BulwarkAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(BulwarkAutoConfiguration.class);

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Bean
    @ConditionalOnMissingBean
    public Clock bulwarkClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventDeduplicator eventDeduplicator(ResilienceProperties properties, Clock clock) {
        return new EventDeduplicator(properties.getDedupTtl(), properties.getDedupMaxSize(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public BackoffPolicy backoffPolicy(ResilienceProperties properties) {
        return new ExponentialBackoff(properties.getBackoffInitial(), properties.getBackoffMax(),
                properties.getBackoffMultiplier());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryExecutor retryExecutor() {
        return new RetryExecutor();
    }

    /**
     * ObjectMapper for dead-letter envelopes. Timestamps are written as ISO-8601 strings.
     */
    @Bean(name = "bulwarkObjectMapper")
    @ConditionalOnMissingBean(name = "bulwarkObjectMapper")
    public ObjectMapper bulwarkObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean(name = "bulwarkProducerFactory")
    @ConditionalOnMissingBean(name = "bulwarkProducerFactory")
    public ProducerFactory<byte[], byte[]> bulwarkProducerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean(name = "bulwarkKafkaTemplate")
    @ConditionalOnMissingBean(name = "bulwarkKafkaTemplate")
    public KafkaTemplate<byte[], byte[]> bulwarkKafkaTemplate(
            @Qualifier("bulwarkProducerFactory") ProducerFactory<byte[], byte[]> bulwarkProducerFactory) {
        return new KafkaTemplate<>(bulwarkProducerFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    public MessagePublisher messagePublisher(@Qualifier("bulwarkKafkaTemplate") KafkaTemplate<byte[], byte[]> bulwarkKafkaTemplate,
                                             ResilienceProperties properties) {
        return new KafkaMessagePublisher(bulwarkKafkaTemplate, properties.getPublishTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterRouter deadLetterRouter(MessagePublisher messagePublisher,
                                             @Qualifier("bulwarkObjectMapper") ObjectMapper bulwarkObjectMapper,
                                             TracingService tracingService,
                                             Clock clock) {
        return new DeadLetterRouter(messagePublisher, bulwarkObjectMapper, tracingService, clock);
    }

    /**
     * Fallback when Micrometer or a MeterRegistry is absent.
     */
    @Bean
    @ConditionalOnMissingBean(MetricsRecorder.class)
    public MetricsRecorder noOpMetricsRecorder() {
        logger.info("MeterRegistry not available - Bulwark metrics are disabled");
        return new NoOpMetricsRecorder();
    }

    /**
     * Fallback when OpenTelemetry is not on the classpath.
     */
    @Bean
    @ConditionalOnMissingBean(TracingService.class)
    public TracingService noOpTracingService() {
        return new NoOpTracingService();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessingStateMachine processingStateMachine(EventDeduplicator eventDeduplicator,
                                                         RetryExecutor retryExecutor,
                                                         BackoffPolicy backoffPolicy,
                                                         DeadLetterRouter deadLetterRouter,
                                                         MessagePublisher messagePublisher,
                                                         MetricsRecorder metricsRecorder,
                                                         TracingService tracingService) {
        return new ProcessingStateMachine(eventDeduplicator, retryExecutor, backoffPolicy, deadLetterRouter,
                messagePublisher, metricsRecorder, tracingService);
    }

    @Bean
    @ConditionalOnMissingBean
    public Redeliverer redeliverer(MessagePublisher messagePublisher) {
        return new Redeliverer(messagePublisher);
    }

    /**
     * Makes listener containers stamp each record with its delivery attempt, which listeners using
     * {@code redeliver = false} need for poison detection. Applied by Spring Boot's listener container factory.
     */
    @Bean
    @ConditionalOnMissingBean(ContainerCustomizer.class)
    public ContainerCustomizer<Object, Object, ConcurrentMessageListenerContainer<Object, Object>> bulwarkDeliveryAttemptCustomizer() {
        return container -> container.getContainerProperties().setDeliveryAttemptHeader(true);
    }

    @Bean
    @ConditionalOnMissingBean
    public ResilientListenerAspect resilientListenerAspect(ProcessingStateMachine processingStateMachine,
                                                           Redeliverer redeliverer,
                                                           ResilienceProperties properties) {
        return new ResilientListenerAspect(processingStateMachine, redeliverer, properties);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "io.micrometer.core.instrument.MeterRegistry")
    static class MicrometerMetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean(MetricsRecorder.class)
        public MetricsRecorder micrometerMetricsRecorder(MeterRegistry meterRegistry) {
            return new MicrometerMetricsRecorder(meterRegistry);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "io.opentelemetry.api.GlobalOpenTelemetry")
    static class OpenTelemetryTracingConfiguration {

        @Bean
        @ConditionalOnMissingBean(TracingService.class)
        public TracingService openTelemetryTracingService() {
            return new OpenTelemetryTracingService();
        }
    }
}
