package net.bulwark.Kafka.Aspect;

import net.bulwark.Kafka.Annotations.ResilientKafkaListener;
import net.bulwark.Kafka.Aspect.Components.Redeliverer;
import net.bulwark.Kafka.Aspect.Components.Utility.AspectHelperMethods;
import net.bulwark.Kafka.Aspect.Components.Utility.HeaderUtils;
import net.bulwark.Kafka.Config.ProcessingConfig;
import net.bulwark.Kafka.Config.ResilienceProperties;
import net.bulwark.Kafka.Messaging.InboundMessage;
import net.bulwark.Kafka.Processing.BusinessFunction;
import net.bulwark.Kafka.Processing.ProcessingOutcome;
import net.bulwark.Kafka.Processing.ProcessingStateMachine;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;

import java.lang.reflect.UndeclaredThrowableException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Aspect that intercepts @ResilientKafkaListener annotated methods and runs each record through
 * the processing state machine, then acknowledges, redelivers or rethrows based on the outcome.
 */
@Aspect
public class ResilientListenerAspect {

    private static final Logger logger = LoggerFactory.getLogger(ResilientListenerAspect.class);

    private final ProcessingStateMachine stateMachine;
    private final Redeliverer redeliverer;
    private final ResilienceProperties properties;

    private final ConcurrentHashMap<ResilientKafkaListener, ProcessingConfig> configs = new ConcurrentHashMap<>();
    private final AtomicBoolean missingAttemptWarned = new AtomicBoolean();

    public ResilientListenerAspect(ProcessingStateMachine stateMachine,
                                   Redeliverer redeliverer,
                                   ResilienceProperties properties) {
        this.stateMachine = stateMachine;
        this.redeliverer = redeliverer;
        this.properties = properties;
    }

    @Around("@annotation(resilientKafkaListener)")
    public Object resilientListener(ProceedingJoinPoint pjp, ResilientKafkaListener resilientKafkaListener) throws Throwable {
        Object[] args = pjp.getArgs();
        Acknowledgment acknowledgment = AspectHelperMethods.extractAcknowledgment(args);
        ConsumerRecord<?, ?> consumerRecord = AspectHelperMethods.extractConsumerRecord(args);

        if (consumerRecord == null) {
            logger.warn("@ResilientKafkaListener on {} has no ConsumerRecord argument, invoking it unchanged",
                    pjp.getSignature().toShortString());
            return pjp.proceed();
        }

        ProcessingConfig config = configs.computeIfAbsent(resilientKafkaListener,
                annotation -> ProcessingConfig.fromAnnotation(annotation, properties));
        InboundMessage message = resilientKafkaListener.redeliver()
                ? InboundMessage.fromRecord(consumerRecord)
                : fromContainerRedelivery(consumerRecord);

        BusinessFunction businessFunction = inbound -> {
            try {
                return AspectHelperMethods.toOutboundEvents(pjp.proceed());
            } catch (Exception | Error e) {
                throw e;
            } catch (Throwable t) {
                throw new UndeclaredThrowableException(t);
            }
        };

        // RoutingFailedException and RetryCancelledException propagate, nothing is acknowledged
        ProcessingOutcome outcome = stateMachine.processMessage(message, businessFunction, config);

        if (outcome instanceof ProcessingOutcome.RetrySignaled retrySignaled) {
            if (!resilientKafkaListener.redeliver()) {
                throw retrySignaled.error();
            }
            redeliverer.redeliver(message, retrySignaled.error());
        }

        if (acknowledgment != null) {
            acknowledgment.acknowledge();
        }
        return null;
    }

    /**
     * Without republishing the retryCount header never grows, so the container's delivery attempt
     * stands in for it: attempt N has been retried N - 1 times.
     */
    private InboundMessage fromContainerRedelivery(ConsumerRecord<?, ?> consumerRecord) {
        InboundMessage message = InboundMessage.fromRecord(consumerRecord);
        int attempt = AspectHelperMethods.deliveryAttempt(consumerRecord);
        if (attempt == 0) {
            if (missingAttemptWarned.compareAndSet(false, true)) {
                logger.warn("record from topic: {} has no {} header; listeners with redeliver=false cannot detect poison messages "
                        + "unless the container sets deliveryAttemptHeader", consumerRecord.topic(), KafkaHeaders.DELIVERY_ATTEMPT);
            }
            return message;
        }

        Map<String, String> headers = HeaderUtils.withRetryCount(message.headers(),
                Math.max(message.retryCount(), attempt - 1));
        headers.remove(KafkaHeaders.DELIVERY_ATTEMPT);
        return InboundMessage.builder()
                .topic(message.topic())
                .partition(message.partition())
                .offset(message.offset())
                .key(message.key())
                .value(message.value())
                .headers(headers)
                .build();
    }
}
