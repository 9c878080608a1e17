package net.bulwark.Kafka.Processing;

import net.bulwark.Kafka.Aspect.Components.Utility.HeaderUtils;
import net.bulwark.Kafka.Aspect.Components.Utility.MetricsRecorder;
import net.bulwark.Kafka.Backoff.BackoffPolicy;
import net.bulwark.Kafka.Config.ProcessingConfig;
import net.bulwark.Kafka.DeadLetter.DeadLetterEnvelope;
import net.bulwark.Kafka.DeadLetter.DeadLetterRouter;
import net.bulwark.Kafka.Deduplication.EventDeduplicator;
import net.bulwark.Kafka.Exceptions.OperationFailedException;
import net.bulwark.Kafka.Exceptions.PoisonMessageException;
import net.bulwark.Kafka.Exceptions.RoutingFailedException;
import net.bulwark.Kafka.Messaging.InboundMessage;
import net.bulwark.Kafka.Messaging.MessagePublisher;
import net.bulwark.Kafka.Messaging.OutboundEvent;
import net.bulwark.Kafka.Retry.RetryExecutor;
import net.bulwark.Kafka.Tracing.TracingService;
import net.bulwark.Kafka.Tracing.TracingSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Drives one delivery from receipt to exactly one terminal state:
 * RECEIVED, POISON_CHECK, DEDUP_CHECK, PROCESSING, then ACK, RETRY_SIGNALED or DEAD_LETTERED.
 *
 * The retry counter is read once from the message and never changes during a run. The poison check
 * runs before deduplication so an exhausted message is dead-lettered even if its id was seen.
 * Not reentrant per partition: the caller hands it one message at a time.
 */
public class ProcessingStateMachine {

    private static final Logger logger = LoggerFactory.getLogger(ProcessingStateMachine.class);

    private final EventDeduplicator deduplicator;
    private final RetryExecutor retryExecutor;
    private final BackoffPolicy backoffPolicy;
    private final DeadLetterRouter deadLetterRouter;
    private final MessagePublisher publisher;
    private final MetricsRecorder metricsRecorder;
    private final TracingService tracingService;

    public ProcessingStateMachine(EventDeduplicator deduplicator,
                                  RetryExecutor retryExecutor,
                                  BackoffPolicy backoffPolicy,
                                  DeadLetterRouter deadLetterRouter,
                                  MessagePublisher publisher,
                                  MetricsRecorder metricsRecorder,
                                  TracingService tracingService) {
        this.deduplicator = deduplicator;
        this.retryExecutor = retryExecutor;
        this.backoffPolicy = backoffPolicy;
        this.deadLetterRouter = deadLetterRouter;
        this.publisher = publisher;
        this.metricsRecorder = metricsRecorder;
        this.tracingService = tracingService;
    }

    /**
     * Processes one delivery.
     *
     * @return the terminal outcome; the caller acknowledges unless it is {@link ProcessingOutcome.RetrySignaled}
     * @throws RoutingFailedException  if a required dead-letter publish failed; the message must not be acknowledged
     * @throws net.bulwark.Kafka.Exceptions.RetryCancelledException if the thread was interrupted during an inline wait
     */
    public ProcessingOutcome processMessage(InboundMessage message, BusinessFunction businessFunction, ProcessingConfig config) {
        long startTime = System.currentTimeMillis();
        final int retryCount = message.retryCount();
        final String eventId = message.eventId();

        TracingSpan span = tracingService.startProcessingSpan(message.topic(), message.partition(), eventId, retryCount);
        boolean claimed = false;
        try {
            ProcessingState state = ProcessingState.RECEIVED;
            ProcessingOutcome outcome = null;
            Exception failure = null;

            while (!state.isTerminal()) {
                switch (state) {
                    case RECEIVED -> state = ProcessingState.POISON_CHECK;

                    case POISON_CHECK -> {
                        if (retryCount >= config.getMaxRetries()) {
                            logger.warn("event {} from topic: {} exceeded max retries ({}/{}), dead-lettering without processing",
                                    eventId, message.topic(), retryCount, config.getMaxRetries());
                            failure = new PoisonMessageException(retryCount, config.getMaxRetries());
                            state = ProcessingState.DEAD_LETTERED;
                        } else {
                            state = ProcessingState.DEDUP_CHECK;
                        }
                    }

                    case DEDUP_CHECK -> {
                        if (config.isDeDuplication() && deduplicator.isDuplicate(eventId)) {
                            logger.info("duplicate event {} on topic: {} partition: {} offset: {}, skipping",
                                    eventId, message.topic(), message.partition(), message.offset());
                            outcome = ProcessingOutcome.duplicate();
                            state = ProcessingState.ACK;
                        } else {
                            claimed = config.isDeDuplication();
                            state = ProcessingState.PROCESSING;
                        }
                    }

                    case PROCESSING -> {
                        try {
                            process(message, businessFunction, config);
                            outcome = ProcessingOutcome.acked();
                            state = ProcessingState.ACK;
                        } catch (OperationFailedException e) {
                            failure = unwrap(e);
                            metricsRecorder.recordFailure(message.topic(), failure, retryCount);
                            span.recordException(failure);
                            if (retryCount < config.getMaxRetries()) {
                                state = ProcessingState.RETRY_SIGNALED;
                            } else {
                                state = ProcessingState.DEAD_LETTERED;
                            }
                        }
                    }

                    default -> throw new IllegalStateException("Unexpected state: " + state);
                }
            }

            if (state == ProcessingState.RETRY_SIGNALED) {
                // release the claim so the redelivery is processed rather than skipped
                releaseClaim(claimed, eventId);
                outcome = new ProcessingOutcome.RetrySignaled(failure);
            } else if (state == ProcessingState.DEAD_LETTERED) {
                DeadLetterEnvelope envelope = deadLetterRouter.route(message, failure,
                        config.getServiceName(), config.getDeadLetterTopic());
                outcome = new ProcessingOutcome.DeadLettered(envelope);
            }

            logOutcome(message, outcome, failure);
            metricsRecorder.recordOutcome(message.topic(), outcome, startTime);
            if (outcome.status() == ProcessingOutcome.Status.ACKED) {
                span.setSuccess();
            } else {
                span.setError(HeaderUtils.describe(failure));
            }
            return outcome;
        } catch (RoutingFailedException e) {
            metricsRecorder.recordRoutingFailure(message.topic());
            span.recordException(e);
            releaseClaim(claimed, eventId);
            throw e;
        } catch (RuntimeException | Error e) {
            // cancelled or broken run; the message stays unacknowledged and its redelivery must not look like a duplicate
            logger.warn("processing of event {} on topic: {} aborted with {}", eventId, message.topic(), e.getClass().getSimpleName());
            span.recordException(e);
            releaseClaim(claimed, eventId);
            throw e;
        } finally {
            span.end();
        }
    }

    private void releaseClaim(boolean claimed, String eventId) {
        if (claimed) {
            deduplicator.forget(eventId);
        }
    }

    private void process(InboundMessage message, BusinessFunction businessFunction, ProcessingConfig config) {
        int budget = config.getInlineRetries();
        List<OutboundEvent> events = retryExecutor.execute(attempt -> {
            if (attempt > 0) {
                logger.debug("inline retry {} of event {} on topic: {}", attempt, message.eventId(), message.topic());
            }
            return businessFunction.apply(message);
        }, budget, backoffPolicy);

        if (events == null) {
            return;
        }
        for (OutboundEvent event : events) {
            retryExecutor.execute(attempt -> {
                publisher.publish(event.topic(), event.key(), event.value(), event.headers());
                return null;
            }, budget, backoffPolicy);
        }
    }

    private static Exception unwrap(OperationFailedException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Exception exception) {
            return exception;
        }
        return e;
    }

    private void logOutcome(InboundMessage message, ProcessingOutcome outcome, Exception failure) {
        switch (outcome.status()) {
            case ACKED -> logger.debug("acked topic: {} partition: {} offset: {} eventId: {} retryCount: {}",
                    message.topic(), message.partition(), message.offset(), message.eventId(), message.retryCount());
            case RETRY_SIGNALED -> logger.warn("retry signalled for topic: {} partition: {} offset: {} eventId: {} retryCount: {}: {}",
                    message.topic(), message.partition(), message.offset(), message.eventId(), message.retryCount(),
                    HeaderUtils.describe(failure));
            case DEAD_LETTERED -> logger.error("dead-lettered topic: {} partition: {} offset: {} eventId: {} retryCount: {}: {}",
                    message.topic(), message.partition(), message.offset(), message.eventId(), message.retryCount(),
                    HeaderUtils.describe(failure));
        }
    }
}
