package net.bulwark.Kafka.Processing;

import net.bulwark.Kafka.Config.ProcessingConfig;
import net.bulwark.Kafka.Exceptions.RetryCancelledException;
import net.bulwark.Kafka.Exceptions.RoutingFailedException;
import net.bulwark.Kafka.Messaging.InboundMessage;
import net.bulwark.Kafka.Messaging.MessageSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sequential consumer loop for one partition. Each message reaches a terminal state before the next
 * is received, which keeps per-partition ordering.
 *
 * Stops on {@link #stop()}, on interruption, or when a dead-letter publish fails. In the last case
 * the failing message is left unacknowledged and the cause is available from {@link #getFailure()}.
 */
public class PartitionWorker implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(PartitionWorker.class);

    private final MessageSource source;
    private final ProcessingStateMachine stateMachine;
    private final BusinessFunction businessFunction;
    private final ProcessingConfig config;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread workerThread;
    private volatile RoutingFailedException failure;

    public PartitionWorker(MessageSource source, ProcessingStateMachine stateMachine,
                           BusinessFunction businessFunction, ProcessingConfig config) {
        this.source = source;
        this.stateMachine = stateMachine;
        this.businessFunction = businessFunction;
        this.config = config;
    }

    @Override
    public void run() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Worker is already running");
        }
        workerThread = Thread.currentThread();
        logger.info("partition worker started");
        try {
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                InboundMessage message = source.receive();
                if (message == null) {
                    continue;
                }
                ProcessingOutcome outcome = stateMachine.processMessage(message, businessFunction, config);
                if (outcome.shouldAcknowledge()) {
                    source.acknowledge(message);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("partition worker interrupted while waiting for a message");
        } catch (RetryCancelledException e) {
            logger.info("partition worker cancelled during retry of attempt {}, message left unacknowledged",
                    e.getAttempt());
        } catch (RoutingFailedException e) {
            failure = e;
            logger.error("dead-letter routing failed for event {} to {}, stopping worker without acknowledging",
                    e.getEventId(), e.getDeadLetterTopic(), e);
        } finally {
            running.set(false);
            workerThread = null;
            logger.info("partition worker stopped");
        }
    }

    /**
     * Requests the loop to end and interrupts any wait in progress.
     */
    public void stop() {
        running.set(false);
        Thread thread = workerThread;
        if (thread != null) {
            thread.interrupt();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * The routing failure that stopped the worker, or null.
     */
    public RoutingFailedException getFailure() {
        return failure;
    }
}
