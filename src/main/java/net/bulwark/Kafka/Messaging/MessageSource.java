package net.bulwark.Kafka.Messaging;

/**
 * Consumer side of the broker client for one assigned partition.
 *
 * A message that is not acknowledged is redelivered by the source later, and the source (or the
 * producer that republishes it) carries an incremented {@code retryCount} header forward.
 */
public interface MessageSource {

    /**
     * Blocks until the next message of the partition is available.
     *
     * @throws InterruptedException when the calling worker is shut down
     */
    InboundMessage receive() throws InterruptedException;

    /**
     * Commits progress past {@code message}.
     */
    void acknowledge(InboundMessage message);
}
