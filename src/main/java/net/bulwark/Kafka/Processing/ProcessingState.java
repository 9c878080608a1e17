package net.bulwark.Kafka.Processing;

/**
 * States a delivery goes through inside {@link ProcessingStateMachine}.
 */
public enum ProcessingState {
    RECEIVED(false),
    POISON_CHECK(false),
    DEDUP_CHECK(false),
    PROCESSING(false),
    ACK(true),
    RETRY_SIGNALED(true),
    DEAD_LETTERED(true);

    private final boolean terminal;

    ProcessingState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
