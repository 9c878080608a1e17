package net.bulwark.Kafka.Config;

import lombok.Getter;
import net.bulwark.Kafka.Annotations.ResilientKafkaListener;

/**
 * Per-listener settings for one run of the processing state machine.
 * Built from {@link ResilienceProperties}, optionally overridden by a {@link ResilientKafkaListener}.
 */
@Getter
public class ProcessingConfig {

    private final int maxRetries;
    private final String deadLetterTopic;
    private final String serviceName;
    private final int inlineRetries;
    private final boolean deDuplication;

    ProcessingConfig(Builder builder) {
        this.maxRetries = builder.maxRetries;
        this.deadLetterTopic = builder.deadLetterTopic;
        this.serviceName = builder.serviceName;
        this.inlineRetries = builder.inlineRetries;
        this.deDuplication = builder.deDuplication;
    }

    public static ProcessingConfig fromProperties(ResilienceProperties properties) {
        return builder()
                .maxRetries(properties.getMaxRetries())
                .deadLetterTopic(properties.getDeadLetterDestination())
                .serviceName(properties.getServiceName())
                .inlineRetries(properties.getInlineRetries())
                .deDuplication(true)
                .build();
    }

    /**
     * Applies annotation attributes on top of the property defaults.
     * Empty strings and negative numbers keep the default.
     */
    public static ProcessingConfig fromAnnotation(ResilientKafkaListener annotation, ResilienceProperties defaults) {
        Builder build = builder()
                .maxRetries(annotation.maxRetries() >= 0 ? annotation.maxRetries() : defaults.getMaxRetries())
                .deadLetterTopic(!annotation.deadLetterTopic().isEmpty()
                        ? annotation.deadLetterTopic() : defaults.getDeadLetterDestination())
                .serviceName(!annotation.serviceName().isEmpty()
                        ? annotation.serviceName() : defaults.getServiceName())
                .inlineRetries(annotation.inlineRetries() >= 0 ? annotation.inlineRetries() : defaults.getInlineRetries())
                .deDuplication(annotation.deDuplication());

        // validate topic and dead-letter topic are different
        if (!annotation.topic().isEmpty() && annotation.topic().equals(build.deadLetterTopic)) {
            throw new IllegalArgumentException("Topic and dead-letter topic cannot be the same");
        }
        return build.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private int maxRetries = 3;
        private String deadLetterTopic = "dlq";
        private String serviceName = "bulwark-worker";
        private int inlineRetries = 0;
        private boolean deDuplication = true;

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("Max retries must be greater than or equal to 0");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder deadLetterTopic(String deadLetterTopic) {
            if (deadLetterTopic == null || deadLetterTopic.isEmpty()) {
                throw new IllegalArgumentException("Dead-letter topic cannot be null or empty");
            }
            this.deadLetterTopic = deadLetterTopic;
            return this;
        }

        public Builder serviceName(String serviceName) {
            if (serviceName == null || serviceName.isEmpty()) {
                throw new IllegalArgumentException("Service name cannot be null or empty");
            }
            this.serviceName = serviceName;
            return this;
        }

        public Builder inlineRetries(int inlineRetries) {
            if (inlineRetries < 0) {
                throw new IllegalArgumentException("Inline retries must be greater than or equal to 0");
            }
            this.inlineRetries = inlineRetries;
            return this;
        }

        public Builder deDuplication(boolean deDuplication) {
            this.deDuplication = deDuplication;
            return this;
        }

        public ProcessingConfig build() {
            return new ProcessingConfig(this);
        }
    }
}
