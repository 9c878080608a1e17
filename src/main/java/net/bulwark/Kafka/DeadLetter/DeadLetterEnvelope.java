package net.bulwark.Kafka.DeadLetter;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * What lands on the dead-letter topic: the original record verbatim plus enough error context to
 * diagnose and reprocess it. Created once per dead-lettered delivery, never mutated.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeadLetterEnvelope {

    // Original record
    String originalTopic;
    int originalPartition;
    long originalOffset;
    String originalKey;
    String originalValue;
    @Singular
    Map<String, String> originalHeaders;

    // Failure
    String errorMessage;
    String errorKind;
    String errorStackTrace;

    String serviceName;
    Instant dlqTimestamp;

    /** Retry counter of the triggering delivery plus one. */
    int retryCount;
}
