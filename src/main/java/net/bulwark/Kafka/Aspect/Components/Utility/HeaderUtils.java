package net.bulwark.Kafka.Aspect.Components.Utility;

import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Utility class for reading and writing the resilience headers carried by Kafka records.
 * Header values are plain UTF-8 strings so any producer (not only this library) can set them.
 */
public final class HeaderUtils {

    private static final Logger logger = LoggerFactory.getLogger(HeaderUtils.class);

    // header key constants
    public static final String HEADER_EVENT_ID = "eventId";
    public static final String HEADER_RETRY_COUNT = "retryCount";
    public static final String HEADER_LAST_ERROR = "lastError";
    public static final String HEADER_DLQ_REASON = "dlqReason";
    public static final String HEADER_DLQ_SERVICE = "dlqService";
    public static final String HEADER_DLQ_TIMESTAMP = "dlqTimestamp";
    public static final String HEADER_DLQ_ERROR_KIND = "dlqErrorKind";

    private HeaderUtils() {
    }

    /**
     * Copies Kafka headers into an ordered string map. When a key repeats, the last value wins,
     * matching {@link Headers#lastHeader(String)}. Null header values map to an empty string.
     */
    public static Map<String, String> toMap(Headers headers) {
        if (headers == null) {
            return Collections.emptyMap();
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (Header header : headers) {
            byte[] value = header.value();
            result.put(header.key(), value == null ? "" : new String(value, StandardCharsets.UTF_8));
        }
        return result;
    }

    /**
     * Builds Kafka headers from a string map, preserving its iteration order.
     */
    public static RecordHeaders toHeaders(Map<String, String> headers) {
        RecordHeaders recordHeaders = new RecordHeaders();
        if (headers == null) {
            return recordHeaders;
        }
        headers.forEach((key, value) ->
                recordHeaders.add(key, value == null ? null : value.getBytes(StandardCharsets.UTF_8)));
        return recordHeaders;
    }

    /**
     * Reads the retry counter. Missing, unparsable and negative values read as 0 so that a
     * malformed header never blocks the pipeline.
     */
    public static int parseRetryCount(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 0) {
                logger.debug("negative retry count header '{}', treating as 0", value);
                return 0;
            }
            return parsed;
        } catch (NumberFormatException e) {
            logger.debug("unparsable retry count header '{}', treating as 0", value);
            return 0;
        }
    }

    /**
     * Normalises an event id header: blank ids cannot be deduplicated and read as null.
     */
    public static String parseEventId(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value;
    }

    /**
     * Returns a copy of {@code headers} with the retry counter set to {@code retryCount}.
     * Other headers keep their position; the counter is appended when missing.
     */
    public static Map<String, String> withRetryCount(Map<String, String> headers, int retryCount) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(HEADER_RETRY_COUNT, String.valueOf(retryCount));
        return copy;
    }

    /**
     * Short description of an exception for headers and logs: {@code SimpleName: message}.
     */
    public static String describe(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }
}
