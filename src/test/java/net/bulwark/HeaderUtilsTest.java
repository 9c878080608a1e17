package net.bulwark;

import net.bulwark.Kafka.Aspect.Components.Utility.HeaderUtils;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HeaderUtilsTest {

    @Test
    void testParseRetryCountToleratesMalformedValues() {
        assertEquals(0, HeaderUtils.parseRetryCount(null));
        assertEquals(0, HeaderUtils.parseRetryCount(""));
        assertEquals(0, HeaderUtils.parseRetryCount("abc"));
        assertEquals(0, HeaderUtils.parseRetryCount("-2"));
        assertEquals(0, HeaderUtils.parseRetryCount("99999999999"));
        assertEquals(2, HeaderUtils.parseRetryCount(" 2 "));
    }

    @Test
    void testBlankEventIdReadsAsNull() {
        assertNull(HeaderUtils.parseEventId(null));
        assertNull(HeaderUtils.parseEventId("  "));
        assertEquals("evt-1", HeaderUtils.parseEventId("evt-1"));
    }

    @Test
    void testToMapKeepsOrderAndLastValueWins() {
        RecordHeaders headers = new RecordHeaders();
        headers.add("eventId", "evt-1".getBytes(StandardCharsets.UTF_8));
        headers.add("retryCount", "1".getBytes(StandardCharsets.UTF_8));
        headers.add("retryCount", "2".getBytes(StandardCharsets.UTF_8));
        headers.add("empty", null);

        Map<String, String> map = HeaderUtils.toMap(headers);

        assertEquals(List.of("eventId", "retryCount", "empty"), List.copyOf(map.keySet()));
        assertEquals("2", map.get("retryCount"));
        assertEquals("", map.get("empty"));
    }

    @Test
    void testToHeadersWritesUtf8Values() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("eventId", "évt-1");

        RecordHeaders headers = HeaderUtils.toHeaders(map);

        assertEquals("évt-1", new String(headers.lastHeader("eventId").value(), StandardCharsets.UTF_8));
    }

    @Test
    void testWithRetryCountReturnsCopy() {
        Map<String, String> original = Map.of("eventId", "evt-1", "retryCount", "1");

        Map<String, String> updated = HeaderUtils.withRetryCount(original, 2);

        assertEquals("2", updated.get("retryCount"));
        assertEquals("evt-1", updated.get("eventId"));
        assertEquals("1", original.get("retryCount"));
    }

    @Test
    void testDescribe() {
        assertEquals("IllegalStateException: bad", HeaderUtils.describe(new IllegalStateException("bad")));
        assertEquals("NullPointerException", HeaderUtils.describe(new NullPointerException()));
        assertEquals("unknown", HeaderUtils.describe(null));
    }
}
