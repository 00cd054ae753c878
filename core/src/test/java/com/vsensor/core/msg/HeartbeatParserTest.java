package com.vsensor.core.msg;

import com.vsensor.core.error.MalformedHeartbeatException;
import com.vsensor.core.model.Heartbeat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HeartbeatParserTest {

    @Test
    @DisplayName("Minimal heartbeat is accepted")
    void testMinimalHeartbeat() {
        HeartbeatParseResult result = HeartbeatParser.parse("{\"id\":\"H1\",\"name\":\"n\",\"cluster\":\"c\"}");

        assertTrue(result.isAccepted());
        Heartbeat heartbeat = result.getHeartbeat();
        assertEquals("H1", heartbeat.getId());
        assertEquals("n", heartbeat.getName());
        assertEquals("c", heartbeat.getCluster());
        assertNull(heartbeat.getConfig());
        assertFalse(heartbeat.isDeparting());
    }

    @Test
    @DisplayName("Config object and departure flag are carried over")
    void testConfigAndDeparture() {
        HeartbeatParseResult result = HeartbeatParser.parse(
            "{\"id\":\"H1\",\"name\":\"n\",\"cluster\":\"c\",\"departing\":true,"
                + "\"config\":{\"capture_size_limit\":4096,\"dev_flag\":true}}"
        );

        Heartbeat heartbeat = result.orElseThrow();
        assertEquals(4096, heartbeat.getConfig().get("capture_size_limit").asInt());
        assertTrue(heartbeat.isDeparting());
    }

    @Test
    @DisplayName("System-managed fields in the payload are ignored")
    void testReservedFieldsIgnored() {
        HeartbeatParseResult result = HeartbeatParser.parse(
            "{\"id\":\"H1\",\"name\":\"n\",\"cluster\":\"c\",\"active\":false,\"lastUpdate\":\"1970-01-01T00:00:00Z\"}"
        );

        assertTrue(result.isAccepted());
    }

    @Test
    @DisplayName("Missing cluster is rejected as a missing field")
    void testMissingCluster() {
        HeartbeatParseResult result = HeartbeatParser.parse("{\"id\":\"H1\",\"name\":\"n\"}");

        assertFalse(result.isAccepted());
        assertEquals(RejectReason.MISSING_FIELD, result.getRejectReason());
        assertTrue(result.getReason().contains("cluster"));
    }

    @Test
    @DisplayName("Null id is rejected as a missing field")
    void testNullId() {
        HeartbeatParseResult result = HeartbeatParser.parse("{\"id\":null,\"name\":\"n\",\"cluster\":\"c\"}");

        assertEquals(RejectReason.MISSING_FIELD, result.getRejectReason());
    }

    @Test
    @DisplayName("Wrongly typed fields are rejected")
    void testInvalidTypes() {
        assertEquals(RejectReason.INVALID_FIELD,
            HeartbeatParser.parse("{\"id\":42,\"name\":\"n\",\"cluster\":\"c\"}").getRejectReason());
        assertEquals(RejectReason.INVALID_FIELD,
            HeartbeatParser.parse("{\"id\":\" \",\"name\":\"n\",\"cluster\":\"c\"}").getRejectReason());
        assertEquals(RejectReason.INVALID_FIELD,
            HeartbeatParser.parse("{\"id\":\"H1\",\"name\":\"n\",\"cluster\":\"c\",\"config\":[1,2]}").getRejectReason());
        assertEquals(RejectReason.INVALID_FIELD,
            HeartbeatParser.parse("{\"id\":\"H1\",\"name\":\"n\",\"cluster\":\"c\",\"departing\":\"yes\"}").getRejectReason());
    }

    @Test
    @DisplayName("Null config counts as no config")
    void testNullConfig() {
        HeartbeatParseResult result = HeartbeatParser.parse(
            "{\"id\":\"H1\",\"name\":\"n\",\"cluster\":\"c\",\"config\":null}"
        );

        assertTrue(result.isAccepted());
        assertNull(result.getHeartbeat().getConfig());
    }

    @Test
    @DisplayName("Unparseable payloads are rejected without throwing")
    void testUnparseable() {
        assertEquals(RejectReason.UNPARSEABLE, HeartbeatParser.parse("{not json").getRejectReason());
        assertEquals(RejectReason.UNPARSEABLE, HeartbeatParser.parse("[1,2,3]").getRejectReason());
        assertEquals(RejectReason.UNPARSEABLE, HeartbeatParser.parse("").getRejectReason());
        assertEquals(RejectReason.UNPARSEABLE, HeartbeatParser.parse(null).getRejectReason());
    }

    @Test
    @DisplayName("orElseThrow surfaces the rejection")
    void testOrElseThrow() {
        MalformedHeartbeatException ex = assertThrows(MalformedHeartbeatException.class,
            () -> HeartbeatParser.parse("{\"id\":\"H1\"}").orElseThrow());

        assertEquals(RejectReason.MISSING_FIELD, ex.getRejectReason());
    }
}
