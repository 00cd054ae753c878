package com.vsensor.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vsensor.core.util.JsonUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SensorStatesTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    @DisplayName("First write without config keeps config absent")
    void testMergeWithoutExistingRecord() {
        SensorState incoming = state("H1", null);

        SensorState merged = SensorStates.merge(null, incoming);

        assertSame(incoming, merged);
        assertNull(merged.getConfig());
    }

    @Test
    @DisplayName("Write without config copies the stored config")
    void testMergeCopiesExistingConfig() {
        SensorState existing = state("H1", config("capture_size_limit", 4096));
        SensorState incoming = state("H1", null).withActive(false);

        SensorState merged = SensorStates.merge(existing, incoming);

        assertEquals(existing.getConfig(), merged.getConfig());
        assertFalse(merged.isActive(), "Fields present in the incoming record must win");
    }

    @Test
    @DisplayName("Stored config always equals the last write that carried one")
    void testMergePreservationOverSequence() {
        // Given: a sequence of writes where only some carry a config
        List<SensorState> writes = List.of(
            state("H1", null),
            state("H1", config("v", 1)),
            state("H1", null),
            state("H1", null),
            state("H1", config("v", 2)),
            state("H1", null)
        );

        // When: each write is merged against what was stored before
        SensorState stored = null;
        JsonNode lastWrittenConfig = null;
        for (SensorState write : writes) {
            stored = SensorStates.merge(stored, write);
            if (write.getConfig() != null) {
                lastWrittenConfig = write.getConfig();
            }

            // Then: the stored config tracks the last config-bearing write
            assertEquals(lastWrittenConfig, stored.getConfig());
        }
        assertEquals(2, stored.getConfig().get("v").asInt());
    }

    @Test
    @DisplayName("Expiry uses strict inequality on the dead timeout")
    void testExpiryBoundary() {
        Duration timeout = Duration.ofMillis(2000);

        SensorState atBoundary = state("H1", null).withLastUpdate(T0.minus(timeout));
        SensorState pastBoundary = state("H1", null).withLastUpdate(T0.minus(timeout).minusMillis(1));

        assertFalse(atBoundary.isExpired(T0, timeout));
        assertTrue(pastBoundary.isExpired(T0, timeout));
        assertTrue(state("H1", null).withLastUpdate(null).isExpired(T0, timeout));
    }

    @Test
    @DisplayName("Serialized state uses the dashboard layout")
    void testJsonLayout() throws Exception {
        SensorState state = SensorState.builder()
            .id("H60001")
            .metadata(new SensorInfo("0", "H6", "edge collector"))
            .active(true)
            .lastUpdate(T0)
            .build();

        JsonNode json = JsonUtils.mapper().readTree(SensorStates.toJson(state));

        assertEquals("H60001", json.get("id").asText());
        assertEquals("H6", json.get("info").get("cluster").asText());
        assertEquals("2024-05-01T10:00:00Z", json.get("lastUpdate").asText());
        assertTrue(json.get("active").asBoolean());
        assertFalse(json.has("config"), "Absent config must not be written");
    }

    @Test
    @DisplayName("Stored JSON null config reads back as absent")
    void testNullConfigReadsAsAbsent() {
        SensorState state = SensorStates.fromJson(
            "{\"id\":\"H1\",\"active\":false,\"lastUpdate\":\"2024-05-01T10:00:00Z\",\"config\":null}"
        );

        assertNull(state.getConfig());
        assertEquals(T0, state.getLastUpdate());
    }

    private static SensorState state(String id, JsonNode config) {
        return SensorState.builder()
            .id(id)
            .active(true)
            .lastUpdate(T0)
            .config(config)
            .build();
    }

    private static JsonNode config(String key, int value) {
        ObjectNode node = JsonUtils.mapper().createObjectNode();
        node.put(key, value);
        return node;
    }
}
