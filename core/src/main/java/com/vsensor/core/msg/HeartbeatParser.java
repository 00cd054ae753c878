package com.vsensor.core.msg;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.vsensor.core.model.Heartbeat;
import com.vsensor.core.util.JsonUtils;

import java.util.List;

/**
 * Parses and validates raw heartbeat payloads.
 * <p>
 * Expected shape:
 * <pre>
 * { "id": "H60001", "name": "0", "cluster": "H6", "config": { ... }, "departing": false }
 * </pre>
 * {@code id}, {@code name} and {@code cluster} are required strings. {@code config} must be an
 * object when present and {@code departing} a boolean. Unknown fields, including attempts to
 * set {@code active} or {@code lastUpdate}, are ignored.
 * </p>
 */
public final class HeartbeatParser {
    private HeartbeatParser() {
    }

    public static final String FIELD_ID = "id";
    public static final String FIELD_NAME = "name";
    public static final String FIELD_CLUSTER = "cluster";
    public static final String FIELD_CONFIG = "config";
    public static final String FIELD_DEPARTING = "departing";

    private static final List<String> REQUIRED_FIELDS = List.of(FIELD_ID, FIELD_NAME, FIELD_CLUSTER);

    /**
     * Parses a raw heartbeat.
     *
     * @param raw payload as received from the channel
     * @return accepted heartbeat, or the reason it was rejected
     */
    public static HeartbeatParseResult parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return HeartbeatParseResult.rejected(RejectReason.UNPARSEABLE, "Empty payload");
        }

        JsonNode root;
        try {
            root = JsonUtils.mapper().readTree(raw);
        } catch (JsonProcessingException e) {
            return HeartbeatParseResult.rejected(RejectReason.UNPARSEABLE, e.getOriginalMessage());
        }

        if (root == null || !root.isObject()) {
            return HeartbeatParseResult.rejected(RejectReason.UNPARSEABLE, "Payload is not a JSON object");
        }

        for (String field : REQUIRED_FIELDS) {
            JsonNode value = root.get(field);
            if (value == null || value.isNull()) {
                return HeartbeatParseResult.rejected(
                    RejectReason.MISSING_FIELD, String.format("No key '%s' exists", field)
                );
            }
            if (!value.isTextual()) {
                return HeartbeatParseResult.rejected(
                    RejectReason.INVALID_FIELD, String.format("Key '%s' must be a string", field)
                );
            }
        }

        String id = root.get(FIELD_ID).asText();
        if (id.isBlank()) {
            return HeartbeatParseResult.rejected(RejectReason.INVALID_FIELD, "Key 'id' must not be blank");
        }

        JsonNode config = root.get(FIELD_CONFIG);
        if (config != null && config.isNull()) {
            config = null;
        }
        if (config != null && !config.isObject()) {
            return HeartbeatParseResult.rejected(RejectReason.INVALID_FIELD, "Key 'config' must be an object");
        }

        JsonNode departing = root.get(FIELD_DEPARTING);
        if (departing != null && !departing.isNull() && !departing.isBoolean()) {
            return HeartbeatParseResult.rejected(RejectReason.INVALID_FIELD, "Key 'departing' must be a boolean");
        }

        return HeartbeatParseResult.accepted(Heartbeat.builder()
            .id(id)
            .name(root.get(FIELD_NAME).asText())
            .cluster(root.get(FIELD_CLUSTER).asText())
            .config(config)
            .departing(departing != null && departing.asBoolean(false))
            .build());
    }
}
