package com.vsensor.simulator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vsensor.core.msg.HeartbeatParser;
import com.vsensor.core.util.JsonUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Builds heartbeat payloads for a fixed list of sensors. A sensor's name is its position
 * in the list.
 */
public class HeartbeatFactory {
    private final List<String> sensorIds;
    private final String cluster;
    private final JsonNode config;

    public HeartbeatFactory(List<String> sensorIds, String cluster, JsonNode config) {
        if (config != null && !config.isObject()) {
            throw new IllegalArgumentException("Heartbeat config must be a JSON object");
        }
        this.sensorIds = List.copyOf(sensorIds);
        this.cluster = cluster;
        this.config = config;
    }

    public List<String> sensorIds() {
        return sensorIds;
    }

    public String heartbeat(int index) {
        return JsonUtils.writeValueAsString(payload(index));
    }

    public String departure(int index) {
        ObjectNode node = payload(index);
        node.put(HeartbeatParser.FIELD_DEPARTING, true);
        return JsonUtils.writeValueAsString(node);
    }

    private ObjectNode payload(int index) {
        ObjectNode node = JsonUtils.mapper().createObjectNode();
        node.put(HeartbeatParser.FIELD_ID, sensorIds.get(index));
        node.put(HeartbeatParser.FIELD_NAME, String.valueOf(index));
        node.put(HeartbeatParser.FIELD_CLUSTER, cluster);
        if (config != null) {
            node.set(HeartbeatParser.FIELD_CONFIG, config.deepCopy());
        }
        return node;
    }

    /**
     * Reads the heartbeat config from a JSON file.
     *
     * @param file path to the file, or {@code null} for no config
     * @return the parsed object, or {@code null}
     */
    public static JsonNode readConfig(String file) {
        if (file == null || file.isBlank()) {
            return null;
        }
        try {
            return JsonUtils.mapper().readTree(Files.readString(Path.of(file)));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read heartbeat config " + file, e);
        }
    }
}
