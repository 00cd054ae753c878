package com.vsensor.core.model;

import com.vsensor.core.util.JsonUtils;

/**
 * Merge and codec helpers for {@link SensorState}.
 */
public final class SensorStates {
    private SensorStates() {
    }

    /**
     * Resolves an incoming state against the currently stored one.
     * <p>
     * Every field of {@code incoming} wins, except a missing {@code config}, which is copied
     * from {@code existing}. With no existing record a missing config stays missing.
     * The result is a complete record meant to replace the stored value in one write.
     * </p>
     *
     * @param existing currently stored state, or {@code null}
     * @param incoming state produced by a heartbeat or a sweep decision
     * @return the record to store
     */
    public static SensorState merge(SensorState existing, SensorState incoming) {
        if (incoming.getConfig() != null || existing == null) {
            return incoming;
        }
        return incoming.withConfig(existing.getConfig());
    }

    public static String toJson(SensorState state) {
        return JsonUtils.writeValueAsString(state);
    }

    public static SensorState fromJson(String json) {
        return JsonUtils.readValue(json, SensorState.class);
    }
}
