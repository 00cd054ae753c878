package com.vsensor.core.msg;

import java.util.Locale;

/**
 * Why an inbound heartbeat was dropped.
 */
public enum RejectReason {
    /**
     * Payload is not a JSON object.
     */
    UNPARSEABLE,

    /**
     * A required identity field is absent or null.
     */
    MISSING_FIELD,

    /**
     * A field is present but has the wrong JSON type.
     */
    INVALID_FIELD;

    /**
     * @return lower-case tag value for metrics
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
