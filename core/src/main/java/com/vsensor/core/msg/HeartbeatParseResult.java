package com.vsensor.core.msg;

import com.vsensor.core.error.MalformedHeartbeatException;
import com.vsensor.core.model.Heartbeat;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of parsing a raw heartbeat: either an accepted {@link Heartbeat} or a rejection reason.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class HeartbeatParseResult {
    Heartbeat heartbeat;
    RejectReason rejectReason;
    String reason;

    public static HeartbeatParseResult accepted(Heartbeat heartbeat) {
        return new HeartbeatParseResult(heartbeat, null, null);
    }

    public static HeartbeatParseResult rejected(RejectReason rejectReason, String reason) {
        return new HeartbeatParseResult(null, rejectReason, reason);
    }

    public boolean isAccepted() {
        return heartbeat != null;
    }

    /**
     * @return the accepted heartbeat
     * @throws MalformedHeartbeatException if the heartbeat was rejected
     */
    public Heartbeat orElseThrow() {
        if (heartbeat == null) {
            throw new MalformedHeartbeatException(rejectReason, reason);
        }
        return heartbeat;
    }
}
