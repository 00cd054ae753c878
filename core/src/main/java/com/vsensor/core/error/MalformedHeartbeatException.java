package com.vsensor.core.error;

import com.vsensor.core.msg.RejectReason;
import lombok.Getter;

/**
 * A heartbeat payload failed validation.
 */
@Getter
public class MalformedHeartbeatException extends RuntimeException {
    private final RejectReason rejectReason;

    public MalformedHeartbeatException(RejectReason rejectReason, String message) {
        super(message);
        this.rejectReason = rejectReason;
    }
}
