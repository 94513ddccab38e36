package net.gpuwarden.core.model;

import java.time.Instant;

public record StopResult(long workerId,
                         Long sessionId,
                         boolean closed,
                         ShutdownReason reason,
                         long measuredSeconds,
                         long chargedSeconds,
                         long weeklyUsageSeconds,
                         Instant cooldownUntil) {

    public static StopResult nothingActive(long workerId, ShutdownReason reason) {
        return new StopResult(workerId, null, false, reason, 0, 0, 0, null);
    }
}
