package net.gpuwarden.core.model;

import net.gpuwarden.core.quota.QuotaLevel;

import java.time.Duration;
import java.time.Instant;

public record WorkerStatusView(
        long workerId,
        String name,
        Provider provider,
        WorkerStatus status,
        Duration quotaUsed,
        Duration quotaRemaining,
        QuotaLevel quotaLevel,
        Duration sessionRuntime,
        Duration cooldownRemaining,
        Instant autoShutdownAt,
        Instant lastHeartbeatAt
) {}
