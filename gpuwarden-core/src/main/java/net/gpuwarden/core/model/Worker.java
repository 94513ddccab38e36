package net.gpuwarden.core.model;

import java.time.Instant;

/**
 * 워커 레지스트리 한 행.
 * sessionToken 은 status == STARTING 일 때만 non-null.
 */
public record Worker(
        long id,
        String name,
        Provider provider,
        WorkerStatus status,
        String accountId,
        String endpointUrl,
        String externalId,
        String capabilities,
        String sessionToken,
        Instant reservationExpiresAt,
        Instant sessionStartedAt,
        long sessionDurationSeconds,
        Instant cooldownUntil,
        long weeklyUsageSeconds,
        Instant weekStartedAt,
        Instant lastHeartbeatAt,
        String lastError,
        Instant createdAt,
        Instant updatedAt
) {
    /** 진행 중인 예약이 TTL 안에 살아있는지 */
    public boolean reservationInFlight(Instant now) {
        return status == WorkerStatus.STARTING
                && reservationExpiresAt != null
                && reservationExpiresAt.isAfter(now);
    }

    /** 만료됐지만 회수되지 않은 예약 */
    public boolean reservationExpired(Instant now) {
        return status == WorkerStatus.STARTING && !reservationInFlight(now);
    }

    /** lastHeartbeatAt → sessionStartedAt → createdAt */
    public Instant lastSeenAt() {
        if (lastHeartbeatAt != null) return lastHeartbeatAt;
        if (sessionStartedAt != null) return sessionStartedAt;
        return createdAt;
    }
}
