package net.gpuwarden.core.model;

import java.time.Duration;
import java.time.Instant;

/** 세션 원장 한 행. 삭제하지 않음(쿼터 정산/감사용). */
public record Session(
        long id,
        long workerId,
        Provider provider,
        Instant sessionStartedAt,
        long sessionDurationMs,
        long maxSessionDurationMs,
        Instant autoShutdownAt,
        boolean active,
        ShutdownReason shutdownReason,
        Instant endedAt,
        Instant createdAt,
        Instant updatedAt
) {
    public boolean deadlinePassed(Instant now) { return !now.isBefore(autoShutdownAt); }

    public boolean durationExhausted() { return sessionDurationMs >= maxSessionDurationMs; }

    public boolean dueForShutdown(Instant now) { return deadlinePassed(now) || durationExhausted(); }

    /** 기록된 값과 벽시계 경과 중 큰 쪽 */
    public long measuredDurationMs(Instant now) {
        long wall = Math.max(0, Duration.between(sessionStartedAt, now).toMillis());
        return Math.max(sessionDurationMs, wall);
    }
}
