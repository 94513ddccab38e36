package net.gpuwarden.core.model;

import java.time.Duration;

/**
 * ensureAvailable 입력.
 * provider 가 null 이면 사용량 계열 → 휴지기 계열 순으로 후보를 고른다.
 */
public record AvailabilityPreferences(Provider provider, Duration maxWait, Duration pollInterval, String reason) {

    public static final Duration DEFAULT_MAX_WAIT = Duration.ofMinutes(3);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);

    public AvailabilityPreferences {
        if (maxWait == null || maxWait.isNegative()) maxWait = DEFAULT_MAX_WAIT;
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) pollInterval = DEFAULT_POLL_INTERVAL;
        if (reason == null || reason.isBlank()) reason = "on-demand";
    }

    public static AvailabilityPreferences any() {
        return new AvailabilityPreferences(null, DEFAULT_MAX_WAIT, DEFAULT_POLL_INTERVAL, null);
    }

    public static AvailabilityPreferences of(Provider provider) {
        return new AvailabilityPreferences(provider, DEFAULT_MAX_WAIT, DEFAULT_POLL_INTERVAL, null);
    }

    public AvailabilityPreferences withMaxWait(Duration maxWait, Duration pollInterval) {
        return new AvailabilityPreferences(provider, maxWait, pollInterval, reason);
    }
}
