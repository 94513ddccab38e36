package net.gpuwarden.core.quota;

import net.gpuwarden.core.model.Provider;
import net.gpuwarden.core.model.QuotaFamily;

import java.time.Duration;

/**
 * 프로바이더 공식 한도와 안전 계수.
 * 실제로 강제하는 값은 공식 한도 × safetyFactor.
 *
 * @param officialWeeklyLimit 사용량 계열만 의미 있음 (휴지기 계열은 null)
 * @param cooldown            휴지기 계열만 의미 있음 (사용량 계열은 null)
 * @param maxConcurrentSessions 프로바이더 전체 동시 세션 상한, 0 이면 제한 없음
 */
public record ProviderQuota(
        Provider provider,
        Duration officialSessionLimit,
        Duration officialWeeklyLimit,
        Duration cooldown,
        double safetyFactor,
        int maxConcurrentSessions
) {
    public static final double DEFAULT_SAFETY_FACTOR = 0.7;

    public ProviderQuota {
        if (provider == null) throw new IllegalArgumentException("provider is required");
        if (officialSessionLimit == null || officialSessionLimit.isNegative() || officialSessionLimit.isZero()) {
            throw new IllegalArgumentException("officialSessionLimit must be positive: " + provider);
        }
        if (safetyFactor <= 0 || safetyFactor > 1) {
            throw new IllegalArgumentException("safetyFactor must be in (0, 1]: " + safetyFactor);
        }
        if (provider.family() == QuotaFamily.USAGE_METERED && officialWeeklyLimit == null) {
            throw new IllegalArgumentException("officialWeeklyLimit is required for " + provider);
        }
        if (maxConcurrentSessions < 0) throw new IllegalArgumentException("maxConcurrentSessions < 0");
    }

    public static ProviderQuota usageMetered(Provider p, Duration session, Duration weekly, double factor) {
        return new ProviderQuota(p, session, weekly, null, factor, 1);
    }

    public static ProviderQuota cooldownMetered(Provider p, Duration session, Duration cooldown, double factor) {
        return new ProviderQuota(p, session, null, cooldown, factor, 0);
    }

    public QuotaFamily family() { return provider.family(); }

    public Duration safeSessionLimit() { return scale(officialSessionLimit); }

    public Duration safeWeeklyLimit() { return officialWeeklyLimit == null ? null : scale(officialWeeklyLimit); }

    public long safeWeeklyLimitSeconds() {
        Duration d = safeWeeklyLimit();
        return d == null ? 0 : d.toSeconds();
    }

    public Duration cooldownOrZero() { return cooldown == null ? Duration.ZERO : cooldown; }

    public boolean limitsConcurrency() { return maxConcurrentSessions > 0; }

    private Duration scale(Duration d) {
        return Duration.ofMillis((long) Math.floor(d.toMillis() * safetyFactor));
    }
}
