package net.gpuwarden.core.quota;

import net.gpuwarden.core.model.StartFailure;
import net.gpuwarden.core.model.Worker;
import net.gpuwarden.core.spi.WeeklyWindowCalculator;

import java.time.Duration;
import java.time.Instant;

import static net.gpuwarden.core.support.Durations.human;
import static net.gpuwarden.core.support.Durations.min;
import static net.gpuwarden.core.support.Durations.positiveOrZero;

/**
 * "지금 새 세션을 시작해도 되는가" 판정. 상태를 갖지 않으며 저장소를 읽지 않는다.
 * 동시성 판단에 필요한 함대 정보는 호출자가 FleetSnapshot 으로 넘긴다.
 */
public final class QuotaEvaluator {
    private final QuotaPolicy policy;
    private final WeeklyWindowCalculator weeklyWindow;

    public QuotaEvaluator(QuotaPolicy policy, WeeklyWindowCalculator weeklyWindow) {
        this.policy = policy;
        this.weeklyWindow = weeklyWindow;
    }

    public QuotaPolicy policy() { return policy; }

    public QuotaDecision canStart(Worker w, FleetSnapshot fleet, Instant now) {
        if (w.status().isLive()) {
            return QuotaDecision.deny(StartFailure.CONCURRENT_SESSION_CONFLICT,
                    "worker " + w.id() + " is already " + w.status().code().toLowerCase());
        }
        // 만료된 예약은 재예약 가능
        if (w.reservationInFlight(now)) {
            return QuotaDecision.deny(StartFailure.CONCURRENT_SESSION_CONFLICT,
                    "worker " + w.id() + " has a reservation in flight until " + w.reservationExpiresAt());
        }

        ProviderQuota q = policy.of(w.provider());
        QuotaDecision own = switch (q.family()) {
            case USAGE_METERED -> checkWeekly(w, q, now);
            case COOLDOWN_METERED -> checkCooldown(w, now);
        };
        if (!own.allowed()) return own;

        if (q.limitsConcurrency() && fleet.occupied() >= q.maxConcurrentSessions()) {
            return QuotaDecision.deny(StartFailure.CONCURRENT_SESSION_CONFLICT,
                    w.provider().code() + " allows " + q.maxConcurrentSessions()
                            + " concurrent session(s) fleet-wide; " + fleet.occupied() + " already running or starting");
        }
        return QuotaDecision.allow();
    }

    private QuotaDecision checkWeekly(Worker w, ProviderQuota q, Instant now) {
        long used = effectiveWeeklyUsageSeconds(w, now);
        long cap = q.safeWeeklyLimitSeconds();
        if (used >= cap) {
            return QuotaDecision.deny(StartFailure.QUOTA_EXCEEDED,
                    "weekly usage " + human(Duration.ofSeconds(used)) + " reached the safe limit of "
                            + human(q.safeWeeklyLimit()) + " (" + percent(q.safetyFactor()) + " of "
                            + human(q.officialWeeklyLimit()) + "); resets at " + nextWindowStart(now));
        }
        return QuotaDecision.allow();
    }

    private QuotaDecision checkCooldown(Worker w, Instant now) {
        Instant until = w.cooldownUntil();
        if (until != null && now.isBefore(until)) {
            return QuotaDecision.deny(StartFailure.COOLDOWN_ACTIVE,
                    "cooldown active for another " + human(Duration.between(now, until)) + " (until " + until + ")");
        }
        return QuotaDecision.allow();
    }

    /** 지난 주간 창의 사용량은 0 으로 본다. weekStartedAt 이 없으면 현재 창으로 간주. */
    public long effectiveWeeklyUsageSeconds(Worker w, Instant now) {
        if (w.weekStartedAt() != null && w.weekStartedAt().isBefore(weeklyWindow.windowStart(now))) return 0;
        return w.weeklyUsageSeconds();
    }

    public Instant currentWindowStart(Instant now) { return weeklyWindow.windowStart(now); }

    private Instant nextWindowStart(Instant now) {
        Instant start = weeklyWindow.windowStart(now);
        return weeklyWindow.windowStart(start.plus(Duration.ofDays(8)));
    }

    /**
     * 이번 세션에 허용할 최대 길이.
     * 사용량 계열은 남은 주간 예산을 넘지 않는다.
     */
    public Duration sessionBudget(Worker w, Instant now) {
        ProviderQuota q = policy.of(w.provider());
        Duration session = q.safeSessionLimit();
        return switch (q.family()) {
            case USAGE_METERED -> {
                long remaining = Math.max(0, q.safeWeeklyLimitSeconds() - effectiveWeeklyUsageSeconds(w, now));
                yield min(session, Duration.ofSeconds(remaining));
            }
            case COOLDOWN_METERED -> session;
        };
    }

    /** 사용량 계열: 주간 사용/잔여, 휴지기 계열: 현재 세션 사용/잔여 */
    public QuotaUsage usage(Worker w, Duration currentRuntime, Instant now) {
        ProviderQuota q = policy.of(w.provider());
        return switch (q.family()) {
            case USAGE_METERED -> {
                long used = effectiveWeeklyUsageSeconds(w, now) + currentRuntime.toSeconds();
                long cap = q.safeWeeklyLimitSeconds();
                yield new QuotaUsage(Duration.ofSeconds(used),
                        Duration.ofSeconds(Math.max(0, cap - used)), QuotaLevel.of(used, cap));
            }
            case COOLDOWN_METERED -> {
                Duration cap = q.safeSessionLimit();
                yield new QuotaUsage(currentRuntime, positiveOrZero(cap.minus(currentRuntime)),
                        QuotaLevel.of(currentRuntime.toSeconds(), cap.toSeconds()));
            }
        };
    }

    private static String percent(double f) { return Math.round(f * 100) + "%"; }

    public record QuotaUsage(Duration used, Duration remaining, QuotaLevel level) {}
}
