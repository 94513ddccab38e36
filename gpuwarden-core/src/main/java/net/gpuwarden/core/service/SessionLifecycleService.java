package net.gpuwarden.core.service;

import net.gpuwarden.core.model.Session;
import net.gpuwarden.core.model.ShutdownReason;
import net.gpuwarden.core.model.StopResult;
import net.gpuwarden.core.model.Worker;
import net.gpuwarden.core.model.WorkerStatus;
import net.gpuwarden.core.quota.ProviderQuota;
import net.gpuwarden.core.quota.QuotaEvaluator;
import net.gpuwarden.core.spi.Clock;
import net.gpuwarden.core.spi.SessionRepository;
import net.gpuwarden.core.spi.TxRunner;
import net.gpuwarden.core.spi.WorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static net.gpuwarden.core.support.Durations.human;

/**
 * 세션 종료와 쿼터 정산.
 * 종료는 IS_ACTIVE 조건부 UPDATE 로만 일어나므로 같은 세션을 두 번 닫아도 정산은 한 번이다.
 */
public final class SessionLifecycleService {
    private static final Logger log = LoggerFactory.getLogger(SessionLifecycleService.class);

    private final WorkerRepository workers;
    private final SessionRepository sessions;
    private final QuotaEvaluator quota;
    private final TxRunner tx;
    private final Clock clock;

    public SessionLifecycleService(WorkerRepository workers,
                                   SessionRepository sessions,
                                   QuotaEvaluator quota,
                                   TxRunner tx,
                                   Clock clock) {
        this.workers = workers;
        this.sessions = sessions;
        this.quota = quota;
        this.tx = tx;
        this.clock = clock;
    }

    /** 워커의 활성 세션을 닫고 워커를 offline 으로. 활성 세션이 없으면 상태만 정리한다. */
    public StopResult stopSession(long workerId, ShutdownReason reason) throws Exception {
        return tx.required(() -> {
            Instant now = clock.now();
            Worker w = workers.lockById(workerId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown worker: " + workerId));
            Optional<Session> active = sessions.findActiveByWorker(workerId);
            if (active.isEmpty()) {
                // starting 은 예약 토큰 소유자가 정리한다
                if (w.status().isLive()) workers.updateStatus(workerId, WorkerStatus.OFFLINE, null, now);
                return StopResult.nothingActive(workerId, reason);
            }
            return closeLocked(w, active.get(), reason, now);
        });
    }

    /** 세션 ID 지정 종료 (워치독/복구). 이미 닫힌 세션이면 closed=false. */
    public StopResult closeSession(long sessionId, ShutdownReason reason) throws Exception {
        return tx.required(() -> {
            Session seen = sessions.findById(sessionId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown session: " + sessionId));
            Worker w = workers.lockById(seen.workerId())
                    .orElseThrow(() -> new IllegalStateException("Session " + sessionId + " references missing worker " + seen.workerId()));
            // 워커 락 이후 다시 읽어 다른 프로세스가 먼저 닫았는지 확인
            Session current = sessions.findById(sessionId).orElseThrow();
            if (!current.active()) {
                return new StopResult(w.id(), sessionId, false, reason, 0, 0, w.weeklyUsageSeconds(), w.cooldownUntil());
            }
            return closeLocked(w, current, reason, clock.now());
        });
    }

    /** 워커 행 락을 쥔 상태에서 호출해야 한다 */
    StopResult closeLocked(Worker w, Session s, ShutdownReason reason, Instant now) throws Exception {
        long measuredMs = s.measuredDurationMs(now);
        if (!sessions.close(s.id(), reason, measuredMs, now)) {
            return new StopResult(w.id(), s.id(), false, reason, 0, 0, w.weeklyUsageSeconds(), w.cooldownUntil());
        }

        long chargedMs = Math.min(measuredMs, s.maxSessionDurationMs());
        if (measuredMs > s.maxSessionDurationMs()) {
            log.warn("Session {} on worker {} ran {} past its budget of {}; charging the budget only",
                    s.id(), w.id(), human(Duration.ofMillis(measuredMs - s.maxSessionDurationMs())),
                    human(Duration.ofMillis(s.maxSessionDurationMs())));
        }
        long measuredSec = measuredMs / 1000;
        long chargedSec = chargedMs / 1000;

        ProviderQuota q = quota.policy().of(w.provider());
        long weekly = w.weeklyUsageSeconds();
        Instant weekStartedAt = w.weekStartedAt();
        Instant cooldownUntil = w.cooldownUntil();

        switch (q.family()) {
            case USAGE_METERED -> {
                Instant windowStart = quota.currentWindowStart(now);
                long base = quota.effectiveWeeklyUsageSeconds(w, now);
                if (weekStartedAt == null || weekStartedAt.isBefore(windowStart)) weekStartedAt = windowStart;
                weekly = base + chargedSec;
                long cap = q.safeWeeklyLimitSeconds();
                if (weekly > cap) {
                    log.warn("Worker {} weekly usage {}s exceeds safe limit {}s after session {}; clamping",
                            w.id(), weekly, cap, s.id());
                    weekly = cap;
                }
            }
            case COOLDOWN_METERED -> cooldownUntil = now.plus(q.cooldownOrZero());
        }

        workers.recordSessionEnd(w.id(), chargedSec, weekly, weekStartedAt, cooldownUntil, null, now);
        log.info("Session {} closed: worker={} provider={} reason={} ran={} charged={} weeklyUsage={}s cooldownUntil={}",
                s.id(), w.id(), w.provider(), reason.code(), human(Duration.ofMillis(measuredMs)),
                human(Duration.ofSeconds(chargedSec)), weekly, cooldownUntil);
        return new StopResult(w.id(), s.id(), true, reason, measuredSec, chargedSec, weekly, cooldownUntil);
    }

    /**
     * 활성 세션의 진행 시간 갱신 (하트비트 경로).
     * reportedRuntime 이 없으면 시작 시각 기준 경과 시간을 쓴다. 값은 줄어들지 않는다.
     *
     * @return 세션이 마감 시각이나 최대 길이에 도달해 정지해야 하면 true
     */
    public boolean updateSessionDuration(long workerId, Duration reportedRuntime) throws Exception {
        return tx.required(() -> {
            Instant now = clock.now();
            Optional<Session> active = sessions.findActiveByWorker(workerId);
            if (active.isEmpty()) return false;
            Session s = active.get();
            long ms = reportedRuntime != null
                    ? reportedRuntime.toMillis()
                    : Math.max(0, Duration.between(s.sessionStartedAt(), now).toMillis());
            sessions.updateDuration(s.id(), ms, now);
            long effective = Math.max(s.sessionDurationMs(), ms);
            return effective >= s.maxSessionDurationMs() || s.deadlinePassed(now);
        });
    }

    public Optional<Session> activeSession(long workerId) throws Exception {
        return tx.required(() -> sessions.findActiveByWorker(workerId));
    }
}
