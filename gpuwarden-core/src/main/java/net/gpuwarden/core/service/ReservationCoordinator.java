package net.gpuwarden.core.service;

import net.gpuwarden.core.model.Credentials;
import net.gpuwarden.core.model.NewSession;
import net.gpuwarden.core.model.ProvisionRequest;
import net.gpuwarden.core.model.ProvisionResult;
import net.gpuwarden.core.model.Session;
import net.gpuwarden.core.model.StartFailure;
import net.gpuwarden.core.model.StartResult;
import net.gpuwarden.core.model.Worker;
import net.gpuwarden.core.quota.FleetSnapshot;
import net.gpuwarden.core.quota.ProviderQuota;
import net.gpuwarden.core.quota.QuotaDecision;
import net.gpuwarden.core.quota.QuotaEvaluator;
import net.gpuwarden.core.spi.Clock;
import net.gpuwarden.core.spi.CredentialProvider;
import net.gpuwarden.core.spi.Provisioner;
import net.gpuwarden.core.spi.SessionRepository;
import net.gpuwarden.core.spi.TxRunner;
import net.gpuwarden.core.spi.WorkerRepository;
import net.gpuwarden.core.support.BoundedCall;
import net.gpuwarden.core.support.Tokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * 3단계 기동 프로토콜.
 * <ol>
 *   <li>짧은 트랜잭션: 행 락 → 쿼터 재평가 → 토큰 발급, status=starting</li>
 *   <li>트랜잭션 없음: 외부 프로비저너 호출 (수 분 소요 가능, 락 미보유)</li>
 *   <li>짧은 트랜잭션: 행 락 → 토큰 검증 → status=pending, 세션 행 생성</li>
 * </ol>
 * 2/3단계 실패는 토큰 일치 시에만 예약을 해제한다. 자동 재시도는 하지 않는다.
 */
public final class ReservationCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ReservationCoordinator.class);

    public static final Duration DEFAULT_RESERVATION_TTL = Duration.ofMinutes(5);
    public static final Duration DEFAULT_PROVISION_TIMEOUT = Duration.ofMinutes(10);

    private final WorkerRepository workers;
    private final SessionRepository sessions;
    private final QuotaEvaluator quota;
    private final Provisioner provisioner;
    private final CredentialProvider credentials;
    private final TxRunner tx;
    private final Clock clock;
    private final ExecutorService executor;

    private Duration reservationTtl = DEFAULT_RESERVATION_TTL;
    private Duration provisionTimeout = DEFAULT_PROVISION_TIMEOUT;

    public ReservationCoordinator(WorkerRepository workers,
                                  SessionRepository sessions,
                                  QuotaEvaluator quota,
                                  Provisioner provisioner,
                                  CredentialProvider credentials,
                                  TxRunner tx,
                                  Clock clock,
                                  ExecutorService executor) {
        this.workers = workers;
        this.sessions = sessions;
        this.quota = quota;
        this.provisioner = provisioner;
        this.credentials = credentials;
        this.tx = tx;
        this.clock = clock;
        this.executor = executor;
    }

    public StartResult startSession(long workerId, String reason) throws Exception {
        Optional<Worker> found = tx.required(() -> workers.findById(workerId));
        if (found.isEmpty()) {
            return StartResult.failed(workerId, StartFailure.WORKER_NOT_FOUND, "worker " + workerId + " does not exist");
        }
        Worker worker = found.get();

        Optional<Credentials> cred = lookupCredentials(worker);
        if (cred.isEmpty()) {
            return StartResult.failed(workerId, StartFailure.NOT_CONFIGURED,
                    "no credentials configured for account '" + worker.accountId() + "' of worker " + workerId);
        }

        // 1) 예약
        Reservation r = tx.requiresNew(() -> reserve(workerId));
        if (!r.granted()) {
            log.info("Start refused: worker={} failure={} reason={}", workerId, r.decision().failure().code(), r.decision().reason());
            return StartResult.failed(workerId, r.decision().failure(), r.decision().reason());
        }
        log.info("Reservation taken: worker={} provider={} expiresAt={} reason={}",
                workerId, r.worker().provider(), r.expiresAt(), reason);

        // 2) 외부 기동 (락 없음)
        ProvisionResult result;
        try {
            result = BoundedCall.call(executor,
                    () -> provisioner.launch(new ProvisionRequest(r.worker(), cred.get(), reason)),
                    provisionTimeout);
        } catch (Exception e) {
            String cause = "provisioning failed: " + describe(e);
            log.warn("Worker {} {}", workerId, cause, e);
            releaseQuietly(workerId, r.token(), cause);
            return StartResult.failed(workerId, StartFailure.PROVISIONING_FAILED, cause);
        }
        final ProvisionResult launched = result;
        if (launched == null || !launched.success()) {
            String cause = "provisioning failed: " + (launched == null ? "no result" : launched.error());
            log.warn("Worker {} {}", workerId, cause);
            releaseQuietly(workerId, r.token(), cause);
            return StartResult.failed(workerId, StartFailure.PROVISIONING_FAILED, cause);
        }

        // 3) 승격
        Promotion p;
        try {
            p = tx.requiresNew(() -> promote(workerId, r.token(), launched));
        } catch (Exception e) {
            releaseQuietly(workerId, r.token(), "promotion failed: " + describe(e));
            throw e;
        }
        if (!p.promoted()) {
            releaseQuietly(workerId, r.token(), p.failure().code() + ": " + p.message());
            if (launched.externalId() != null) {
                log.warn("Worker {} remote '{}' was launched but not promoted; it is not tracked by any session",
                        workerId, launched.externalId());
            }
            return StartResult.failed(workerId, p.failure(), p.message());
        }

        Session s = p.session();
        log.info("Session {} started: worker={} provider={} autoShutdownAt={} endpoint={}",
                s.id(), workerId, s.provider(), s.autoShutdownAt(), launched.endpointUrl());
        return StartResult.started(workerId, s.id(), launched.endpointUrl());
    }

    /**
     * 토큰이 여전히 일치할 때만 starting → offline.
     * TTL 만료 후 다른 프로세스가 가져간 예약은 건드리지 않는다.
     */
    public boolean releaseReservation(long workerId, String token, String cause) throws Exception {
        return tx.requiresNew(() -> {
            if (workers.lockById(workerId).isEmpty()) return false;
            boolean released = workers.release(workerId, token, cause, clock.now());
            if (released) {
                log.warn("Reservation released: worker={} cause={}", workerId, cause);
            } else {
                log.info("Reservation on worker {} is no longer held by this attempt; left untouched (cause: {})",
                        workerId, cause);
            }
            return released;
        });
    }

    // --- phase 1 ---
    private Reservation reserve(long workerId) throws Exception {
        Worker peek = workers.findById(workerId)
                .orElseThrow(() -> new IllegalStateException("worker vanished: " + workerId));
        ProviderQuota q = quota.policy().of(peek.provider());
        // 프로바이더 락 → 워커 락 순서 고정
        if (q.limitsConcurrency()) workers.lockProvider(peek.provider());
        Worker w = workers.lockById(workerId).orElseThrow();
        Instant now = clock.now();

        FleetSnapshot fleet = q.limitsConcurrency() ? snapshot(w, now, true) : FleetSnapshot.EMPTY;
        QuotaDecision d = quota.canStart(w, fleet, now);
        if (!d.allowed()) return Reservation.refused(d);

        if (w.reservationExpired(now)) {
            log.warn("Taking over stale reservation on worker {} (expired at {})", w.id(), w.reservationExpiresAt());
        }
        String token = Tokens.newSessionToken();
        Instant expiresAt = now.plus(reservationTtl);
        workers.markReserved(w.id(), token, expiresAt, now);
        return Reservation.granted(w, token, expiresAt);
    }

    // --- phase 3 ---
    private Promotion promote(long workerId, String token, ProvisionResult launched) throws Exception {
        Worker peek = workers.findById(workerId)
                .orElseThrow(() -> new IllegalStateException("worker vanished: " + workerId));
        ProviderQuota q = quota.policy().of(peek.provider());
        if (q.limitsConcurrency()) workers.lockProvider(peek.provider());
        Worker w = workers.lockById(workerId).orElseThrow();
        Instant now = clock.now();

        if (!token.equals(w.sessionToken())) {
            return Promotion.rejected(StartFailure.RESERVATION_TOKEN_MISMATCH,
                    "reservation on worker " + workerId + " was taken over or reclaimed while provisioning (status "
                            + w.status().code().toLowerCase() + ")");
        }
        if (q.limitsConcurrency()) {
            // 만료된 예약끼리 경합한 경우: 먼저 승격한 쪽만 살린다
            FleetSnapshot fleet = snapshot(w, now, false);
            if (fleet.occupied() >= q.maxConcurrentSessions()) {
                return Promotion.rejected(StartFailure.CONCURRENT_SESSION_CONFLICT,
                        w.provider().code() + " already has " + fleet.occupied() + " running session(s)");
            }
        }

        Duration budget = quota.sessionBudget(w, now);
        String endpoint = launched.endpointUrl() != null ? launched.endpointUrl() : w.endpointUrl();
        workers.markPending(w.id(), endpoint, launched.externalId(), now, now);
        Session s = sessions.insert(new NewSession(w.id(), w.provider(), now, budget.toMillis(), now.plus(budget)), now);
        return Promotion.promoted(s);
    }

    private FleetSnapshot snapshot(Worker self, Instant now, boolean countReservations) throws Exception {
        List<Worker> peers = workers.findByProvider(self.provider());
        int live = 0, reserving = 0;
        for (Worker o : peers) {
            if (o.id() == self.id()) continue;
            if (o.status().isLive()) live++;
            else if (countReservations && o.reservationInFlight(now)) reserving++;
        }
        int activeSessions = (int) sessions.findActiveByProvider(self.provider()).stream()
                .filter(s -> s.workerId() != self.id())
                .count();
        return new FleetSnapshot(activeSessions, live, reserving);
    }

    private Optional<Credentials> lookupCredentials(Worker w) {
        if (w.accountId() == null || w.accountId().isBlank()) return Optional.empty();
        try {
            return credentials.get(w.accountId());
        } catch (RuntimeException e) {
            log.warn("Credential lookup for account '{}' failed; treating as not configured", w.accountId(), e);
            return Optional.empty();
        }
    }

    private void releaseQuietly(long workerId, String token, String cause) {
        try {
            releaseReservation(workerId, token, cause);
        } catch (Exception e) {
            log.error("Could not release reservation on worker {} (cause: {}); it will expire after {}",
                    workerId, cause, reservationTtl, e);
        }
    }

    private static String describe(Throwable t) {
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }

    public void setReservationTtl(Duration reservationTtl) { this.reservationTtl = reservationTtl; }

    public void setProvisionTimeout(Duration provisionTimeout) { this.provisionTimeout = provisionTimeout; }

    public Duration getReservationTtl() { return reservationTtl; }

    private record Reservation(boolean granted, Worker worker, String token, Instant expiresAt, QuotaDecision decision) {
        static Reservation granted(Worker w, String token, Instant expiresAt) {
            return new Reservation(true, w, token, expiresAt, QuotaDecision.allow());
        }

        static Reservation refused(QuotaDecision d) {
            return new Reservation(false, null, null, null, d);
        }
    }

    private record Promotion(boolean promoted, Session session, StartFailure failure, String message) {
        static Promotion promoted(Session s) { return new Promotion(true, s, null, null); }

        static Promotion rejected(StartFailure f, String message) { return new Promotion(false, null, f, message); }
    }
}
