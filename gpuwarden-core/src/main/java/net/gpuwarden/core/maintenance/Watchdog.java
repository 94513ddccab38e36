package net.gpuwarden.core.maintenance;

import net.gpuwarden.core.model.Session;
import net.gpuwarden.core.model.ShutdownReason;
import net.gpuwarden.core.model.StopResult;
import net.gpuwarden.core.model.Worker;
import net.gpuwarden.core.service.SessionLifecycleService;
import net.gpuwarden.core.spi.Clock;
import net.gpuwarden.core.spi.RemoteShutdownNotifier;
import net.gpuwarden.core.spi.SessionRepository;
import net.gpuwarden.core.spi.TxRunner;
import net.gpuwarden.core.spi.WorkerRepository;
import net.gpuwarden.core.support.BoundedCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 세션 원장 주기 점검.
 * 세션 상태는 매번 저장소에서 읽는다. 이 객체가 기억하는 건 콜백과 통계뿐이다.
 */
public final class Watchdog {
    private static final Logger log = LoggerFactory.getLogger(Watchdog.class);

    public static final Duration DEFAULT_CALLBACK_TIMEOUT = Duration.ofSeconds(30);

    private final SessionRepository sessions;
    private final WorkerRepository workers;
    private final SessionLifecycleService lifecycle;
    private final TxRunner tx;
    private final Clock clock;
    private final ExecutorService executor;

    private volatile ShutdownCallback callback;
    private Duration callbackTimeout = DEFAULT_CALLBACK_TIMEOUT;

    // 복구 패스가 끝나기 전에는 어떤 점검도 원장을 건드리지 않는다
    private final ReentrantLock recoveryLock = new ReentrantLock();
    private volatile boolean recovered;
    private final AtomicReference<Instant> lastCheckAt = new AtomicReference<>();
    private final AtomicLong shutdownsPerformed = new AtomicLong();

    public Watchdog(SessionRepository sessions,
                    WorkerRepository workers,
                    SessionLifecycleService lifecycle,
                    TxRunner tx,
                    Clock clock,
                    ExecutorService executor) {
        this.sessions = sessions;
        this.workers = workers;
        this.lifecycle = lifecycle;
        this.tx = tx;
        this.clock = clock;
        this.executor = executor;
        this.callback = (w, s) -> { };
    }

    /** 원격 정지 알림을 콜백으로 등록 */
    public static ShutdownCallback notifying(RemoteShutdownNotifier notifier) {
        return (w, s) -> notifier.notifyShutdown(w);
    }

    public void registerShutdownCallback(ShutdownCallback callback) {
        this.callback = callback == null ? (w, s) -> { } : callback;
    }

    /**
     * 기동 직후 복구 패스: 직전 프로세스가 죽으면서 남긴 (마감이 지난) 활성 세션을 닫는다.
     * 프로세스당 한 번만 동작한다. 완료 표시는 모든 세션을 처리한 뒤에 하고,
     * 그 사이 다른 스레드의 점검은 락에서 기다린다.
     *
     * @return 닫은 세션 수
     */
    public int recoverOrphans() {
        recoveryLock.lock();
        try {
            if (recovered) return 0;
            List<Session> overdue;
            try {
                Instant now = clock.now();
                overdue = tx.required(() -> sessions.findActiveOverdue(now));
            } catch (Exception e) {
                log.error("Watchdog recovery pass could not read the session ledger; will retry on next tick", e);
                return 0;
            }
            int closed = 0;
            for (Session s : overdue) {
                if (close(s, ShutdownReason.ORPHANED_RECOVERY, false)) closed++;
            }
            recovered = true;
            if (closed > 0) log.warn("Watchdog recovery closed {} orphaned session(s)", closed);
            else log.info("Watchdog recovery pass: no orphaned sessions");
            return closed;
        } finally {
            recoveryLock.unlock();
        }
    }

    /**
     * 복구 패스가 아직이면 지금 돌린다. 다른 스레드가 도는 중이면 끝날 때까지 기다린다.
     *
     * @return 복구가 끝났으면 true (원장을 못 읽어 실패하면 false)
     */
    public boolean ensureRecovered() {
        if (!recovered) recoverOrphans();
        return recovered;
    }

    /**
     * 한 번의 점검. 마감 시각이 지났거나 기록된 진행 시간이 최대치에 도달한 세션을
     * 콜백으로 정지시키고 quota_exceeded 로 닫는다. 세션별 실패는 격리된다.
     *
     * @return 닫은 세션 수
     */
    public int runOnce() {
        if (!ensureRecovered()) {
            log.warn("Watchdog tick skipped: recovery pass has not completed");
            return 0;
        }

        Instant now = clock.now();
        lastCheckAt.set(now);
        List<Session> active;
        try {
            active = tx.required(sessions::findActive);
        } catch (Exception e) {
            log.error("Watchdog could not read active sessions", e);
            return 0;
        }

        int closed = 0;
        for (Session s : active) {
            if (!s.dueForShutdown(now)) continue;
            log.warn("Session {} on worker {} is due: autoShutdownAt={} duration={}ms max={}ms",
                    s.id(), s.workerId(), s.autoShutdownAt(), s.sessionDurationMs(), s.maxSessionDurationMs());
            if (close(s, ShutdownReason.QUOTA_EXCEEDED, true)) closed++;
        }
        return closed;
    }

    /** 관리자 강제 종료 (admin_override) */
    public StopResult forceShutdown(long workerId, String note) throws Exception {
        return shutdown(workerId, ShutdownReason.ADMIN_OVERRIDE, note);
    }

    /**
     * 운영자 정지: 원격에 먼저 정지를 알리고 (실패해도) 주어진 사유로 원장을 닫는다.
     * 활성 세션이 없으면 워커 상태만 정리한다.
     */
    public StopResult shutdown(long workerId, ShutdownReason reason, String note) throws Exception {
        Optional<Session> active = tx.required(() -> sessions.findActiveByWorker(workerId));
        if (active.isEmpty()) {
            log.info("Shutdown of worker {} as {}: no active session ({})", workerId, reason.code(), note);
            return lifecycle.stopSession(workerId, reason);
        }
        log.warn("Shutdown of worker {} session {} as {} requested: {}", workerId, active.get().id(), reason.code(), note);
        invokeCallback(active.get());
        StopResult r = lifecycle.closeSession(active.get().id(), reason);
        if (r.closed()) shutdownsPerformed.incrementAndGet();
        return r;
    }

    public WatchdogStatus status() throws Exception {
        int active = tx.required(sessions::findActive).size();
        return new WatchdogStatus(recovered, lastCheckAt.get(), shutdownsPerformed.get(), active);
    }

    /** 콜백 → 원장 종료. 콜백 실패와 무관하게 종료를 시도한다. */
    private boolean close(Session s, ShutdownReason reason, boolean callbackFirst) {
        if (callbackFirst) invokeCallback(s);
        boolean closed = false;
        try {
            StopResult r = lifecycle.closeSession(s.id(), reason);
            closed = r.closed();
            if (closed) shutdownsPerformed.incrementAndGet();
        } catch (Exception e) {
            log.error("Watchdog failed to close session {} (worker {}) as {}", s.id(), s.workerId(), reason.code(), e);
        }
        if (!callbackFirst && closed) invokeCallback(s);
        return closed;
    }

    private void invokeCallback(Session s) {
        ShutdownCallback cb = callback;
        try {
            Worker w = tx.required(() -> workers.findById(s.workerId())).orElse(null);
            if (w == null) {
                log.warn("Session {} references missing worker {}; skipping remote shutdown", s.id(), s.workerId());
                return;
            }
            BoundedCall.call(executor, () -> { cb.onShutdown(w, s); return null; }, callbackTimeout);
        } catch (Exception e) {
            log.error("Remote shutdown of worker {} (session {}) failed; closing the session anyway",
                    s.workerId(), s.id(), e);
        }
    }

    public void setCallbackTimeout(Duration callbackTimeout) { this.callbackTimeout = callbackTimeout; }

    public boolean isRecovered() { return recovered; }
}
