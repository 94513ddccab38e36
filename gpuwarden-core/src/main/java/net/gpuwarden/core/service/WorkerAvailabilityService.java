package net.gpuwarden.core.service;

import net.gpuwarden.core.model.AvailabilityPreferences;
import net.gpuwarden.core.model.EnsureResult;
import net.gpuwarden.core.model.QuotaFamily;
import net.gpuwarden.core.model.Session;
import net.gpuwarden.core.model.StartResult;
import net.gpuwarden.core.model.Worker;
import net.gpuwarden.core.model.WorkerStatus;
import net.gpuwarden.core.model.WorkerStatusView;
import net.gpuwarden.core.quota.QuotaEvaluator;
import net.gpuwarden.core.spi.Clock;
import net.gpuwarden.core.spi.SessionRepository;
import net.gpuwarden.core.spi.TxRunner;
import net.gpuwarden.core.spi.WorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import static net.gpuwarden.core.support.Durations.human;

/**
 * 추론/학습 디스패치가 쓰는 진입점.
 * 가능한 한 기존 워커를 재사용하고, 없으면 하나를 기동해 online 이 될 때까지 기다린다.
 */
public final class WorkerAvailabilityService {
    private static final Logger log = LoggerFactory.getLogger(WorkerAvailabilityService.class);

    /** 사용량 계열 먼저 */
    private static final Comparator<Worker> START_ORDER = Comparator
            .comparing((Worker w) -> w.provider().family() == QuotaFamily.USAGE_METERED ? 0 : 1)
            .thenComparingLong(Worker::id);

    private final WorkerRepository workers;
    private final SessionRepository sessions;
    private final ReservationCoordinator coordinator;
    private final QuotaEvaluator quota;
    private final TxRunner tx;
    private final Clock clock;

    public WorkerAvailabilityService(WorkerRepository workers,
                                     SessionRepository sessions,
                                     ReservationCoordinator coordinator,
                                     QuotaEvaluator quota,
                                     TxRunner tx,
                                     Clock clock) {
        this.workers = workers;
        this.sessions = sessions;
        this.coordinator = coordinator;
        this.quota = quota;
        this.tx = tx;
        this.clock = clock;
    }

    public EnsureResult ensureAvailable(AvailabilityPreferences prefs) throws Exception {
        List<Worker> candidates = tx.required(() -> workers.findAll()).stream()
                .filter(w -> prefs.provider() == null || w.provider() == prefs.provider())
                .sorted(START_ORDER)
                .toList();

        Optional<Worker> online = candidates.stream().filter(w -> w.status().isReusable()).findFirst();
        if (online.isPresent()) {
            log.debug("Reusing online worker {}", online.get().id());
            return EnsureResult.reused(online.get());
        }

        // 다른 호출이 이미 띄우는 중이면 그걸 기다린다
        Optional<Worker> pending = candidates.stream().filter(w -> w.status() == WorkerStatus.PENDING).findFirst();
        if (pending.isPresent()) {
            return awaitOnline(pending.get().id(), prefs, false);
        }

        Instant now = clock.now();
        List<String> reasons = new ArrayList<>();
        for (Worker w : candidates) {
            if (w.status().isLive() || w.reservationInFlight(now)) {
                reasons.add(label(w) + ": busy (" + w.status().code().toLowerCase() + ")");
                continue;
            }
            StartResult r;
            try {
                r = coordinator.startSession(w.id(), prefs.reason());
            } catch (Exception e) {
                log.error("Start attempt on worker {} aborted", w.id(), e);
                reasons.add(label(w) + ": store error (" + e.getMessage() + ")");
                continue;
            }
            if (r.success()) {
                return awaitOnline(w.id(), prefs, true);
            }
            reasons.add(label(w) + ": " + r.reason() + " - " + r.message());
        }

        String reason = reasons.isEmpty()
                ? "no workers registered" + (prefs.provider() == null ? "" : " for " + prefs.provider().code())
                : String.join("; ", reasons);
        log.warn("No GPU worker available: {}", reason);
        return EnsureResult.unavailable(null, false, reason);
    }

    /** 실제 경과 시간(nanoTime)으로 대기한다 */
    private EnsureResult awaitOnline(long workerId, AvailabilityPreferences prefs, boolean startedNew) throws Exception {
        long deadline = System.nanoTime() + prefs.maxWait().toNanos();
        while (true) {
            Worker w = tx.required(() -> workers.findById(workerId)).orElse(null);
            if (w == null) return EnsureResult.unavailable(workerId, startedNew, "worker " + workerId + " disappeared");
            if (w.status() == WorkerStatus.ONLINE) return EnsureResult.ready(w, startedNew);
            if (w.status() == WorkerStatus.OFFLINE) {
                return EnsureResult.unavailable(workerId, startedNew,
                        "worker " + workerId + " went offline before registering"
                                + (w.lastError() == null ? "" : " (" + w.lastError() + ")"));
            }
            long left = deadline - System.nanoTime();
            if (left <= 0) {
                return EnsureResult.unavailable(workerId, startedNew,
                        "worker " + workerId + " did not come online within " + human(prefs.maxWait())
                                + " (status " + w.status().code().toLowerCase() + ")");
            }
            Thread.sleep(Math.min(prefs.pollInterval().toMillis(), Math.max(1, left / 1_000_000)));
        }
    }

    public WorkerStatusView getStatus(long workerId) throws Exception {
        return tx.required(() -> {
            Worker w = workers.findById(workerId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown worker: " + workerId));
            return view(w, sessions.findActiveByWorker(workerId), clock.now());
        });
    }

    public List<WorkerStatusView> listStatus() throws Exception {
        return tx.required(() -> {
            Instant now = clock.now();
            List<WorkerStatusView> out = new ArrayList<>();
            for (Worker w : workers.findAll()) out.add(view(w, sessions.findActiveByWorker(w.id()), now));
            return out;
        });
    }

    private WorkerStatusView view(Worker w, Optional<Session> active, Instant now) {
        Duration runtime = active.map(s -> Duration.ofMillis(s.measuredDurationMs(now))).orElse(Duration.ZERO);
        QuotaEvaluator.QuotaUsage usage = quota.usage(w, runtime, now);
        Duration cooldown = w.cooldownUntil() != null && w.cooldownUntil().isAfter(now)
                ? Duration.between(now, w.cooldownUntil())
                : Duration.ZERO;
        return new WorkerStatusView(w.id(), w.name(), w.provider(), w.status(),
                usage.used(), usage.remaining(), usage.level(), runtime, cooldown,
                active.map(Session::autoShutdownAt).orElse(null), w.lastHeartbeatAt());
    }

    private static String label(Worker w) {
        return w.name() + "#" + w.id() + " (" + w.provider().code() + ")";
    }
}
