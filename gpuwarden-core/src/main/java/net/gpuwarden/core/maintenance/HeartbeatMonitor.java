package net.gpuwarden.core.maintenance;

import net.gpuwarden.core.model.ShutdownReason;
import net.gpuwarden.core.model.Worker;
import net.gpuwarden.core.model.WorkerStatus;
import net.gpuwarden.core.service.SessionLifecycleService;
import net.gpuwarden.core.spi.Clock;
import net.gpuwarden.core.spi.TxRunner;
import net.gpuwarden.core.spi.WorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 생존 감시. offline 이 아닌 워커 중 기준 시각 이후 timeout 이 지난 워커를 offline 으로 내린다.
 * 기준 시각: lastHeartbeatAt → sessionStartedAt → createdAt.
 * starting 워커는 예약 TTL 로 관리되므로 여기서는 보지 않는다.
 * 워치독이 연결돼 있으면 그 복구 패스가 끝난 뒤에만 점검한다.
 */
public final class HeartbeatMonitor {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(3);

    private final WorkerRepository workers;
    private final SessionLifecycleService lifecycle;
    private final TxRunner tx;
    private final Clock clock;
    private Duration timeout = DEFAULT_TIMEOUT;
    private Watchdog recovery;

    public HeartbeatMonitor(WorkerRepository workers,
                            SessionLifecycleService lifecycle,
                            TxRunner tx,
                            Clock clock) {
        this.workers = workers;
        this.lifecycle = lifecycle;
        this.tx = tx;
        this.clock = clock;
    }

    public HeartbeatReport runOnce() {
        Instant now = clock.now();
        HeartbeatReport r = new HeartbeatReport();
        r.timestamp = now;

        if (recovery != null && !recovery.ensureRecovered()) {
            log.warn("Heartbeat sweep deferred: watchdog recovery pass has not completed");
            r.deferred = true;
            return r;
        }

        List<Worker> watched;
        try {
            watched = tx.required(() -> workers.findByStatuses(
                    WorkerStatus.PENDING, WorkerStatus.ONLINE, WorkerStatus.UNHEALTHY));
        } catch (Exception e) {
            log.error("Heartbeat monitor could not read workers", e);
            return r;
        }

        for (Worker w : watched) {
            r.checked++;
            Instant seen = w.lastSeenAt();
            if (seen == null) {
                log.warn("Worker {} has no heartbeat, session start or creation time; skipping", w.id());
                r.skipped++;
                continue;
            }
            if (Duration.between(seen, now).compareTo(timeout) <= 0) continue;
            try {
                if (demote(w.id(), now)) r.demoted++;
            } catch (Exception e) {
                r.failed++;
                log.error("Failed to demote silent worker {}", w.id(), e);
            }
        }
        if (r.demoted > 0) log.warn("Heartbeat sweep: {}", r);
        return r;
    }

    /** 락을 잡고 다시 판정한다 (그 사이 하트비트가 왔을 수 있음) */
    private boolean demote(long workerId, Instant now) throws Exception {
        return tx.required(() -> {
            Worker w = workers.lockById(workerId).orElse(null);
            if (w == null || !w.status().isLive()) return false;
            Instant seen = w.lastSeenAt();
            if (seen == null || Duration.between(seen, now).compareTo(timeout) <= 0) return false;

            log.warn("Worker {} silent since {} (> {}); {} -> OFFLINE", workerId, seen, timeout, w.status());
            var stopped = lifecycle.stopSession(workerId, ShutdownReason.HEARTBEAT_LOST);
            if (!stopped.closed()) {
                workers.updateStatus(workerId, WorkerStatus.OFFLINE, "heartbeat lost", now);
            }
            return true;
        });
    }

    public void setTimeout(Duration timeout) { this.timeout = timeout; }

    /** 이 워치독의 복구 패스가 끝나기 전에는 점검하지 않는다 */
    public void awaitRecoveryOf(Watchdog watchdog) { this.recovery = watchdog; }

    public static final class HeartbeatReport {
        public Instant timestamp;
        public int checked;
        public int demoted;
        public int skipped;
        public int failed;
        public boolean deferred;

        @Override public String toString() {
            return "HeartbeatReport{" +
                    "timestamp=" + timestamp +
                    ", checked=" + checked +
                    ", demoted=" + demoted +
                    ", skipped=" + skipped +
                    ", failed=" + failed +
                    ", deferred=" + deferred +
                    '}';
        }
    }
}
