package net.gpuwarden.core.maintenance;

import net.gpuwarden.core.quota.QuotaEvaluator;
import net.gpuwarden.core.spi.Clock;
import net.gpuwarden.core.spi.TxRunner;
import net.gpuwarden.core.spi.WorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

public final class MaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

    public static final String EXPIRED_RESERVATION_REASON = "reservation expired; reclaimed by maintenance";

    private final WorkerRepository workers;
    private final QuotaEvaluator quota;
    private final TxRunner tx;
    private final Clock clock;

    public MaintenanceService(WorkerRepository workers,
                              QuotaEvaluator quota,
                              TxRunner tx,
                              Clock clock) {
        this.workers = workers;
        this.quota = quota;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * 주기 점검.
     * - 만료 예약 회수 (starting → offline)
     * - 주간 창이 바뀐 워커의 사용량 초기화
     */
    public MaintenanceReport runOnce() throws Exception {
        Instant now = clock.now();
        MaintenanceReport r = new MaintenanceReport();

        r.reclaimedReservations = reclaimExpiredReservations(now);

        Instant windowStart = quota.currentWindowStart(now);
        r.weeklyCountersReset = tx.required(() -> workers.rollWeeklyWindow(windowStart, now));
        if (r.weeklyCountersReset > 0) {
            log.info("Weekly quota window rolled over at {}: {} counter(s) reset", windowStart, r.weeklyCountersReset);
        }

        r.timestamp = now;
        return r;
    }

    public int reclaimExpiredReservations(Instant now) throws Exception {
        int n = tx.required(() -> workers.reclaimExpiredReservations(now, EXPIRED_RESERVATION_REASON));
        if (n > 0) log.warn("Reclaimed {} expired reservation(s)", n);
        return n;
    }

    public static final class MaintenanceReport {
        public Instant timestamp;
        public int reclaimedReservations;
        public int weeklyCountersReset;

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", reclaimedReservations=" + reclaimedReservations +
                    ", weeklyCountersReset=" + weeklyCountersReset +
                    '}';
        }
    }
}
