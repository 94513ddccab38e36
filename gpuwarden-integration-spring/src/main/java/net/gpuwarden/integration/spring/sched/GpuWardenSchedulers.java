package net.gpuwarden.integration.spring.sched;

import net.gpuwarden.core.maintenance.HeartbeatMonitor;
import net.gpuwarden.core.maintenance.MaintenanceService;
import net.gpuwarden.core.maintenance.Watchdog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * 주기 작업 (watchdog / heartbeat / maintenance). 실패는 로그만 남긴다.
 */
public class GpuWardenSchedulers {
    private static final Logger log = LoggerFactory.getLogger(GpuWardenSchedulers.class);

    private final Watchdog watchdog;
    private final HeartbeatMonitor heartbeats;
    private final MaintenanceService maintenance;

    public GpuWardenSchedulers(Watchdog watchdog, HeartbeatMonitor heartbeats, MaintenanceService maintenance) {
        this.watchdog = watchdog;
        this.heartbeats = heartbeats;
        this.maintenance = maintenance;
    }

    @Scheduled(fixedDelayString = "${gpuwarden.scheduler.watchdog-delay-ms:60000}")
    public void watchdog() {
        int closed = watchdog.runOnce();
        if (closed > 0) log.info("Watchdog tick closed {} session(s)", closed);
    }

    @Scheduled(fixedDelayString = "${gpuwarden.scheduler.heartbeat-delay-ms:60000}")
    public void heartbeats() {
        heartbeats.runOnce();
    }

    @Scheduled(fixedDelayString = "${gpuwarden.scheduler.maintenance-delay-ms:60000}")
    public void maintenance() {
        try {
            var r = maintenance.runOnce();
            log.debug("Maintenance: {}", r);
        } catch (Exception e) {
            log.error("Maintenance run failed", e);
        }
    }
}
