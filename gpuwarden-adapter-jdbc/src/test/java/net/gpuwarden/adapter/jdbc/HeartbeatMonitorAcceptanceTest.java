package net.gpuwarden.adapter.jdbc;

import net.gpuwarden.core.maintenance.HeartbeatMonitor;
import net.gpuwarden.core.maintenance.HeartbeatMonitor.HeartbeatReport;
import net.gpuwarden.core.maintenance.Watchdog;
import net.gpuwarden.core.model.Provider;
import net.gpuwarden.core.model.Session;
import net.gpuwarden.core.model.ShutdownReason;
import net.gpuwarden.core.model.StartResult;
import net.gpuwarden.core.model.Worker;
import net.gpuwarden.core.model.WorkerStatus;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@TestMethodOrder(MethodOrderer.MethodName.class)
class HeartbeatMonitorAcceptanceTest extends ControlPlaneTestSupport {

    @Test
    void a1_silentOnlineWorker_isDemoted_andItsSessionClosed() throws Exception {
        Worker w = newWorker("kaggle-a", Provider.KAGGLE);
        StartResult started = coordinator.startSession(w.id(), "x");
        registration.register(w.id(), null);

        clock.advance(Duration.ofMinutes(3));
        assertThat(heartbeats.runOnce().demoted).isZero();

        clock.advance(Duration.ofSeconds(1));
        HeartbeatReport r = heartbeats.runOnce();

        assertThat(r.checked).isEqualTo(1);
        assertThat(r.demoted).isEqualTo(1);
        assertThat(reload(w.id()).status()).isEqualTo(WorkerStatus.OFFLINE);
        assertThat(session(started.sessionId()).shutdownReason()).isEqualTo(ShutdownReason.HEARTBEAT_LOST);
        assertThat(reload(w.id()).weeklyUsageSeconds()).isEqualTo(Duration.ofSeconds(181).toSeconds());
    }

    @Test
    void a2_heartbeats_keepWorkerOnline() throws Exception {
        Worker w = newWorker("kaggle-a", Provider.KAGGLE);
        coordinator.startSession(w.id(), "x");
        registration.register(w.id(), null);

        for (int i = 0; i < 5; i++) {
            clock.advance(Duration.ofMinutes(2));
            registration.heartbeat(w.id(), null);
            heartbeats.runOnce();
        }

        assertThat(reload(w.id()).status()).isEqualTo(WorkerStatus.ONLINE);
        assertThat(activeSession(w.id())).isPresent();
    }

    @Test
    void b1_pendingWorkerWithoutHeartbeat_fallsBackToSessionStart() throws Exception {
        Worker w = newWorker("colab-a", Provider.COLAB);
        coordinator.startSession(w.id(), "x");
        Worker pending = reload(w.id());
        assertThat(pending.lastHeartbeatAt()).isNull();
        assertThat(pending.lastSeenAt()).isEqualTo(T0);

        clock.advance(Duration.ofMinutes(4));
        assertThat(heartbeats.runOnce().demoted).isEqualTo(1);

        assertThat(reload(w.id()).status()).isEqualTo(WorkerStatus.OFFLINE);
        assertThat(activeSession(w.id())).isEmpty();
    }

    @Test
    void b2_liveWorkerWithoutSession_fallsBackToCreatedAt() throws Exception {
        Worker w = newWorker("colab-a", Provider.COLAB);
        exec("UPDATE TB_GPU_WORKER SET STATUS = 'UNHEALTHY' WHERE ID = ?", w.id());

        clock.advance(Duration.ofMinutes(2));
        assertThat(heartbeats.runOnce().demoted).isZero();

        clock.advance(Duration.ofMinutes(2));
        assertThat(heartbeats.runOnce().demoted).isEqualTo(1);

        Worker after = reload(w.id());
        assertThat(after.status()).isEqualTo(WorkerStatus.OFFLINE);
        assertThat(after.lastError()).isEqualTo("heartbeat lost");
    }

    @Test
    void c1_startingAndOfflineWorkers_areNotWatched() throws Exception {
        Worker starting = newWorker("kaggle-a", Provider.KAGGLE);
        newWorker("colab-a", Provider.COLAB);
        tx.required(() -> workers.markReserved(starting.id(), "tok", T0.plus(Duration.ofMinutes(5)), T0));

        clock.advance(Duration.ofMinutes(30));
        HeartbeatReport r = heartbeats.runOnce();

        assertThat(r.checked).isZero();
        assertThat(reload(starting.id()).status()).isEqualTo(WorkerStatus.STARTING);
    }

    @Test
    void c2_customTimeout() throws Exception {
        Worker w = newWorker("kaggle-a", Provider.KAGGLE);
        coordinator.startSession(w.id(), "x");
        registration.register(w.id(), null);
        heartbeats.setTimeout(Duration.ofMinutes(10));
        try {
            clock.advance(Duration.ofMinutes(5));
            assertThat(heartbeats.runOnce().demoted).isZero();
            clock.advance(Duration.ofMinutes(6));
            assertThat(heartbeats.runOnce().demoted).isEqualTo(1);
        } finally {
            heartbeats.setTimeout(HeartbeatMonitor.DEFAULT_TIMEOUT);
        }
    }

    @Test
    void d1_afterRestart_orphansAreRecoveredBeforeTheFirstSweep() throws Exception {
        Watchdog restarted = new Watchdog(sessions, workers, lifecycle, tx, clock, executor);
        HeartbeatMonitor monitor = new HeartbeatMonitor(workers, lifecycle, tx, clock);
        monitor.awaitRecoveryOf(restarted);

        Worker orphanWorker = newWorker("kaggle-a", Provider.KAGGLE);
        Session orphan = seedActiveSession(orphanWorker, T0.minus(Duration.ofHours(2)), Duration.ofHours(1));
        Worker silentWorker = newWorker("colab-a", Provider.COLAB);
        Session silent = seedActiveSession(silentWorker, T0.minus(Duration.ofMinutes(10)), Duration.ofHours(8));

        // 스케줄러가 복구 패스보다 먼저 점검을 돌린 경우
        HeartbeatReport r = monitor.runOnce();
        assertThat(restarted.recoverOrphans()).isZero();

        assertThat(r.deferred).isFalse();
        assertThat(r.demoted).isEqualTo(1);
        assertThat(session(orphan.id()).shutdownReason()).isEqualTo(ShutdownReason.ORPHANED_RECOVERY);
        assertThat(session(silent.id()).shutdownReason()).isEqualTo(ShutdownReason.HEARTBEAT_LOST);
        assertThat(reload(orphanWorker.id()).status()).isEqualTo(WorkerStatus.OFFLINE);
        assertThat(restarted.isRecovered()).isTrue();
    }
}
