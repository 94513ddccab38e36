package net.gpuwarden.adapter.jdbc;

import net.gpuwarden.core.model.HeartbeatAck;
import net.gpuwarden.core.model.NewWorker;
import net.gpuwarden.core.model.Provider;
import net.gpuwarden.core.model.ShutdownReason;
import net.gpuwarden.core.model.StartResult;
import net.gpuwarden.core.model.StopResult;
import net.gpuwarden.core.model.Worker;
import net.gpuwarden.core.model.WorkerStatus;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestMethodOrder(MethodOrderer.MethodName.class)
class WorkerRegistrationAcceptanceTest extends ControlPlaneTestSupport {

    @Test
    void a1_createOrUpdate_upsertsByName() throws Exception {
        Worker created = registration.createOrUpdate(new NewWorker("gpu-1", Provider.KAGGLE, "acct-main", null));
        Worker updated = registration.createOrUpdate(new NewWorker("gpu-1", Provider.COLAB, "acct-2", "{\"gpu\":\"A100\"}"));

        assertThat(updated.id()).isEqualTo(created.id());
        assertThat(updated.provider()).isEqualTo(Provider.COLAB);
        assertThat(updated.accountId()).isEqualTo("acct-2");
        assertThat(updated.capabilities()).contains("A100");
        assertThat(updated.status()).isEqualTo(WorkerStatus.OFFLINE);
    }

    @Test
    void b1_register_promotesPendingWorkerToOnline() throws Exception {
        Worker w = newWorker("kaggle-a", Provider.KAGGLE);
        coordinator.startSession(w.id(), "x");
        clock.advance(Duration.ofSeconds(40));

        HeartbeatAck ack = registration.register(w.id(), "https://tunnel.example/abc");

        assertThat(ack.accepted()).isTrue();
        assertThat(ack.status()).isEqualTo(WorkerStatus.ONLINE);
        Worker after = reload(w.id());
        assertThat(after.status()).isEqualTo(WorkerStatus.ONLINE);
        assertThat(after.endpointUrl()).isEqualTo("https://tunnel.example/abc");
        assertThat(after.lastHeartbeatAt()).isEqualTo(clock.now());
    }

    @Test
    void b2_register_isRejected_whenNoSessionWasStarted() throws Exception {
        Worker w = newWorker("kaggle-a", Provider.KAGGLE);

        HeartbeatAck ack = registration.register(w.id(), "https://rogue.example");

        assertThat(ack.accepted()).isFalse();
        assertThat(ack.shouldShutdown()).isTrue();
        assertThat(reload(w.id()).status()).isEqualTo(WorkerStatus.OFFLINE);
    }

    @Test
    void b3_register_unknownWorker() {
        assertThatThrownBy(() -> registration.register(424_242L, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("424242");
    }

    @Test
    void c1_heartbeat_promotesPending_andTracksRuntime() throws Exception {
        Worker w = newWorker("colab-a", Provider.COLAB);
        StartResult started = coordinator.startSession(w.id(), "x");
        clock.advance(Duration.ofMinutes(2));

        HeartbeatAck ack = registration.heartbeat(w.id(), null);

        assertThat(ack.accepted()).isTrue();
        assertThat(ack.status()).isEqualTo(WorkerStatus.ONLINE);
        assertThat(ack.shouldShutdown()).isFalse();
        assertThat(session(started.sessionId()).sessionDurationMs()).isEqualTo(Duration.ofMinutes(2).toMillis());
        assertThat(reload(w.id()).sessionDurationSeconds()).isEqualTo(120);
    }

    @Test
    void c2_heartbeat_asksToShutDown_whenBudgetReached() throws Exception {
        Worker w = newWorker("kaggle-a", Provider.KAGGLE);
        setWeeklyUsage(w.id(), Duration.ofHours(20).toSeconds());
        coordinator.startSession(w.id(), "x");
        registration.register(w.id(), null);

        clock.advance(Duration.ofMinutes(30));
        assertThat(registration.heartbeat(w.id(), null).shouldShutdown()).isFalse();

        clock.advance(Duration.ofMinutes(30));
        assertThat(registration.heartbeat(w.id(), null).shouldShutdown()).isTrue();
    }

    @Test
    void c3_reportedRuntime_neverMovesBackwards() throws Exception {
        Worker w = newWorker("colab-a", Provider.COLAB);
        StartResult started = coordinator.startSession(w.id(), "x");
        registration.heartbeat(w.id(), Duration.ofMinutes(20));
        registration.heartbeat(w.id(), Duration.ofMinutes(5));

        assertThat(session(started.sessionId()).sessionDurationMs()).isEqualTo(Duration.ofMinutes(20).toMillis());
    }

    @Test
    void c4_heartbeat_fromOfflineWorker_isRejected() throws Exception {
        Worker w = newWorker("colab-a", Provider.COLAB);

        HeartbeatAck ack = registration.heartbeat(w.id(), Duration.ofMinutes(1));

        assertThat(ack.accepted()).isFalse();
        assertThat(ack.shouldShutdown()).isTrue();
    }

    @Test
    void d1_reportShutdown_closesAsJobCompleted() throws Exception {
        Worker w = newWorker("kaggle-a", Provider.KAGGLE);
        StartResult started = coordinator.startSession(w.id(), "x");
        registration.register(w.id(), null);
        clock.advance(Duration.ofMinutes(45));

        StopResult r = registration.reportShutdown(w.id());

        assertThat(r.closed()).isTrue();
        assertThat(r.reason()).isEqualTo(ShutdownReason.JOB_COMPLETED);
        assertThat(session(started.sessionId()).shutdownReason()).isEqualTo(ShutdownReason.JOB_COMPLETED);
        assertThat(reload(w.id()).weeklyUsageSeconds()).isEqualTo(45 * 60);

        StopResult again = registration.reportShutdown(w.id());
        assertThat(again.closed()).isFalse();
        assertThat(reload(w.id()).weeklyUsageSeconds()).isEqualTo(45 * 60);
    }

    @Test
    void e1_unhealthy_andBack() throws Exception {
        Worker w = newWorker("kaggle-a", Provider.KAGGLE);
        coordinator.startSession(w.id(), "x");

        // pending 은 unhealthy 로 내리지 않는다
        registration.markUnhealthy(w.id(), "health check failed");
        assertThat(reload(w.id()).status()).isEqualTo(WorkerStatus.PENDING);

        registration.register(w.id(), null);
        registration.markUnhealthy(w.id(), "health check failed");
        Worker sick = reload(w.id());
        assertThat(sick.status()).isEqualTo(WorkerStatus.UNHEALTHY);
        assertThat(sick.lastError()).isEqualTo("health check failed");

        // unhealthy 도 하트비트는 받는다
        assertThat(registration.heartbeat(w.id(), null).status()).isEqualTo(WorkerStatus.UNHEALTHY);

        registration.markHealthy(w.id());
        assertThat(reload(w.id()).status()).isEqualTo(WorkerStatus.ONLINE);
        assertThat(activeSession(w.id())).isPresent();
    }
}
