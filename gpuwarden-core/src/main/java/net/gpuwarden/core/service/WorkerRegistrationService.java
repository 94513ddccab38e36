package net.gpuwarden.core.service;

import net.gpuwarden.core.model.HeartbeatAck;
import net.gpuwarden.core.model.NewWorker;
import net.gpuwarden.core.model.ShutdownReason;
import net.gpuwarden.core.model.StopResult;
import net.gpuwarden.core.model.Worker;
import net.gpuwarden.core.model.WorkerStatus;
import net.gpuwarden.core.spi.Clock;
import net.gpuwarden.core.spi.TxRunner;
import net.gpuwarden.core.spi.WorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * 원격 워커가 호출하는 쪽: 자기 등록, 하트비트, 종료 보고.
 * 외부 헬스체크가 쓰는 unhealthy/healthy 전이도 여기서 처리한다.
 */
public final class WorkerRegistrationService {
    private static final Logger log = LoggerFactory.getLogger(WorkerRegistrationService.class);

    private final WorkerRepository workers;
    private final SessionLifecycleService lifecycle;
    private final TxRunner tx;
    private final Clock clock;

    public WorkerRegistrationService(WorkerRepository workers,
                                     SessionLifecycleService lifecycle,
                                     TxRunner tx,
                                     Clock clock) {
        this.workers = workers;
        this.lifecycle = lifecycle;
        this.tx = tx;
        this.clock = clock;
    }

    /** 관리자 프로비저닝: 이름이 같으면 프로필만 갱신 */
    public Worker createOrUpdate(NewWorker def) throws Exception {
        return tx.required(() -> {
            Instant now = clock.now();
            var existing = workers.findByName(def.name());
            if (existing.isPresent()) {
                long id = existing.get().id();
                workers.updateProfile(id, def.provider(), def.accountId(), def.capabilities(), now);
                return workers.findById(id).orElseThrow();
            }
            Worker w = workers.insert(def, now);
            log.info("Worker created: id={} name='{}' provider={}", w.id(), w.name(), w.provider());
            return w;
        });
    }

    /**
     * 기동된 원격 자원의 자기 등록. pending/unhealthy → online, 하트비트 시계 초기화.
     * offline 이나 starting 워커의 등록은 받지 않는다 (세션 원장에 없는 자원).
     */
    public HeartbeatAck register(long workerId, String endpointUrl) throws Exception {
        return tx.required(() -> {
            Instant now = clock.now();
            Worker w = workers.lockById(workerId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown worker: " + workerId));
            if (!w.status().isLive()) {
                log.warn("Registration rejected: worker {} is {}", workerId, w.status());
                return new HeartbeatAck(false, w.status(), true);
            }
            String url = endpointUrl == null || endpointUrl.isBlank() ? w.endpointUrl() : endpointUrl;
            workers.recordHeartbeat(workerId, WorkerStatus.ONLINE, url, w.sessionDurationSeconds(), now);
            if (w.status() != WorkerStatus.ONLINE) {
                log.info("Worker {} registered: {} -> ONLINE endpoint={}", workerId, w.status(), url);
            }
            return new HeartbeatAck(true, WorkerStatus.ONLINE, false);
        });
    }

    /**
     * 하트비트. pending → online 승격, 세션 진행 시간 갱신.
     *
     * @param reportedRuntime 원격이 보고한 세션 경과 시간 (없으면 null)
     */
    public HeartbeatAck heartbeat(long workerId, Duration reportedRuntime) throws Exception {
        HeartbeatAck ack = tx.required(() -> {
            Instant now = clock.now();
            Worker w = workers.lockById(workerId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown worker: " + workerId));
            if (!w.status().isLive()) {
                log.warn("Heartbeat rejected: worker {} is {}", workerId, w.status());
                return new HeartbeatAck(false, w.status(), true);
            }
            boolean shouldShutdown = lifecycle.updateSessionDuration(workerId, reportedRuntime);
            long seconds = lifecycle.activeSession(workerId)
                    .map(s -> s.sessionDurationMs() / 1000)
                    .orElse(w.sessionDurationSeconds());
            // unhealthy 는 헬스체크가 풀어준다
            WorkerStatus next = w.status() == WorkerStatus.PENDING ? WorkerStatus.ONLINE : w.status();
            workers.recordHeartbeat(workerId, next, w.endpointUrl(), seconds, now);
            if (next != w.status()) log.info("Worker {} promoted by heartbeat: {} -> {}", workerId, w.status(), next);
            return new HeartbeatAck(true, next, shouldShutdown);
        });
        if (ack.shouldShutdown()) {
            log.info("Worker {} reached its session budget; asking it to shut down", workerId);
        }
        return ack;
    }

    /** 원격이 스스로 정지했음을 보고 */
    public StopResult reportShutdown(long workerId) throws Exception {
        return lifecycle.stopSession(workerId, ShutdownReason.JOB_COMPLETED);
    }

    public void markUnhealthy(long workerId, String error) throws Exception {
        transition(workerId, WorkerStatus.ONLINE, WorkerStatus.UNHEALTHY, error);
    }

    public void markHealthy(long workerId) throws Exception {
        transition(workerId, WorkerStatus.UNHEALTHY, WorkerStatus.ONLINE, null);
    }

    private void transition(long workerId, WorkerStatus from, WorkerStatus to, String error) throws Exception {
        tx.required(() -> {
            Worker w = workers.lockById(workerId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown worker: " + workerId));
            if (w.status() != from) {
                log.debug("Ignoring {} -> {} for worker {} in status {}", from, to, workerId, w.status());
                return;
            }
            workers.updateStatus(workerId, to, error, clock.now());
            log.info("Worker {} {} -> {}{}", workerId, from, to, error == null ? "" : " (" + error + ")");
        });
    }
}
