package net.gpuwarden.core.spi;

import net.gpuwarden.core.model.NewWorker;
import net.gpuwarden.core.model.Provider;
import net.gpuwarden.core.model.Worker;
import net.gpuwarden.core.model.WorkerStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface WorkerRepository {
    Worker insert(NewWorker w, Instant now) throws Exception;

    Optional<Worker> findById(long id) throws Exception;

    Optional<Worker> findByName(String name) throws Exception;

    /** SELECT ... FOR UPDATE */
    Optional<Worker> lockById(long id) throws Exception;

    List<Worker> findAll() throws Exception;

    List<Worker> findByProvider(Provider provider) throws Exception;

    List<Worker> findByStatuses(WorkerStatus... statuses) throws Exception;

    /** 프로바이더 단위 직렬화 락 (TB_PROVIDER_LOCK 행) */
    void lockProvider(Provider provider) throws Exception;

    void updateProfile(long id, Provider provider, String accountId, String capabilities, Instant now) throws Exception;

    /** offline/만료 예약 → starting */
    void markReserved(long id, String token, Instant expiresAt, Instant now) throws Exception;

    /** starting → pending, 토큰 해제 */
    void markPending(long id, String endpointUrl, String externalId, Instant sessionStartedAt, Instant now) throws Exception;

    /** 토큰 일치 시에만 starting → offline */
    boolean release(long id, String token, String reason, Instant now) throws Exception;

    /** 만료 예약 일괄 회수 */
    int reclaimExpiredReservations(Instant now, String reason) throws Exception;

    void recordHeartbeat(long id, WorkerStatus status, String endpointUrl, long sessionDurationSeconds, Instant heartbeatAt) throws Exception;

    void updateStatus(long id, WorkerStatus status, String lastError, Instant now) throws Exception;

    /** 세션 종료 정산 결과 반영, status → offline */
    void recordSessionEnd(long id, long sessionDurationSeconds, long weeklyUsageSeconds, Instant weekStartedAt,
                          Instant cooldownUntil, String lastError, Instant now) throws Exception;

    /** 지난 주간 창에 속한 사용량 초기화 */
    int rollWeeklyWindow(Instant windowStart, Instant now) throws Exception;
}
