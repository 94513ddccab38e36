package net.gpuwarden.adapter.jdbc.repo;

import net.gpuwarden.adapter.jdbc.TxContext;
import net.gpuwarden.adapter.jdbc.mapper.RowMappers;
import net.gpuwarden.core.model.NewWorker;
import net.gpuwarden.core.model.Provider;
import net.gpuwarden.core.model.Worker;
import net.gpuwarden.core.model.WorkerStatus;
import net.gpuwarden.core.spi.WorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.gpuwarden.adapter.jdbc.JdbcUtil.placeholders;
import static net.gpuwarden.adapter.jdbc.JdbcUtil.setInstant;
import static net.gpuwarden.adapter.jdbc.JdbcUtil.setString;

public final class JdbcWorkerRepository implements WorkerRepository {
    private static final Logger log = LoggerFactory.getLogger(JdbcWorkerRepository.class);

    private final DataSource ds;

    public JdbcWorkerRepository(DataSource ds) {
        this.ds = ds;
    }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public Worker insert(NewWorker w, Instant now) throws Exception {
        long id;
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_GPU_WORKER
                   (NAME, PROVIDER, STATUS, ACCOUNT_ID, CAPABILITIES,
                    SESSION_DURATION_SECONDS, WEEKLY_USAGE_SECONDS, CREATED_AT, UPDATED_AT)
            VALUES (?, ?, 'OFFLINE', ?, ?, 0, 0, ?, ?)
        """, new String[]{"ID"})) {
            ps.setString(1, w.name());
            ps.setString(2, w.provider().code());
            setString(ps, 3, w.accountId());
            setString(ps, 4, w.capabilities());
            setInstant(ps, 5, now);
            setInstant(ps, 6, now);
            ps.executeUpdate();
            try (var keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new IllegalStateException("no generated key for worker " + w.name());
                id = keys.getLong(1);
            }
        }
        return findById(id).orElseThrow();
    }

    @Override
    public Optional<Worker> findById(long id) throws Exception {
        return one("SELECT * FROM TB_GPU_WORKER WHERE ID = ?", id);
    }

    @Override
    public Optional<Worker> findByName(String name) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_GPU_WORKER WHERE NAME = ?")) {
            ps.setString(1, name);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toWorker(rs)) : Optional.empty();
            }
        }
    }

    /** 행 락. 같은 워커에 대한 1/3단계, 정산, 강등이 여기서 직렬화된다. */
    @Override
    public Optional<Worker> lockById(long id) throws Exception {
        return one("SELECT * FROM TB_GPU_WORKER WHERE ID = ? FOR UPDATE", id);
    }

    @Override
    public List<Worker> findAll() throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_GPU_WORKER ORDER BY ID")) {
            return list(ps);
        }
    }

    @Override
    public List<Worker> findByProvider(Provider provider) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_GPU_WORKER WHERE PROVIDER = ? ORDER BY ID")) {
            ps.setString(1, provider.code());
            return list(ps);
        }
    }

    @Override
    public List<Worker> findByStatuses(WorkerStatus... statuses) throws Exception {
        if (statuses.length == 0) return List.of();
        try (var ps = mustConn().prepareStatement(
                "SELECT * FROM TB_GPU_WORKER WHERE STATUS IN (" + placeholders(statuses.length) + ") ORDER BY ID")) {
            for (int i = 0; i < statuses.length; i++) ps.setString(i + 1, statuses[i].code());
            return list(ps);
        }
    }

    /** 락 행이 없으면 만들고 다시 잠근다 (동시 생성은 PK 위반으로 한쪽만 성공) */
    @Override
    public void lockProvider(Provider provider) throws Exception {
        if (selectProviderForUpdate(provider)) return;
        try (var ins = mustConn().prepareStatement(
                "INSERT INTO TB_PROVIDER_LOCK (PROVIDER, UPDATED_AT) VALUES (?, CURRENT_TIMESTAMP)")) {
            ins.setString(1, provider.code());
            ins.executeUpdate();
        } catch (SQLIntegrityConstraintViolationException dup) {
            log.debug("Provider lock row for {} created concurrently", provider, dup);
        }
        if (!selectProviderForUpdate(provider)) {
            throw new IllegalStateException("provider lock row missing for " + provider);
        }
    }

    private boolean selectProviderForUpdate(Provider provider) throws SQLException {
        try (var ps = mustConn().prepareStatement(
                "SELECT PROVIDER FROM TB_PROVIDER_LOCK WHERE PROVIDER = ? FOR UPDATE")) {
            ps.setString(1, provider.code());
            try (var rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public void updateProfile(long id, Provider provider, String accountId, String capabilities, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_GPU_WORKER
               SET PROVIDER     = ?,
                   ACCOUNT_ID   = ?,
                   CAPABILITIES = ?,
                   UPDATED_AT   = ?
             WHERE ID = ?
        """)) {
            ps.setString(1, provider.code());
            setString(ps, 2, accountId);
            setString(ps, 3, capabilities);
            setInstant(ps, 4, now);
            ps.setLong(5, id);
            ps.executeUpdate();
        }
    }

    @Override
    public void markReserved(long id, String token, Instant expiresAt, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_GPU_WORKER
               SET STATUS                 = 'STARTING',
                   SESSION_TOKEN          = ?,
                   RESERVATION_EXPIRES_AT = ?,
                   LAST_ERROR             = NULL,
                   UPDATED_AT             = ?
             WHERE ID = ?
        """)) {
            ps.setString(1, token);
            setInstant(ps, 2, expiresAt);
            setInstant(ps, 3, now);
            ps.setLong(4, id);
            requireOne(ps.executeUpdate(), id);
        }
    }

    /** 하트비트 기준 시각은 새 세션 시작으로 초기화 */
    @Override
    public void markPending(long id, String endpointUrl, String externalId, Instant sessionStartedAt, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_GPU_WORKER
               SET STATUS                   = 'PENDING',
                   SESSION_TOKEN            = NULL,
                   RESERVATION_EXPIRES_AT   = NULL,
                   ENDPOINT_URL             = ?,
                   EXTERNAL_ID              = ?,
                   SESSION_STARTED_AT       = ?,
                   SESSION_DURATION_SECONDS = 0,
                   LAST_HEARTBEAT_AT        = NULL,
                   UPDATED_AT               = ?
             WHERE ID = ?
        """)) {
            setString(ps, 1, endpointUrl);
            setString(ps, 2, externalId);
            setInstant(ps, 3, sessionStartedAt);
            setInstant(ps, 4, now);
            ps.setLong(5, id);
            requireOne(ps.executeUpdate(), id);
        }
    }

    /** 반납 (토큰 일치 시에만) */
    @Override
    public boolean release(long id, String token, String reason, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_GPU_WORKER
               SET STATUS                 = 'OFFLINE',
                   SESSION_TOKEN          = NULL,
                   RESERVATION_EXPIRES_AT = NULL,
                   LAST_ERROR             = ?,
                   UPDATED_AT             = ?
             WHERE ID = ?
               AND SESSION_TOKEN = ?
        """)) {
            setString(ps, 1, truncate(reason));
            setInstant(ps, 2, now);
            ps.setLong(3, id);
            ps.setString(4, token);
            return ps.executeUpdate() > 0;
        }
    }

    /** 만료 예약 일괄 회수 */
    @Override
    public int reclaimExpiredReservations(Instant now, String reason) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_GPU_WORKER
               SET STATUS                 = 'OFFLINE',
                   SESSION_TOKEN          = NULL,
                   RESERVATION_EXPIRES_AT = NULL,
                   LAST_ERROR             = ?,
                   UPDATED_AT             = ?
             WHERE STATUS = 'STARTING'
               AND RESERVATION_EXPIRES_AT <= ?
        """)) {
            setString(ps, 1, truncate(reason));
            setInstant(ps, 2, now);
            setInstant(ps, 3, now);
            return ps.executeUpdate();
        }
    }

    @Override
    public void recordHeartbeat(long id, WorkerStatus status, String endpointUrl, long sessionDurationSeconds,
                                Instant heartbeatAt) throws Exception {
        requireNotStarting(status);
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_GPU_WORKER
               SET STATUS                   = ?,
                   ENDPOINT_URL             = ?,
                   SESSION_DURATION_SECONDS = ?,
                   LAST_HEARTBEAT_AT        = ?,
                   UPDATED_AT               = ?
             WHERE ID = ?
        """)) {
            ps.setString(1, status.code());
            setString(ps, 2, endpointUrl);
            ps.setLong(3, sessionDurationSeconds);
            setInstant(ps, 4, heartbeatAt);
            setInstant(ps, 5, heartbeatAt);
            ps.setLong(6, id);
            requireOne(ps.executeUpdate(), id);
        }
    }

    @Override
    public void updateStatus(long id, WorkerStatus status, String lastError, Instant now) throws Exception {
        requireNotStarting(status);
        String sql = status == WorkerStatus.OFFLINE
                ? """
                  UPDATE TB_GPU_WORKER
                     SET STATUS                 = 'OFFLINE',
                         SESSION_TOKEN          = NULL,
                         RESERVATION_EXPIRES_AT = NULL,
                         SESSION_STARTED_AT     = NULL,
                         LAST_ERROR             = ?,
                         UPDATED_AT             = ?
                   WHERE ID = ?
                  """
                : """
                  UPDATE TB_GPU_WORKER
                     SET STATUS     = '%s',
                         LAST_ERROR = ?,
                         UPDATED_AT = ?
                   WHERE ID = ?
                  """.formatted(status.code());
        try (var ps = mustConn().prepareStatement(sql)) {
            setString(ps, 1, truncate(lastError));
            setInstant(ps, 2, now);
            ps.setLong(3, id);
            requireOne(ps.executeUpdate(), id);
        }
    }

    @Override
    public void recordSessionEnd(long id, long sessionDurationSeconds, long weeklyUsageSeconds, Instant weekStartedAt,
                                 Instant cooldownUntil, String lastError, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_GPU_WORKER
               SET STATUS                   = 'OFFLINE',
                   SESSION_TOKEN            = NULL,
                   RESERVATION_EXPIRES_AT   = NULL,
                   SESSION_STARTED_AT       = NULL,
                   SESSION_DURATION_SECONDS = ?,
                   WEEKLY_USAGE_SECONDS     = ?,
                   WEEK_STARTED_AT          = ?,
                   COOLDOWN_UNTIL           = ?,
                   LAST_ERROR               = ?,
                   UPDATED_AT               = ?
             WHERE ID = ?
        """)) {
            ps.setLong(1, sessionDurationSeconds);
            ps.setLong(2, weeklyUsageSeconds);
            setInstant(ps, 3, weekStartedAt);
            setInstant(ps, 4, cooldownUntil);
            setString(ps, 5, truncate(lastError));
            setInstant(ps, 6, now);
            ps.setLong(7, id);
            requireOne(ps.executeUpdate(), id);
        }
    }

    @Override
    public int rollWeeklyWindow(Instant windowStart, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_GPU_WORKER
               SET WEEKLY_USAGE_SECONDS = 0,
                   WEEK_STARTED_AT      = ?,
                   UPDATED_AT           = ?
             WHERE WEEK_STARTED_AT IS NOT NULL
               AND WEEK_STARTED_AT < ?
        """)) {
            setInstant(ps, 1, windowStart);
            setInstant(ps, 2, now);
            setInstant(ps, 3, windowStart);
            return ps.executeUpdate();
        }
    }

    // === utils ===

    private Optional<Worker> one(String sql, long id) throws SQLException {
        try (var ps = mustConn().prepareStatement(sql)) {
            ps.setLong(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toWorker(rs)) : Optional.empty();
            }
        }
    }

    private static List<Worker> list(PreparedStatement ps) throws SQLException {
        List<Worker> out = new ArrayList<>();
        try (var rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toWorker(rs));
        }
        return out;
    }

    private static void requireOne(int updated, long id) {
        if (updated != 1) throw new IllegalStateException("worker " + id + " not found (updated " + updated + " rows)");
    }

    /** starting 은 예약 경로(markReserved)로만 들어간다 */
    private static void requireNotStarting(WorkerStatus status) {
        if (status == WorkerStatus.STARTING) {
            throw new IllegalArgumentException("STARTING is only set through markReserved");
        }
    }

    private static String truncate(String s) {
        return s == null || s.length() <= 1000 ? s : s.substring(0, 1000);
    }
}
