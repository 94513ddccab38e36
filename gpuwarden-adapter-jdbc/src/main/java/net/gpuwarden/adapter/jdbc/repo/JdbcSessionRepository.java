package net.gpuwarden.adapter.jdbc.repo;

import net.gpuwarden.adapter.jdbc.TxContext;
import net.gpuwarden.adapter.jdbc.mapper.RowMappers;
import net.gpuwarden.core.model.NewSession;
import net.gpuwarden.core.model.Provider;
import net.gpuwarden.core.model.Session;
import net.gpuwarden.core.model.ShutdownReason;
import net.gpuwarden.core.spi.SessionRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.gpuwarden.adapter.jdbc.JdbcUtil.setInstant;

public final class JdbcSessionRepository implements SessionRepository {
    private final DataSource ds;

    public JdbcSessionRepository(DataSource ds) {
        this.ds = ds;
    }

    private Connection mustConn() {
        return TxContext.require();
    }

    /** ACTIVE_WORKER_ID UNIQUE 로 워커당 활성 세션 1개 */
    @Override
    public Session insert(NewSession s, Instant now) throws Exception {
        long id;
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_GPU_SESSION
                   (WORKER_ID, PROVIDER, SESSION_STARTED_AT, SESSION_DURATION_MS, MAX_SESSION_DURATION_MS,
                    AUTO_SHUTDOWN_AT, IS_ACTIVE, ACTIVE_WORKER_ID, CREATED_AT, UPDATED_AT)
            VALUES (?, ?, ?, 0, ?, ?, 'Y', ?, ?, ?)
        """, new String[]{"ID"})) {
            ps.setLong(1, s.workerId());
            ps.setString(2, s.provider().code());
            setInstant(ps, 3, s.sessionStartedAt());
            ps.setLong(4, s.maxSessionDurationMs());
            setInstant(ps, 5, s.autoShutdownAt());
            ps.setLong(6, s.workerId());
            setInstant(ps, 7, now);
            setInstant(ps, 8, now);
            ps.executeUpdate();
            try (var keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new IllegalStateException("no generated key for session of worker " + s.workerId());
                id = keys.getLong(1);
            }
        }
        return findById(id).orElseThrow();
    }

    @Override
    public Optional<Session> findById(long id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_GPU_SESSION WHERE ID = ?")) {
            ps.setLong(1, id);
            return first(ps);
        }
    }

    @Override
    public Optional<Session> findActiveByWorker(long workerId) throws Exception {
        try (var ps = mustConn().prepareStatement(
                "SELECT * FROM TB_GPU_SESSION WHERE WORKER_ID = ? AND IS_ACTIVE = 'Y'")) {
            ps.setLong(1, workerId);
            return first(ps);
        }
    }

    @Override
    public List<Session> findActive() throws Exception {
        try (var ps = mustConn().prepareStatement(
                "SELECT * FROM TB_GPU_SESSION WHERE IS_ACTIVE = 'Y' ORDER BY AUTO_SHUTDOWN_AT, ID")) {
            return list(ps);
        }
    }

    @Override
    public List<Session> findActiveByProvider(Provider provider) throws Exception {
        try (var ps = mustConn().prepareStatement(
                "SELECT * FROM TB_GPU_SESSION WHERE IS_ACTIVE = 'Y' AND PROVIDER = ? ORDER BY ID")) {
            ps.setString(1, provider.code());
            return list(ps);
        }
    }

    @Override
    public List<Session> findActiveOverdue(Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT *
              FROM TB_GPU_SESSION
             WHERE IS_ACTIVE = 'Y'
               AND AUTO_SHUTDOWN_AT < ?
             ORDER BY AUTO_SHUTDOWN_AT, ID
        """)) {
            setInstant(ps, 1, now);
            return list(ps);
        }
    }

    @Override
    public List<Session> findByWorker(long workerId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_GPU_SESSION WHERE WORKER_ID = ? ORDER BY ID")) {
            ps.setLong(1, workerId);
            return list(ps);
        }
    }

    @Override
    public boolean updateDuration(long id, long durationMs, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_GPU_SESSION
               SET SESSION_DURATION_MS = GREATEST(SESSION_DURATION_MS, ?),
                   UPDATED_AT          = ?
             WHERE ID = ?
               AND IS_ACTIVE = 'Y'
        """)) {
            ps.setLong(1, durationMs);
            setInstant(ps, 2, now);
            ps.setLong(3, id);
            return ps.executeUpdate() > 0;
        }
    }

    /** 활성일 때만 닫힌다 → 두 번 호출해도 결과 동일 */
    @Override
    public boolean close(long id, ShutdownReason reason, long durationMs, Instant endedAt) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_GPU_SESSION
               SET IS_ACTIVE           = 'N',
                   ACTIVE_WORKER_ID    = NULL,
                   SHUTDOWN_REASON     = ?,
                   SESSION_DURATION_MS = GREATEST(SESSION_DURATION_MS, ?),
                   ENDED_AT            = ?,
                   UPDATED_AT          = ?
             WHERE ID = ?
               AND IS_ACTIVE = 'Y'
        """)) {
            ps.setString(1, reason.code());
            ps.setLong(2, durationMs);
            setInstant(ps, 3, endedAt);
            setInstant(ps, 4, endedAt);
            ps.setLong(5, id);
            return ps.executeUpdate() > 0;
        }
    }

    private static Optional<Session> first(PreparedStatement ps) throws SQLException {
        try (var rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(RowMappers.toSession(rs)) : Optional.empty();
        }
    }

    private static List<Session> list(PreparedStatement ps) throws SQLException {
        List<Session> out = new ArrayList<>();
        try (var rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toSession(rs));
        }
        return out;
    }
}
