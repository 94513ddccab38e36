package net.gpuwarden.adapter.jdbc.mapper;

import net.gpuwarden.core.model.Provider;
import net.gpuwarden.core.model.Session;
import net.gpuwarden.core.model.ShutdownReason;
import net.gpuwarden.core.model.Worker;
import net.gpuwarden.core.model.WorkerStatus;

import java.sql.ResultSet;
import java.sql.SQLException;

import static net.gpuwarden.adapter.jdbc.JdbcUtil.instant;

public final class RowMappers {
    private RowMappers() {}

    // --- TB_GPU_WORKER ---
    public static Worker toWorker(ResultSet rs) throws SQLException {
        return new Worker(
                rs.getLong("ID"),
                rs.getString("NAME"),
                Provider.from(rs.getString("PROVIDER")),
                WorkerStatus.from(rs.getString("STATUS")),
                rs.getString("ACCOUNT_ID"),
                rs.getString("ENDPOINT_URL"),
                rs.getString("EXTERNAL_ID"),
                rs.getString("CAPABILITIES"),
                rs.getString("SESSION_TOKEN"),
                instant(rs, "RESERVATION_EXPIRES_AT"),
                instant(rs, "SESSION_STARTED_AT"),
                rs.getLong("SESSION_DURATION_SECONDS"),
                instant(rs, "COOLDOWN_UNTIL"),
                rs.getLong("WEEKLY_USAGE_SECONDS"),
                instant(rs, "WEEK_STARTED_AT"),
                instant(rs, "LAST_HEARTBEAT_AT"),
                rs.getString("LAST_ERROR"),
                instant(rs, "CREATED_AT"),
                instant(rs, "UPDATED_AT")
        );
    }

    // --- TB_GPU_SESSION ---
    public static Session toSession(ResultSet rs) throws SQLException {
        return new Session(
                rs.getLong("ID"),
                rs.getLong("WORKER_ID"),
                Provider.from(rs.getString("PROVIDER")),
                instant(rs, "SESSION_STARTED_AT"),
                rs.getLong("SESSION_DURATION_MS"),
                rs.getLong("MAX_SESSION_DURATION_MS"),
                instant(rs, "AUTO_SHUTDOWN_AT"),
                "Y".equals(rs.getString("IS_ACTIVE")),
                ShutdownReason.from(rs.getString("SHUTDOWN_REASON")),
                instant(rs, "ENDED_AT"),
                instant(rs, "CREATED_AT"),
                instant(rs, "UPDATED_AT")
        );
    }
}
