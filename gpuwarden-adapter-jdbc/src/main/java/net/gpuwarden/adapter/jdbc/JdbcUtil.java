package net.gpuwarden.adapter.jdbc;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Collections;

public final class JdbcUtil {
    private JdbcUtil() {}

    public static Timestamp ts(Instant i) { return i == null ? null : Timestamp.from(i); }

    public static Instant toInstant(Timestamp ts) { return ts == null ? null : ts.toInstant(); }

    public static Instant instant(ResultSet rs, String column) throws SQLException {
        return toInstant(rs.getTimestamp(column));
    }

    public static void setInstant(PreparedStatement ps, int idx, Instant i) throws SQLException {
        if (i == null) ps.setNull(idx, Types.TIMESTAMP);
        else ps.setTimestamp(idx, Timestamp.from(i));
    }

    public static void setString(PreparedStatement ps, int idx, String s) throws SQLException {
        if (s == null) ps.setNull(idx, Types.VARCHAR);
        else ps.setString(idx, s);
    }

    /** IN (?, ?, ...) 자리표시자 */
    public static String placeholders(int n) {
        if (n <= 0) throw new IllegalArgumentException("at least one placeholder required");
        return String.join(", ", Collections.nCopies(n, "?"));
    }
}
