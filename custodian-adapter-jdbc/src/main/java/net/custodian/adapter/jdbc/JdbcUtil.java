package net.custodian.adapter.jdbc;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcUtil {
    private JdbcUtil() {}

    /** ORA-00001 (unique constraint violated) */
    private static final int ORA_UNIQUE_VIOLATION = 1;

    public static Instant toInstant(Timestamp ts) { return ts == null ? null : ts.toInstant(); }

    /** SQLState 23xxx 또는 Oracle 오류코드 1 */
    public static boolean isUniqueViolation(SQLException e) {
        for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
            if (cur.getErrorCode() == ORA_UNIQUE_VIOLATION) return true;
            String state = cur.getSQLState();
            if (state != null && state.startsWith("23")) return true;
        }
        return false;
    }
}
