package net.custodian.adapter.jdbc.repo;

import net.custodian.adapter.jdbc.JdbcUtil;
import net.custodian.adapter.jdbc.TxContext;
import net.custodian.adapter.jdbc.mapper.RowMappers;
import net.custodian.core.spi.OptionStore;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * TB_OPTION(Oracle) 기반 OptionStore.
 * OPTION_NAME 이 PK 라서 {@link #insertPairIfAbsent} 를 락으로 쓸 수 있다.
 */
public final class JdbcOptionStore implements OptionStore {
    private final DataSource ds;

    public JdbcOptionStore(DataSource ds) {
        this.ds = ds;
    }

    // === utils ===
    private Connection mustConn() {
        return TxContext.require();
    }

    // === interface impl ===

    public Optional<StoredOption> find(String name) throws Exception {
        Connection c = mustConn();
        try (var ps = c.prepareStatement("""
            SELECT OPTION_NAME, OPTION_VALUE, UPDATED_AT
            FROM   TB_OPTION
            WHERE  OPTION_NAME = ?
        """)) {
            ps.setString(1, name);
            try (var rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(RowMappers.toStoredOption(rs));
                return Optional.empty();
            }
        }
    }

    @Override
    public Optional<String> get(String name) throws Exception {
        return find(name).map(StoredOption::value);
    }

    /** MERGE 업서트. 동시 INSERT 로 유니크 충돌이 나면 한 번 더 시도한다 (두 번째는 UPDATE 경로) */
    @Override
    public void put(String name, String value) throws Exception {
        try {
            merge(name, value);
        } catch (SQLException e) {
            if (!JdbcUtil.isUniqueViolation(e)) throw e;
            merge(name, value);
        }
    }

    private void merge(String name, String value) throws SQLException {
        Connection c = mustConn();
        try (var ps = c.prepareStatement("""
            MERGE INTO TB_OPTION t
            USING (SELECT ? AS OPTION_NAME FROM DUAL) s
               ON (t.OPTION_NAME = s.OPTION_NAME)
            WHEN MATCHED THEN
                UPDATE SET t.OPTION_VALUE = ?,
                           t.UPDATED_AT   = CURRENT_TIMESTAMP
            WHEN NOT MATCHED THEN
                INSERT (OPTION_NAME, OPTION_VALUE, CREATED_AT, UPDATED_AT)
                VALUES (s.OPTION_NAME, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
        """)) {
            ps.setString(1, name);
            ps.setString(2, value);
            ps.setString(3, value);
            ps.executeUpdate();
        }
    }

    @Override
    public boolean delete(String name) throws Exception {
        Connection c = mustConn();
        try (var ps = c.prepareStatement("DELETE FROM TB_OPTION WHERE OPTION_NAME = ?")) {
            ps.setString(1, name);
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public boolean deleteIfValue(String name, String expectedValue) throws Exception {
        Connection c = mustConn();
        try (var ps = c.prepareStatement("""
            DELETE FROM TB_OPTION
            WHERE  OPTION_NAME  = ?
            AND    OPTION_VALUE = ?
        """)) {
            ps.setString(1, name);
            ps.setString(2, expectedValue);
            return ps.executeUpdate() > 0;
        }
    }

    /**
     * INSERT ALL 은 문장 단위로 원자적이다. 한 행이라도 유니크 충돌이면 두 행 모두 들어가지 않으므로 0 을 반환.
     */
    @Override
    public int insertPairIfAbsent(String firstName, String firstValue,
                                  String secondName, String secondValue) throws Exception {
        Connection c = mustConn();
        try (var ps = c.prepareStatement("""
            INSERT ALL
                INTO TB_OPTION (OPTION_NAME, OPTION_VALUE, CREATED_AT, UPDATED_AT)
                     VALUES (?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
                INTO TB_OPTION (OPTION_NAME, OPTION_VALUE, CREATED_AT, UPDATED_AT)
                     VALUES (?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
            SELECT 1 FROM DUAL
        """)) {
            ps.setString(1, firstName);
            ps.setString(2, firstValue);
            ps.setString(3, secondName);
            ps.setString(4, secondValue);
            return ps.executeUpdate();
        } catch (SQLException e) {
            if (JdbcUtil.isUniqueViolation(e)) return 0;
            throw e;
        }
    }

    @Override
    public int deleteByPattern(String likePattern) throws Exception {
        Connection c = mustConn();
        try (var ps = c.prepareStatement("DELETE FROM TB_OPTION WHERE OPTION_NAME LIKE ? ESCAPE '\\'")) {
            ps.setString(1, likePattern);
            return ps.executeUpdate();
        }
    }

    @Override
    public Map<String, String> findByPrefix(String prefix) throws Exception {
        Connection c = mustConn();
        Map<String, String> out = new LinkedHashMap<>();
        try (var ps = c.prepareStatement("""
            SELECT OPTION_NAME, OPTION_VALUE, UPDATED_AT
            FROM   TB_OPTION
            WHERE  OPTION_NAME LIKE ? ESCAPE '\\'
            ORDER BY OPTION_NAME
        """)) {
            ps.setString(1, OptionStore.escapeLike(prefix) + "%");
            try (var rs = ps.executeQuery()) {
                while (rs.next()) {
                    StoredOption o = RowMappers.toStoredOption(rs);
                    out.put(o.name(), o.value());
                }
            }
        }
        return out;
    }

    @Override
    public int countByPrefix(String prefix) throws Exception {
        Connection c = mustConn();
        try (var ps = c.prepareStatement("SELECT COUNT(*) FROM TB_OPTION WHERE OPTION_NAME LIKE ? ESCAPE '\\'")) {
            ps.setString(1, OptionStore.escapeLike(prefix) + "%");
            try (var rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }
}
