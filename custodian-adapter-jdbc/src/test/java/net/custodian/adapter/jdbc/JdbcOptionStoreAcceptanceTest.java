package net.custodian.adapter.jdbc;

import net.custodian.adapter.jdbc.repo.JdbcOptionStore;
import net.custodian.core.spi.OptionStore;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcOptionStoreAcceptanceTest extends TestSupport {

    JdbcTxRunner tx;
    JdbcOptionStore options;

    @BeforeAll
    void initAll() {
        tx = new JdbcTxRunner(ds);
        options = new JdbcOptionStore(ds);
    }

    @BeforeEach
    void clean() throws Exception {
        truncateOptions(tx);
    }

    @Test
    @DisplayName("Flyway 마이그레이션: TB_OPTION 생성")
    void migrationCreatesOptionTable() throws Exception {
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM USER_TABLES WHERE TABLE_NAME='TB_OPTION'")) {
            try (ResultSet rs = ps.executeQuery()) {
                assertTrue(rs.next());
                assertEquals(1, rs.getInt(1));
            }
        }
    }

    @Test
    @DisplayName("put → get, 덮어쓰기, 빈 문자열 유지")
    void putGetOverwrite() throws Exception {
        tx.required(() -> { options.put("a", "1"); return null; });
        assertEquals(Optional.of("1"), tx.required(() -> options.get("a")));

        tx.required(() -> { options.put("a", "2"); return null; });
        assertEquals(Optional.of("2"), tx.required(() -> options.get("a")));

        tx.required(() -> { options.put("empty", ""); return null; });
        assertEquals(Optional.of(""), tx.required(() -> options.get("empty")));

        assertTrue(tx.required(() -> options.delete("a")));
        assertFalse(tx.required(() -> options.delete("a")));
        assertEquals(Optional.empty(), tx.required(() -> options.get("a")));
    }

    @Test
    @DisplayName("insertPairIfAbsent: 두 행 모두 없을 때만 2, 하나라도 있으면 0")
    void insertPairIsAllOrNothing() throws Exception {
        assertEquals(2, tx.required(() -> options.insertPairIfAbsent("_t_timeout_k", "100", "_t_k", "1")));
        assertEquals(0, tx.required(() -> options.insertPairIfAbsent("_t_timeout_k", "200", "_t_k", "1")));

        // 두 번째 이름만 존재해도 첫 번째 행은 들어가지 않는다
        tx.required(() -> { options.put("only_second", "x"); return null; });
        assertEquals(0, tx.required(() -> options.insertPairIfAbsent("fresh", "1", "only_second", "y")));
        assertEquals(Optional.empty(), tx.required(() -> options.get("fresh")));
        assertEquals(Optional.of("100"), tx.required(() -> options.get("_t_timeout_k")));
    }

    @Test
    @DisplayName("deleteIfValue: 값이 일치할 때만 삭제")
    void deleteIfValueComparesValue() throws Exception {
        tx.required(() -> { options.put("_t_timeout_k", "100"); return null; });

        assertFalse(tx.required(() -> options.deleteIfValue("_t_timeout_k", "99")));
        assertEquals(Optional.of("100"), tx.required(() -> options.get("_t_timeout_k")));

        assertTrue(tx.required(() -> options.deleteIfValue("_t_timeout_k", "100")));
        assertFalse(tx.required(() -> options.deleteIfValue("_t_timeout_k", "100")));
    }

    @Test
    @DisplayName("LIKE 패턴: 이스케이프된 _ 와 % 는 와일드카드가 아니다")
    void escapedPatternIsLiteral() throws Exception {
        tx.required(() -> {
            options.put("cache_a_1", "v");
            options.put("cache_a_2", "v");
            options.put("cacheXa_3", "v");
            options.put("cache%a", "v");
            return null;
        });

        assertEquals(2, tx.required(() -> options.countByPrefix("cache_a_")));
        Map<String, String> found = tx.required(() -> options.findByPrefix("cache_a_"));
        assertEquals(2, found.size());
        assertTrue(found.containsKey("cache_a_1"));

        int removed = tx.required(() -> options.deleteByPattern(OptionStore.escapeLike("cache_a") + "%"));
        assertEquals(2, removed);
        assertEquals(Optional.of("v"), tx.required(() -> options.get("cacheXa_3")));
        assertEquals(Optional.of("v"), tx.required(() -> options.get("cache%a")));
    }

    @Test
    @DisplayName("트랜잭션 롤백 시 기록 취소")
    void rollbackDiscardsWrites() throws Exception {
        assertThrows(IllegalStateException.class, () -> tx.required(() -> {
            options.put("rolled_back", "1");
            throw new IllegalStateException("boom");
        }));
        assertEquals(Optional.empty(), tx.required(() -> options.get("rolled_back")));
    }

    @Test
    @DisplayName("트랜잭션 밖 호출은 IllegalStateException")
    void requiresTransaction() {
        assertThrows(IllegalStateException.class, () -> options.get("x"));
    }
}
