package net.custodian.core.spi;

import java.util.Map;
import java.util.Optional;

/**
 * 영속 key/value 옵션 저장소. transient 캐시, 진행 상태 저장소, 락 기반 rate limiter 가 공유한다.
 * - 옵션 이름은 유일
 * - DB 구현체는 {@link TxRunner#required} 안에서 호출되어야 함
 */
public interface OptionStore {

    Optional<String> get(String name) throws Exception;

    /** insert or overwrite */
    void put(String name, String value) throws Exception;

    /** @return true if a row was removed */
    boolean delete(String name) throws Exception;

    /** compare-and-delete: removes the row only while it still holds {@code expectedValue} */
    boolean deleteIfValue(String name, String expectedValue) throws Exception;

    /**
     * Inserts both rows or neither. A unique-name conflict on either row is not an error:
     * the call reports how many rows it inserted, so {@code 2} means the caller won the race.
     */
    int insertPairIfAbsent(String firstName, String firstValue,
                           String secondName, String secondValue) throws Exception;

    /** {@code likePattern} must already be escaped with {@link #escapeLike(String)} */
    int deleteByPattern(String likePattern) throws Exception;

    /** name → value for every option whose name starts with {@code prefix} */
    Map<String, String> findByPrefix(String prefix) throws Exception;

    int countByPrefix(String prefix) throws Exception;

    /** LIKE 와일드카드(%, _) 및 이스케이프 문자(\) 이스케이프 */
    static String escapeLike(String raw) {
        StringBuilder sb = new StringBuilder(raw.length() + 8);
        for (char ch : raw.toCharArray()) {
            if (ch == '\\' || ch == '%' || ch == '_') sb.append('\\');
            sb.append(ch);
        }
        return sb.toString();
    }
}
