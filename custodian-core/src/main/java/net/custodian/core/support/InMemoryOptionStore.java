package net.custodian.core.support;

import net.custodian.core.spi.OptionStore;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.regex.Pattern;

/** 프로세스 메모리 OptionStore (테스트, DB 없는 호스트용). 재시작하면 사라진다. */
public final class InMemoryOptionStore implements OptionStore {
    private final ConcurrentSkipListMap<String, String> options = new ConcurrentSkipListMap<>();

    @Override
    public Optional<String> get(String name) {
        return Optional.ofNullable(options.get(name));
    }

    @Override
    public void put(String name, String value) {
        options.put(name, value);
    }

    @Override
    public boolean delete(String name) {
        return options.remove(name) != null;
    }

    @Override
    public boolean deleteIfValue(String name, String expectedValue) {
        return options.remove(name, expectedValue);
    }

    @Override
    public synchronized int insertPairIfAbsent(String firstName, String firstValue,
                                               String secondName, String secondValue) {
        // 둘 중 하나라도 존재하면 아무것도 넣지 않는다 (INSERT ALL 과 동일)
        if (options.containsKey(firstName) || options.containsKey(secondName)) return 0;
        options.put(firstName, firstValue);
        options.put(secondName, secondValue);
        return 2;
    }

    @Override
    public int deleteByPattern(String likePattern) {
        Pattern regex = likeToRegex(likePattern);
        int removed = 0;
        for (String name : options.keySet()) {
            if (regex.matcher(name).matches() && options.remove(name) != null) removed++;
        }
        return removed;
    }

    @Override
    public Map<String, String> findByPrefix(String prefix) {
        return new TreeMap<>(options.subMap(prefix, true, prefix + Character.MAX_VALUE, false));
    }

    @Override
    public int countByPrefix(String prefix) {
        return options.subMap(prefix, true, prefix + Character.MAX_VALUE, false).size();
    }

    public int size() {
        return options.size();
    }

    static Pattern likeToRegex(String like) {
        StringBuilder re = new StringBuilder();
        boolean escaped = false;
        for (char ch : like.toCharArray()) {
            if (escaped) {
                re.append(Pattern.quote(String.valueOf(ch)));
                escaped = false;
            } else if (ch == '\\') {
                escaped = true;
            } else if (ch == '%') {
                re.append(".*");
            } else if (ch == '_') {
                re.append('.');
            } else {
                re.append(Pattern.quote(String.valueOf(ch)));
            }
        }
        return Pattern.compile(re.toString(), Pattern.DOTALL);
    }
}
