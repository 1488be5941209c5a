package net.custodian.core.spi;

/**
 * 호스트 설정 조회 (읽기 전용).
 * 키는 {@link net.custodian.core.model.TaskDefinition} 이 지정한 이름과 아래 전역 키.
 */
public interface SettingsProvider {
    String SCHEDULER_ENABLED = "scheduler_enabled";
    String PREFERRED_TIME = "preferred_time";
    String RATE_LIMIT = "rest_api_rate_limit";

    Object getSetting(String key, Object defaultValue);

    default boolean getBoolean(String key, boolean defaultValue) {
        Object v = getSetting(key, defaultValue);
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) return n.intValue() != 0;
        if (v instanceof String s) {
            String t = s.trim().toLowerCase();
            if (t.isEmpty()) return defaultValue;
            return t.equals("true") || t.equals("1") || t.equals("yes") || t.equals("on");
        }
        return defaultValue;
    }

    default int getInt(String key, int defaultValue) {
        Object v = getSetting(key, defaultValue);
        if (v instanceof Number n) return n.intValue();
        if (v instanceof String s) {
            try { return Integer.parseInt(s.trim()); } catch (NumberFormatException e) { return defaultValue; }
        }
        return defaultValue;
    }

    default String getString(String key, String defaultValue) {
        Object v = getSetting(key, defaultValue);
        return v == null ? defaultValue : v.toString();
    }
}
