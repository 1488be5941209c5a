package net.custodian.bootstrap.settings;

import net.custodian.bootstrap.props.CustodianProperties;
import net.custodian.core.model.TaskDefinition;
import net.custodian.core.spi.SettingsProvider;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * {@link CustodianProperties} 를 코어의 설정 키로 노출한다.
 * 태스크별 키는 {@link TaskDefinition} 이 가리키는 이름을 그대로 쓴다.
 * {@code custodian.settings.*} 는 마지막에 조회하는 자유 형식 키.
 */
public final class PropertiesSettingsProvider implements SettingsProvider {
    private final CustodianProperties props;
    private final Map<String, Function<CustodianProperties, Object>> mapped = new HashMap<>();

    public PropertiesSettingsProvider(CustodianProperties props, List<TaskDefinition> definitions) {
        this.props = props;
        mapped.put(SCHEDULER_ENABLED, p -> p.getScheduler().isEnabled());
        mapped.put(PREFERRED_TIME, p -> p.getScheduler().getPreferredHour());
        mapped.put(RATE_LIMIT, p -> p.getRateLimit().getPerMinute());
        for (TaskDefinition def : definitions) {
            String taskId = def.taskId();
            mapped.put(def.enabledSettingKey(), p -> {
                var t = p.getTasks().get(taskId);
                return t == null ? null : t.isEnabled();
            });
            mapped.put(def.frequencySettingKey(), p -> {
                var t = p.getTasks().get(taskId);
                return t == null ? null : t.getFrequency();
            });
        }
    }

    @Override
    public Object getSetting(String key, Object defaultValue) {
        var f = mapped.get(key);
        if (f != null) {
            Object v = f.apply(props);
            if (v != null) return v;
        }
        String raw = props.getSettings().get(key);
        return raw != null ? raw : defaultValue;
    }
}
