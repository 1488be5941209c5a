package net.custodian.bootstrap.schedule;

import net.custodian.bootstrap.props.CustodianProperties;
import net.custodian.core.model.Frequency;
import net.custodian.core.model.TaskDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 내장 태스크 + {@code custodian.tasks.<id>} 로 추가된 태스크.
 * 추가 태스크의 설정 키는 내장 태스크와 같은 규칙(enable_scheduled_&lt;id&gt;, &lt;id&gt;_frequency)을 따른다.
 */
public final class TaskCatalog {
    private TaskCatalog() {}

    public static List<TaskDefinition> from(CustodianProperties props) {
        List<TaskDefinition> out = new ArrayList<>(TaskDefinition.builtIn());
        Set<String> known = out.stream().map(TaskDefinition::taskId).collect(Collectors.toSet());

        props.getTasks().forEach((taskId, t) -> {
            if (known.contains(taskId)) return;
            Frequency f = Frequency.from(t.getFrequency());
            out.add(new TaskDefinition(taskId,
                    "enable_scheduled_" + taskId,
                    taskId + "_frequency",
                    f != null ? f : Frequency.DAILY));
        });
        return out;
    }
}
