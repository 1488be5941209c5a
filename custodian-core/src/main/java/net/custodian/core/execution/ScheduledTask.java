package net.custodian.core.execution;

import net.custodian.core.model.TaskResult;

/** 호스트 스케줄러가 taskId 로 실행하는 작업 1건. 한 번의 호출은 하나의 실행 슬라이스. */
public interface ScheduledTask {

    String taskId();

    /**
     * 슬라이스 하나를 동기적으로 실행한다. 시간이 부족하면 체크포인트를 남기고
     * {@code interrupted=true} 결과를 반환해야 한다.
     */
    TaskResult execute(ExecutionContext context) throws Exception;
}
