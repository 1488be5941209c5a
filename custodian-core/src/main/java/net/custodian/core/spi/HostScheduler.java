package net.custodian.core.spi;

import net.custodian.core.model.Frequency;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/** 호스트의 스케줄링 프리미티브. 코어는 "언제 실행할지"만 결정하고 실제 발화는 여기에 위임한다. */
public interface HostScheduler {

    /** 기존 스케줄을 대체하여 {@code firstRun}부터 {@code frequency} 주기로 반복 등록 */
    boolean schedule(String taskId, Instant firstRun, Frequency frequency) throws Exception;

    /** 중단된 작업 재개용 1회성 실행 */
    boolean scheduleOnce(String taskId, Instant at) throws Exception;

    boolean unschedule(String taskId) throws Exception;

    boolean isScheduled(String taskId) throws Exception;

    Optional<Instant> nextRun(String taskId) throws Exception;

    Optional<Frequency> scheduledFrequency(String taskId) throws Exception;

    /** taskId → 다음 실행 시각 (반복 스케줄만, scheduleOnce 로 등록한 항목은 제외) */
    Map<String, Instant> listScheduled() throws Exception;

    /** 고용량 백엔드(큐 기반 등) 사용 가능 여부. 정보 제공용. */
    default boolean isHighCapacity() { return false; }
}
