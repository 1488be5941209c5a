package net.custodian.core.service;

import net.custodian.core.model.Frequency;

import java.time.Instant;

/**
 * 태스크 하나의 실제 스케줄 상태와 설정값.
 *
 * @param frequency           호스트에 등록된 주기 (미등록이면 null)
 * @param frequencyInSettings 설정값; 알 수 없는 값이면 null
 */
public record TaskScheduleStatus(
        String taskId,
        boolean scheduled,
        Instant nextRun,
        Frequency frequency,
        boolean enabledInSettings,
        Frequency frequencyInSettings
) {}
