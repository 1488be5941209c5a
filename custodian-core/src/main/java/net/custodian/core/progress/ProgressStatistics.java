package net.custodian.core.progress;

import java.time.Instant;

/**
 * 전체 체크포인트 요약.
 *
 * @param stale  24시간 이상 갱신되지 않았거나 saved_at 이 없는 체크포인트 수
 * @param oldest null 이면 유효한 saved_at 이 하나도 없음
 */
public record ProgressStatistics(
        int total,
        int stale,
        int interrupted,
        Instant oldest,
        Instant newest
) {
    public static final ProgressStatistics EMPTY = new ProgressStatistics(0, 0, 0, null, null);
}
