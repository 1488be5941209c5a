package net.custodian.core.service;

import java.time.Duration;

/** 재시도 간 대기 시간. attempt 는 1부터 시작. */
@FunctionalInterface
public interface RetryPolicy {
    Duration nextBackoff(long attempt);

    /** 고정 백오프 정책 */
    static RetryPolicy fixed(Duration backoff) {
        if (backoff == null || backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must be >= 0");
        }
        return attempt -> backoff;
    }
}
