package net.custodian.core.ratelimit;

/** 요청 1건에 대한 rate limiter 판정. HTTP 상태코드는 웹 계층에서 그대로 사용한다. */
public enum RateLimitDecision {
    ALLOWED(200),
    /** 분당 한도 초과 */
    EXCEEDED(429),
    /** 락을 얻지 못함. 한도 우회를 막기 위해 거부로 처리 (fail-closed) */
    UNAVAILABLE(503);

    private final int httpStatus;

    RateLimitDecision(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public boolean allowed() {
        return this == ALLOWED;
    }

    public String message(int limit) {
        return switch (this) {
            case ALLOWED -> "OK";
            case EXCEEDED -> "Rate limit exceeded. Maximum " + limit + " requests per minute allowed.";
            case UNAVAILABLE -> "Rate limiter temporarily unavailable. Please try again.";
        };
    }
}
