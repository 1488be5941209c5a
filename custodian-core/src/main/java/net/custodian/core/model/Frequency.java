package net.custodian.core.model;

import java.time.Duration;

public enum Frequency {
    DAILY(Duration.ofDays(1)),
    WEEKLY(Duration.ofDays(7)),
    MONTHLY(Duration.ofDays(30)),
    /** "do not schedule" sentinel, distinct from the task's enable flag being off */
    DISABLED(null);

    private final Duration interval;

    Frequency(Duration interval) {
        this.interval = interval;
    }

    public Duration interval() {
        return interval;
    }

    public boolean schedulable() {
        return interval != null;
    }

    /** 알 수 없는 값은 null (설정 오류는 예외로 던지지 않는다) */
    public static Frequency from(String s) {
        if (s == null) return null;
        String v = s.trim().toUpperCase();
        // 호스트 스케줄러의 하위 주기는 daily로 정규화
        if (v.equals("HOURLY") || v.equals("TWICEDAILY")) return DAILY;
        try { return Frequency.valueOf(v); } catch (IllegalArgumentException e) { return null; }
    }

    public String code() { return name().toLowerCase(); }
}
