package net.custodian.core.cache;

/**
 * 캐시 조회 결과. {@code found} 이면 값({@code null}, {@code false} 일 수 있음)을 담고,
 * 저장소 오류로 읽지 못했으면 {@code failed}. failed 는 found 가 아니므로 일반 조회에서는 miss 로 취급된다.
 */
public record Lookup(boolean found, Object value, boolean failed) {
    private static final Lookup NOT_FOUND = new Lookup(false, null, false);
    private static final Lookup FAILED = new Lookup(false, null, true);

    public Lookup(boolean found, Object value) {
        this(found, value, false);
    }

    public static Lookup found(Object value) {
        return new Lookup(true, value, false);
    }

    public static Lookup notFound() {
        return NOT_FOUND;
    }

    /** 저장소 오류: "없음" 과 구분해야 하는 호출자(rate limiter 등)용 */
    public static Lookup failure() {
        return FAILED;
    }

    public Object orElse(Object defaultValue) {
        return found ? value : defaultValue;
    }
}
