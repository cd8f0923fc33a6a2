package net.kairos.core.rpc;

import java.util.Locale;

/** RPC 결과 상태 코드 (gRPC canonical code 와 번호 동일) */
public enum StatusCode {
    OK(0),
    CANCELLED(1),
    UNKNOWN(2),
    INVALID_ARGUMENT(3),
    DEADLINE_EXCEEDED(4),
    NOT_FOUND(5),
    ALREADY_EXISTS(6),
    PERMISSION_DENIED(7),
    RESOURCE_EXHAUSTED(8),
    FAILED_PRECONDITION(9),
    ABORTED(10),
    OUT_OF_RANGE(11),
    UNIMPLEMENTED(12),
    INTERNAL(13),
    UNAVAILABLE(14),
    DATA_LOSS(15),
    UNAUTHENTICATED(16);

    private final int value;

    StatusCode(int value) { this.value = value; }

    public int value() { return value; }

    public static StatusCode fromValue(int value) {
        for (StatusCode c : values()) {
            if (c.value == value) return c;
        }
        return UNKNOWN;
    }

    /** 이름("unavailable", "UNAVAILABLE") 또는 숫자("14") 모두 허용 */
    public static StatusCode from(String s) {
        if (s == null || s.isBlank()) throw new IllegalArgumentException("status code is blank");
        String v = s.trim();
        if (v.chars().allMatch(Character::isDigit)) return fromValue(Integer.parseInt(v));
        try {
            return StatusCode.valueOf(v.toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown status code: " + s, e);
        }
    }
}
