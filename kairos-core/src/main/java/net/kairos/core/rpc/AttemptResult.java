package net.kairos.core.rpc;

import java.util.Objects;

/**
 * 한 번의 시도 결과. 성공 값 또는 (오류, 핸들) 쌍.
 * 실패 시 핸들을 돌려받아 다음 시도에서 그대로(또는 교체된 것을) 사용한다.
 *
 * @param <T> 성공 값 타입
 * @param <H> 클라이언트 핸들 타입
 */
public final class AttemptResult<T, H> {
    private final T value;
    private final RpcStatusException error;
    private final H handle;

    private AttemptResult(T value, RpcStatusException error, H handle) {
        this.value = value;
        this.error = error;
        this.handle = handle;
    }

    public static <T, H> AttemptResult<T, H> success(T value) {
        return new AttemptResult<>(value, null, null);
    }

    public static <T, H> AttemptResult<T, H> failure(RpcStatusException error, H handle) {
        return new AttemptResult<>(null, Objects.requireNonNull(error, "error"), handle);
    }

    public boolean isSuccess() { return error == null; }

    /** 성공 값 (null 가능: delete 처럼 응답 본문이 없는 경우) */
    public T value() {
        if (error != null) throw new IllegalStateException("not a success: " + error.code());
        return value;
    }

    public RpcStatusException error() {
        if (error == null) throw new IllegalStateException("not a failure");
        return error;
    }

    public H handle() { return handle; }

    @Override
    public String toString() {
        return isSuccess() ? "AttemptResult{success}" : "AttemptResult{failure=" + error.code() + '}';
    }
}
