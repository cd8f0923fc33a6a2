package net.kairos.core.rpc;

import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 상태 코드가 붙은 RPC 실패.
 * 재시도 소진 후의 실패와 첫 시도의 실패는 같은 타입/코드로 표현된다.
 */
public class RpcStatusException extends RuntimeException {
    private final StatusCode code;
    private final String description;

    public RpcStatusException(StatusCode code, String description) {
        this(code, description, null);
    }

    public RpcStatusException(StatusCode code, String description, Throwable cause) {
        super(format(code, description), cause);
        this.code = Objects.requireNonNull(code, "code");
        this.description = description;
    }

    public static RpcStatusException of(StatusCode code, String description) {
        return new RpcStatusException(code, description);
    }

    public static RpcStatusException invalidArgument(String description) {
        return new RpcStatusException(StatusCode.INVALID_ARGUMENT, description);
    }

    /**
     * 임의의 실패를 RpcStatusException 으로 정규화.
     * CompletionException/ExecutionException 은 벗겨내고, 상태가 없는 예외는 UNKNOWN 으로 감싼다.
     */
    public static RpcStatusException from(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        if (cur instanceof RpcStatusException e) return e;
        return new RpcStatusException(StatusCode.UNKNOWN, String.valueOf(cur), cur);
    }

    public StatusCode code() { return code; }

    public String description() { return description; }

    private static String format(StatusCode code, String description) {
        return description == null || description.isEmpty()
                ? String.valueOf(code)
                : code + ": " + description;
    }
}
