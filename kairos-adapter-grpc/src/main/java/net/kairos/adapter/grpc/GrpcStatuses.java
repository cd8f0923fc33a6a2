package net.kairos.adapter.grpc;

import io.grpc.Status;
import net.kairos.core.rpc.RpcStatusException;
import net.kairos.core.rpc.StatusCode;

/** io.grpc.Status ↔ 코어 상태 코드 변환 */
public final class GrpcStatuses {
    private GrpcStatuses() {}

    public static StatusCode toCode(Status.Code code) {
        return StatusCode.fromValue(code.value());
    }

    /** StatusRuntimeException 등에서 상태를 꺼내 RpcStatusException 으로. 상태가 없으면 UNKNOWN */
    public static RpcStatusException toRpcException(Throwable t) {
        if (t instanceof RpcStatusException e) return e;
        Status status = Status.fromThrowable(t);
        return new RpcStatusException(toCode(status.getCode()), status.getDescription(), t);
    }
}
