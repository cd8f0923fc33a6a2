package net.kairos.core.spi;

import net.kairos.core.rpc.RpcStatusException;
import net.kairos.core.rpc.StatusCode;

import java.util.concurrent.CompletableFuture;

/**
 * long-running operation 조회용 외부 협력자. 구현은 이 라이브러리 밖에서 주입한다.
 */
public interface OperationsClient {
    CompletableFuture<Operation> getOperation(String name);

    /** done 이 될 때까지 폴링 */
    CompletableFuture<Operation> pollUntilDone(String name);

    record Operation(String name, boolean done, String errorCode, String errorMessage) {
        public boolean failed() {
            return done && errorCode != null;
        }
    }

    /** 구현이 없을 때 쓰는 자리표시자. 호출하면 UNIMPLEMENTED 로 실패 */
    static OperationsClient unsupported() {
        return new OperationsClient() {
            @Override
            public CompletableFuture<Operation> getOperation(String name) {
                return CompletableFuture.failedFuture(
                        RpcStatusException.of(StatusCode.UNIMPLEMENTED, "no operations client configured"));
            }

            @Override
            public CompletableFuture<Operation> pollUntilDone(String name) {
                return getOperation(name);
            }
        };
    }
}
