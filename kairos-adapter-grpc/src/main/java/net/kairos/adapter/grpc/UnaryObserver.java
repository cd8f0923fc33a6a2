package net.kairos.adapter.grpc;

import io.grpc.stub.StreamObserver;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/** 단항 호출 응답을 CompletableFuture 로 옮기는 observer. 오류는 RpcStatusException 으로 변환 */
final class UnaryObserver<P, T> implements StreamObserver<P> {
    private final CompletableFuture<T> future = new CompletableFuture<>();
    private final Function<P, T> mapper;
    private P value;

    UnaryObserver(Function<P, T> mapper) {
        this.mapper = mapper;
    }

    CompletableFuture<T> future() {
        return future;
    }

    @Override
    public void onNext(P message) {
        this.value = message;
    }

    @Override
    public void onError(Throwable t) {
        future.completeExceptionally(GrpcStatuses.toRpcException(t));
    }

    @Override
    public void onCompleted() {
        try {
            future.complete(mapper.apply(value));
        } catch (RuntimeException e) {
            future.completeExceptionally(e);
        }
    }
}
