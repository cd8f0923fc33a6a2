package net.kairos.adapter.grpc;

import com.google.protobuf.Empty;
import io.grpc.CallCredentials;
import io.grpc.Metadata;
import io.grpc.stub.MetadataUtils;
import io.grpc.stub.StreamObserver;
import net.kairos.adapter.grpc.mapper.ProtoMappers;
import net.kairos.adapter.grpc.proto.CloudSchedulerGrpc;
import net.kairos.core.model.*;
import net.kairos.core.spi.CallContext;
import net.kairos.core.spi.SchedulerStub;
import net.kairos.core.spi.TokenSource;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * CloudScheduler gRPC 서비스에 대한 단일 시도 stub.
 * 재시도는 하지 않는다. 실패는 {@link net.kairos.core.rpc.RpcStatusException} 으로 완료된다.
 */
public final class GrpcSchedulerStub implements SchedulerStub {
    static final Metadata.Key<String> ROUTING_KEY =
            Metadata.Key.of(CallContext.ROUTING_HEADER, Metadata.ASCII_STRING_MARSHALLER);

    private final ChannelPool pool;
    private final CallCredentials credentials;
    private final Duration callTimeout;

    public GrpcSchedulerStub(ChannelPool pool) {
        this(pool, null, null, ConnectionOptions.defaults());
    }

    /**
     * @param tokens   null 이면 인증 헤더 없이 호출
     * @param audience 토큰 audience, null 이면 채널 authority 에서 유도
     */
    public GrpcSchedulerStub(ChannelPool pool, TokenSource tokens, String audience, ConnectionOptions options) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.credentials = tokens == null ? null : new BearerTokenCallCredentials(tokens, audience);
        this.callTimeout = options == null ? null : options.callTimeout();
    }

    @Override
    public CompletableFuture<Job> createJob(CreateJobRequest request, CallContext ctx) {
        return unary(ctx, ProtoMappers.toProto(request), CloudSchedulerGrpc.CloudSchedulerStub::createJob,
                ProtoMappers::toJob);
    }

    @Override
    public CompletableFuture<Job> getJob(GetJobRequest request, CallContext ctx) {
        return unary(ctx, ProtoMappers.toProto(request), CloudSchedulerGrpc.CloudSchedulerStub::getJob, ProtoMappers::toJob);
    }

    @Override
    public CompletableFuture<ListJobsResponse> listJobs(ListJobsRequest request, CallContext ctx) {
        return unary(ctx, ProtoMappers.toProto(request), CloudSchedulerGrpc.CloudSchedulerStub::listJobs,
                ProtoMappers::toResponse);
    }

    @Override
    public CompletableFuture<Job> updateJob(UpdateJobRequest request, CallContext ctx) {
        return unary(ctx, ProtoMappers.toProto(request), CloudSchedulerGrpc.CloudSchedulerStub::updateJob,
                ProtoMappers::toJob);
    }

    @Override
    public CompletableFuture<Void> deleteJob(DeleteJobRequest request, CallContext ctx) {
        return unary(ctx, ProtoMappers.toProto(request), CloudSchedulerGrpc.CloudSchedulerStub::deleteJob,
                (Empty e) -> null);
    }

    @Override
    public CompletableFuture<Job> pauseJob(PauseJobRequest request, CallContext ctx) {
        return unary(ctx, ProtoMappers.toProto(request), CloudSchedulerGrpc.CloudSchedulerStub::pauseJob,
                ProtoMappers::toJob);
    }

    @Override
    public CompletableFuture<Job> resumeJob(ResumeJobRequest request, CallContext ctx) {
        return unary(ctx, ProtoMappers.toProto(request), CloudSchedulerGrpc.CloudSchedulerStub::resumeJob,
                ProtoMappers::toJob);
    }

    @Override
    public CompletableFuture<Job> runJob(RunJobRequest request, CallContext ctx) {
        return unary(ctx, ProtoMappers.toProto(request), CloudSchedulerGrpc.CloudSchedulerStub::runJob,
                ProtoMappers::toJob);
    }

    @Override
    public void close() throws Exception {
        pool.close();
    }

    @FunctionalInterface
    private interface Call<Q, P> {
        void invoke(CloudSchedulerGrpc.CloudSchedulerStub stub, Q request, StreamObserver<P> observer);
    }

    private <Q, P, T> CompletableFuture<T> unary(CallContext ctx, Q request, Call<Q, P> call, Function<P, T> mapper) {
        UnaryObserver<P, T> observer = new UnaryObserver<>(mapper);
        call.invoke(stub(ctx), request, observer);
        return observer.future();
    }

    /** 호출마다 채널을 고르고 인증/라우팅/deadline 을 입힌다 */
    private CloudSchedulerGrpc.CloudSchedulerStub stub(CallContext ctx) {
        CloudSchedulerGrpc.CloudSchedulerStub s = CloudSchedulerGrpc.newStub(pool.next());
        if (credentials != null) s = s.withCallCredentials(credentials);
        if (ctx != null && ctx.hasRouting()) {
            Metadata headers = new Metadata();
            headers.put(ROUTING_KEY, ctx.routingParams());
            s = s.withInterceptors(MetadataUtils.newAttachHeadersInterceptor(headers));
        }
        if (callTimeout != null && !callTimeout.isZero()) {
            s = s.withDeadlineAfter(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        return s;
    }
}
