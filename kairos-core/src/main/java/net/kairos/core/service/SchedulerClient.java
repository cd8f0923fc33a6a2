package net.kairos.core.service;

import net.kairos.core.model.*;
import net.kairos.core.rpc.*;
import net.kairos.core.spi.CallContext;
import net.kairos.core.spi.OperationsClient;
import net.kairos.core.spi.ScheduleValidator;
import net.kairos.core.spi.SchedulerStub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * 원격 Job 스케줄러 클라이언트.
 * <p>
 * 모든 오퍼레이션은 같은 흐름을 탄다: 요청 검증 → 라우팅 메타데이터 → {@link RetryInvoker} 로 재시도 호출 → 결과.
 * retry 인자가 null 이면 생성 시 받은 기본 정책을 쓴다.
 * <p>
 * 재시도는 상태 코드만 보고 결정하며 중복 제거를 하지 않는다. 따라서 CreateJob, RunJob 처럼
 * 멱등이 아닌 호출은 재시도 중에 서버에서 두 번 반영될 수 있다 (at-least-once).
 * 이를 피하려면 해당 호출에 {@link RetryPolicy#noRetry()} 를 넘긴다.
 * <p>
 * 한 인스턴스를 여러 스레드가 공유해도 된다. 호출마다 독립된 재시도 루프가 돈다.
 * 실패는 {@link RpcStatusException} (블로킹 메서드는 throw, async 메서드는 예외 완료).
 */
public final class SchedulerClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SchedulerClient.class);

    private final SchedulerStub stub;
    private final OperationsClient operations;
    private final RetryInvoker invoker;
    private final RetryPolicy defaultPolicy;
    private final ScheduleValidator scheduleValidator;

    public SchedulerClient(SchedulerStub stub, OperationsClient operations) {
        this(stub, operations, new RetryInvoker(), RetryPolicy.defaults(), ScheduleValidator.noop());
    }

    public SchedulerClient(SchedulerStub stub,
                           OperationsClient operations,
                           RetryInvoker invoker,
                           RetryPolicy defaultPolicy,
                           ScheduleValidator scheduleValidator) {
        this.stub = Objects.requireNonNull(stub, "stub");
        this.operations = operations == null ? OperationsClient.unsupported() : operations;
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.defaultPolicy = defaultPolicy == null ? RetryPolicy.defaults() : defaultPolicy;
        this.scheduleValidator = scheduleValidator == null ? ScheduleValidator.noop() : scheduleValidator;
    }

    // --- CreateJob ---

    public Job createJob(CreateJobRequest request) {
        return createJob(request, null);
    }

    public Job createJob(CreateJobRequest request, RetryPolicy retry) {
        return await(createJobAsync(request, retry));
    }

    public CompletableFuture<Job> createJobAsync(CreateJobRequest request, RetryPolicy retry) {
        return call("CreateJob", retry,
                () -> {
                    requireRequest(request);
                    requireText(request.parent(), "parent");
                    requireSchedule(requireJob(request.job()));
                },
                () -> CallContext.routing("parent", request.parent()),
                (s, ctx) -> s.createJob(request, ctx));
    }

    // --- GetJob ---

    public Job getJob(GetJobRequest request) {
        return getJob(request, null);
    }

    public Job getJob(GetJobRequest request, RetryPolicy retry) {
        return await(getJobAsync(request, retry));
    }

    public CompletableFuture<Job> getJobAsync(GetJobRequest request, RetryPolicy retry) {
        return call("GetJob", retry,
                () -> requireText(requireRequest(request).name(), "name"),
                () -> CallContext.routing("name", request.name()),
                (s, ctx) -> s.getJob(request, ctx));
    }

    // --- ListJobs ---

    public ListJobsResponse listJobs(ListJobsRequest request) {
        return listJobs(request, null);
    }

    public ListJobsResponse listJobs(ListJobsRequest request, RetryPolicy retry) {
        return await(listJobsAsync(request, retry));
    }

    /** 한 페이지만 가져온다. nextPageToken 은 서버 값 그대로 */
    public CompletableFuture<ListJobsResponse> listJobsAsync(ListJobsRequest request, RetryPolicy retry) {
        return call("ListJobs", retry,
                () -> {
                    requireText(requireRequest(request).parent(), "parent");
                    if (request.pageSize() < 0) throw RpcStatusException.invalidArgument("pageSize must be >= 0");
                },
                () -> CallContext.routing("parent", request.parent()),
                (s, ctx) -> s.listJobs(request, ctx));
    }

    // --- UpdateJob ---

    public Job updateJob(UpdateJobRequest request) {
        return updateJob(request, null);
    }

    public Job updateJob(UpdateJobRequest request, RetryPolicy retry) {
        return await(updateJobAsync(request, retry));
    }

    public CompletableFuture<Job> updateJobAsync(UpdateJobRequest request, RetryPolicy retry) {
        return call("UpdateJob", retry,
                () -> {
                    Job job = requireJob(requireRequest(request).job());
                    requireText(job.name(), "job.name");
                    if (request.updateMask().isEmpty() || request.updateMask().contains("schedule")) {
                        requireSchedule(job);
                    }
                },
                () -> CallContext.routing("job.name", request.job().name()),
                (s, ctx) -> s.updateJob(request, ctx));
    }

    // --- DeleteJob ---

    public void deleteJob(DeleteJobRequest request) {
        deleteJob(request, null);
    }

    public void deleteJob(DeleteJobRequest request, RetryPolicy retry) {
        await(deleteJobAsync(request, retry));
    }

    public CompletableFuture<Void> deleteJobAsync(DeleteJobRequest request, RetryPolicy retry) {
        return call("DeleteJob", retry,
                () -> requireText(requireRequest(request).name(), "name"),
                () -> CallContext.routing("name", request.name()),
                (s, ctx) -> s.deleteJob(request, ctx));
    }

    // --- PauseJob ---

    public Job pauseJob(PauseJobRequest request) {
        return pauseJob(request, null);
    }

    public Job pauseJob(PauseJobRequest request, RetryPolicy retry) {
        return await(pauseJobAsync(request, retry));
    }

    public CompletableFuture<Job> pauseJobAsync(PauseJobRequest request, RetryPolicy retry) {
        return call("PauseJob", retry,
                () -> requireText(requireRequest(request).name(), "name"),
                () -> CallContext.routing("name", request.name()),
                (s, ctx) -> s.pauseJob(request, ctx));
    }

    // --- ResumeJob ---

    public Job resumeJob(ResumeJobRequest request) {
        return resumeJob(request, null);
    }

    public Job resumeJob(ResumeJobRequest request, RetryPolicy retry) {
        return await(resumeJobAsync(request, retry));
    }

    public CompletableFuture<Job> resumeJobAsync(ResumeJobRequest request, RetryPolicy retry) {
        return call("ResumeJob", retry,
                () -> requireText(requireRequest(request).name(), "name"),
                () -> CallContext.routing("name", request.name()),
                (s, ctx) -> s.resumeJob(request, ctx));
    }

    // --- RunJob ---

    public Job runJob(RunJobRequest request) {
        return runJob(request, null);
    }

    public Job runJob(RunJobRequest request, RetryPolicy retry) {
        return await(runJobAsync(request, retry));
    }

    /** 재시도 시 같은 Job 이 여러 번 실행될 수 있다 */
    public CompletableFuture<Job> runJobAsync(RunJobRequest request, RetryPolicy retry) {
        return call("RunJob", retry,
                () -> requireText(requireRequest(request).name(), "name"),
                () -> CallContext.routing("name", request.name()),
                (s, ctx) -> s.runJob(request, ctx));
    }

    /** long-running operation 협력자 (구현이 없으면 UNIMPLEMENTED 로 실패하는 자리표시자) */
    public OperationsClient operations() {
        return operations;
    }

    public RetryPolicy defaultPolicy() {
        return defaultPolicy;
    }

    @Override
    public void close() throws Exception {
        stub.close();
    }

    // --- 공통 호출 경로 ---

    @FunctionalInterface
    private interface Rpc<T> {
        CompletableFuture<T> call(SchedulerStub stub, CallContext ctx);
    }

    private <T> CompletableFuture<T> call(String method,
                                          RetryPolicy retry,
                                          Runnable validation,
                                          Supplier<CallContext> context,
                                          Rpc<T> rpc) {
        try {
            validation.run();
        } catch (RpcStatusException e) {
            log.debug("{} rejected before sending: {}", method, e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
        CallContext ctx = context.get();
        RetryPolicy policy = retry == null ? defaultPolicy : retry;
        return invoker.invoke(policy, stub, (SchedulerStub s) -> rpc.call(s, ctx).handle((value, error) ->
                error == null
                        ? AttemptResult.<T, SchedulerStub>success(value)
                        : AttemptResult.<T, SchedulerStub>failure(RpcStatusException.from(error), s)));
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new RpcStatusException(StatusCode.CANCELLED, "interrupted while waiting for response", e);
        } catch (ExecutionException e) {
            throw RpcStatusException.from(e);
        }
    }

    // --- 검증 (실패 시 INVALID_ARGUMENT, 시도 0회) ---

    private static <R> R requireRequest(R request) {
        if (request == null) throw RpcStatusException.invalidArgument("request is required");
        return request;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw RpcStatusException.invalidArgument(field + " is required");
        }
    }

    private static Job requireJob(Job job) {
        if (job == null) throw RpcStatusException.invalidArgument("job is required");
        return job;
    }

    private void requireSchedule(Job job) {
        if (job.schedule() == null || job.schedule().isBlank()) return; // 서버 측 판단에 맡김
        Optional<String> problem = scheduleValidator.validate(job.schedule(), job.timeZone());
        if (problem.isPresent()) {
            throw RpcStatusException.invalidArgument("invalid schedule '" + job.schedule() + "': " + problem.get());
        }
    }
}
