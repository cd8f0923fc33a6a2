package net.kairos.core.spi;

import net.kairos.core.model.*;

import java.util.concurrent.CompletableFuture;

/**
 * 원격 스케줄러 서비스에 채널로 묶인 호출 핸들.
 * 구현은 한 번만 시도하며(재시도 없음) 실패는 RpcStatusException 으로 예외 완료한다.
 * 여러 스레드가 동시에 호출해도 안전해야 한다.
 */
public interface SchedulerStub extends AutoCloseable {
    CompletableFuture<Job> createJob(CreateJobRequest request, CallContext ctx);
    CompletableFuture<Job> getJob(GetJobRequest request, CallContext ctx);
    CompletableFuture<ListJobsResponse> listJobs(ListJobsRequest request, CallContext ctx);
    CompletableFuture<Job> updateJob(UpdateJobRequest request, CallContext ctx);
    CompletableFuture<Void> deleteJob(DeleteJobRequest request, CallContext ctx);
    CompletableFuture<Job> pauseJob(PauseJobRequest request, CallContext ctx);
    CompletableFuture<Job> resumeJob(ResumeJobRequest request, CallContext ctx);
    CompletableFuture<Job> runJob(RunJobRequest request, CallContext ctx);

    /** 채널 등 보유 자원 해제. 기본은 no-op */
    @Override
    default void close() throws Exception { }
}
