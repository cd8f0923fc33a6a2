package net.kairos.app;

import com.google.protobuf.Empty;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import net.kairos.adapter.grpc.proto.CloudSchedulerGrpc;
import net.kairos.adapter.grpc.proto.SchedulerProtos;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

/** Netty 위에서 도는 테스트용 CloudScheduler. failNext 만큼 UNAVAILABLE 로 응답 */
class InMemoryCloudScheduler extends CloudSchedulerGrpc.CloudSchedulerImplBase {
    final Map<String, SchedulerProtos.Job> jobs = new TreeMap<>();
    final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger pendingFailures = new AtomicInteger();

    void failNext(int times) {
        pendingFailures.set(times);
    }

    private boolean enter(StreamObserver<?> o) {
        calls.incrementAndGet();
        if (pendingFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            o.onError(Status.UNAVAILABLE.withDescription("warming up").asRuntimeException());
            return false;
        }
        return true;
    }

    private static <T> void reply(StreamObserver<T> o, T v) {
        o.onNext(v);
        o.onCompleted();
    }

    private static void notFound(StreamObserver<?> o, String name) {
        o.onError(Status.NOT_FOUND.withDescription(name).asRuntimeException());
    }

    @Override
    public synchronized void createJob(SchedulerProtos.CreateJobRequest r, StreamObserver<SchedulerProtos.Job> o) {
        if (!enter(o)) return;
        if (jobs.containsKey(r.getJob().getName())) {
            o.onError(Status.ALREADY_EXISTS.withDescription(r.getJob().getName()).asRuntimeException());
            return;
        }
        SchedulerProtos.Job j = r.getJob().toBuilder().setState(SchedulerProtos.Job.State.ENABLED).build();
        jobs.put(j.getName(), j);
        reply(o, j);
    }

    @Override
    public synchronized void getJob(SchedulerProtos.GetJobRequest r, StreamObserver<SchedulerProtos.Job> o) {
        if (!enter(o)) return;
        SchedulerProtos.Job j = jobs.get(r.getName());
        if (j == null) notFound(o, r.getName()); else reply(o, j);
    }

    @Override
    public synchronized void listJobs(SchedulerProtos.ListJobsRequest r, StreamObserver<SchedulerProtos.ListJobsResponse> o) {
        if (!enter(o)) return;
        List<SchedulerProtos.Job> all = new ArrayList<>();
        for (SchedulerProtos.Job j : jobs.values()) if (j.getName().startsWith(r.getParent() + "/")) all.add(j);
        int size = r.getPageSize() > 0 ? r.getPageSize() : 100;
        int from = r.getPageToken().isEmpty() ? 0 : Integer.parseInt(r.getPageToken());
        int to = Math.min(all.size(), from + size);
        reply(o, SchedulerProtos.ListJobsResponse.newBuilder()
                .addAllJobs(all.subList(Math.min(from, to), to))
                .setNextPageToken(to < all.size() ? String.valueOf(to) : "")
                .build());
    }

    @Override
    public synchronized void updateJob(SchedulerProtos.UpdateJobRequest r, StreamObserver<SchedulerProtos.Job> o) {
        if (!enter(o)) return;
        SchedulerProtos.Job cur = jobs.get(r.getJob().getName());
        if (cur == null) {
            notFound(o, r.getJob().getName());
            return;
        }
        SchedulerProtos.Job j = r.getJob().toBuilder().setState(cur.getState()).build();
        jobs.put(j.getName(), j);
        reply(o, j);
    }

    @Override
    public synchronized void deleteJob(SchedulerProtos.DeleteJobRequest r, StreamObserver<Empty> o) {
        if (!enter(o)) return;
        if (jobs.remove(r.getName()) == null) notFound(o, r.getName()); else reply(o, Empty.getDefaultInstance());
    }

    @Override
    public synchronized void pauseJob(SchedulerProtos.PauseJobRequest r, StreamObserver<SchedulerProtos.Job> o) {
        if (!enter(o)) return;
        state(r.getName(), SchedulerProtos.Job.State.PAUSED, o);
    }

    @Override
    public synchronized void resumeJob(SchedulerProtos.ResumeJobRequest r, StreamObserver<SchedulerProtos.Job> o) {
        if (!enter(o)) return;
        state(r.getName(), SchedulerProtos.Job.State.ENABLED, o);
    }

    @Override
    public synchronized void runJob(SchedulerProtos.RunJobRequest r, StreamObserver<SchedulerProtos.Job> o) {
        if (!enter(o)) return;
        SchedulerProtos.Job j = jobs.get(r.getName());
        if (j == null) notFound(o, r.getName()); else reply(o, j);
    }

    private void state(String name, SchedulerProtos.Job.State s, StreamObserver<SchedulerProtos.Job> o) {
        SchedulerProtos.Job j = jobs.get(name);
        if (j == null) {
            notFound(o, name);
            return;
        }
        SchedulerProtos.Job changed = j.toBuilder().setState(s).build();
        jobs.put(name, changed);
        reply(o, changed);
    }
}
