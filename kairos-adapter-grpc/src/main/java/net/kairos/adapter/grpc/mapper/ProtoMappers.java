package net.kairos.adapter.grpc.mapper;

import com.google.protobuf.ByteString;
import com.google.protobuf.FieldMask;
import net.kairos.adapter.grpc.proto.SchedulerProtos;
import net.kairos.core.model.*;
import net.kairos.core.rpc.RpcStatusException;

import java.util.ArrayList;
import java.util.List;

import static net.kairos.adapter.grpc.mapper.ProtoTimes.*;

/**
 * 코어 모델 ↔ SchedulerProtos 메시지.
 * proto3 setter 는 null 을 받지 않으므로 null 필드는 건너뛴다 (= 기본값).
 */
public final class ProtoMappers {
    private ProtoMappers() {}

    // --- Job ---
    public static Job toJob(SchedulerProtos.Job p) {
        return new Job(
                emptyToNull(p.getName()),
                emptyToNull(p.getDescription()),
                emptyToNull(p.getSchedule()),
                emptyToNull(p.getTimeZone()),
                toTarget(p),
                p.hasRetryConfig() ? toRetryConfig(p.getRetryConfig()) : null,
                p.hasAttemptDeadline() ? toDuration(p.getAttemptDeadline()) : null,
                toState(p.getState()),
                p.hasUserUpdateTime() ? toInstant(p.getUserUpdateTime()) : null,
                p.hasScheduleTime() ? toInstant(p.getScheduleTime()) : null,
                p.hasLastAttemptTime() ? toInstant(p.getLastAttemptTime()) : null
        );
    }

    public static SchedulerProtos.Job toProto(Job job) {
        SchedulerProtos.Job.Builder b = SchedulerProtos.Job.newBuilder();
        if (job.name() != null) b.setName(job.name());
        if (job.description() != null) b.setDescription(job.description());
        if (job.schedule() != null) b.setSchedule(job.schedule());
        if (job.timeZone() != null) b.setTimeZone(job.timeZone());

        JobTarget target = job.target();
        if (target instanceof HttpTarget http) {
            b.setHttpTarget(toProto(http));
        } else if (target instanceof PubsubTarget pubsub) {
            b.setPubsubTarget(toProto(pubsub));
        } else if (target != null) {
            throw RpcStatusException.invalidArgument("unsupported job target: " + target.getClass().getName());
        }

        if (job.retryConfig() != null) b.setRetryConfig(toProto(job.retryConfig()));
        if (job.attemptDeadline() != null) b.setAttemptDeadline(ProtoTimes.toProto(job.attemptDeadline()));
        if (job.state() != null) b.setState(toProto(job.state()));
        if (job.userUpdateTime() != null) b.setUserUpdateTime(toTimestamp(job.userUpdateTime()));
        if (job.scheduleTime() != null) b.setScheduleTime(toTimestamp(job.scheduleTime()));
        if (job.lastAttemptTime() != null) b.setLastAttemptTime(toTimestamp(job.lastAttemptTime()));
        return b.build();
    }

    // --- Target ---
    private static JobTarget toTarget(SchedulerProtos.Job p) {
        return switch (p.getTargetCase()) {
            case HTTP_TARGET -> {
                SchedulerProtos.HttpTarget h = p.getHttpTarget();
                yield new HttpTarget(h.getUri(), toMethod(h.getHttpMethod()), h.getHeadersMap(), h.getBody().toByteArray());
            }
            case PUBSUB_TARGET -> {
                SchedulerProtos.PubsubTarget s = p.getPubsubTarget();
                yield new PubsubTarget(s.getTopicName(), s.getData().toByteArray(), s.getAttributesMap());
            }
            case TARGET_NOT_SET -> null;
        };
    }

    static SchedulerProtos.HttpTarget toProto(HttpTarget t) {
        SchedulerProtos.HttpTarget.Builder b = SchedulerProtos.HttpTarget.newBuilder()
                .putAllHeaders(t.headers())
                .setBody(ByteString.copyFrom(t.body()));
        if (t.uri() != null) b.setUri(t.uri());
        if (t.httpMethod() != null) b.setHttpMethod(toProto(t.httpMethod()));
        return b.build();
    }

    static SchedulerProtos.PubsubTarget toProto(PubsubTarget t) {
        SchedulerProtos.PubsubTarget.Builder b = SchedulerProtos.PubsubTarget.newBuilder()
                .putAllAttributes(t.attributes())
                .setData(ByteString.copyFrom(t.data()));
        if (t.topicName() != null) b.setTopicName(t.topicName());
        return b.build();
    }

    // --- RetryConfig ---
    static JobRetryConfig toRetryConfig(SchedulerProtos.RetryConfig p) {
        return new JobRetryConfig(
                p.getRetryCount(),
                p.hasMaxRetryDuration() ? toDuration(p.getMaxRetryDuration()) : null,
                p.hasMinBackoffDuration() ? toDuration(p.getMinBackoffDuration()) : null,
                p.hasMaxBackoffDuration() ? toDuration(p.getMaxBackoffDuration()) : null,
                p.getMaxDoublings()
        );
    }

    static SchedulerProtos.RetryConfig toProto(JobRetryConfig c) {
        SchedulerProtos.RetryConfig.Builder b = SchedulerProtos.RetryConfig.newBuilder()
                .setRetryCount(c.retryCount())
                .setMaxDoublings(c.maxDoublings());
        if (c.maxRetryDuration() != null) b.setMaxRetryDuration(ProtoTimes.toProto(c.maxRetryDuration()));
        if (c.minBackoffDuration() != null) b.setMinBackoffDuration(ProtoTimes.toProto(c.minBackoffDuration()));
        if (c.maxBackoffDuration() != null) b.setMaxBackoffDuration(ProtoTimes.toProto(c.maxBackoffDuration()));
        return b.build();
    }

    // --- enum ---
    static Job.State toState(SchedulerProtos.Job.State s) {
        return switch (s) {
            case ENABLED -> Job.State.ENABLED;
            case PAUSED -> Job.State.PAUSED;
            case DISABLED -> Job.State.DISABLED;
            case UPDATE_FAILED -> Job.State.UPDATE_FAILED;
            case STATE_UNSPECIFIED, UNRECOGNIZED -> Job.State.UNSPECIFIED;
        };
    }

    static SchedulerProtos.Job.State toProto(Job.State s) {
        return switch (s) {
            case ENABLED -> SchedulerProtos.Job.State.ENABLED;
            case PAUSED -> SchedulerProtos.Job.State.PAUSED;
            case DISABLED -> SchedulerProtos.Job.State.DISABLED;
            case UPDATE_FAILED -> SchedulerProtos.Job.State.UPDATE_FAILED;
            case UNSPECIFIED -> SchedulerProtos.Job.State.STATE_UNSPECIFIED;
        };
    }

    static HttpTarget.Method toMethod(SchedulerProtos.HttpMethod m) {
        return switch (m) {
            case POST -> HttpTarget.Method.POST;
            case GET -> HttpTarget.Method.GET;
            case HEAD -> HttpTarget.Method.HEAD;
            case PUT -> HttpTarget.Method.PUT;
            case DELETE -> HttpTarget.Method.DELETE;
            case PATCH -> HttpTarget.Method.PATCH;
            case OPTIONS -> HttpTarget.Method.OPTIONS;
            case HTTP_METHOD_UNSPECIFIED, UNRECOGNIZED -> HttpTarget.Method.UNSPECIFIED;
        };
    }

    static SchedulerProtos.HttpMethod toProto(HttpTarget.Method m) {
        return switch (m) {
            case POST -> SchedulerProtos.HttpMethod.POST;
            case GET -> SchedulerProtos.HttpMethod.GET;
            case HEAD -> SchedulerProtos.HttpMethod.HEAD;
            case PUT -> SchedulerProtos.HttpMethod.PUT;
            case DELETE -> SchedulerProtos.HttpMethod.DELETE;
            case PATCH -> SchedulerProtos.HttpMethod.PATCH;
            case OPTIONS -> SchedulerProtos.HttpMethod.OPTIONS;
            case UNSPECIFIED -> SchedulerProtos.HttpMethod.HTTP_METHOD_UNSPECIFIED;
        };
    }

    // --- 요청/응답 ---
    public static SchedulerProtos.CreateJobRequest toProto(CreateJobRequest r) {
        return SchedulerProtos.CreateJobRequest.newBuilder()
                .setParent(r.parent())
                .setJob(toProto(r.job()))
                .build();
    }

    public static SchedulerProtos.GetJobRequest toProto(GetJobRequest r) {
        return SchedulerProtos.GetJobRequest.newBuilder().setName(r.name()).build();
    }

    public static SchedulerProtos.ListJobsRequest toProto(ListJobsRequest r) {
        SchedulerProtos.ListJobsRequest.Builder b = SchedulerProtos.ListJobsRequest.newBuilder()
                .setParent(r.parent())
                .setPageSize(r.pageSize());
        if (r.pageToken() != null) b.setPageToken(r.pageToken());
        return b.build();
    }

    public static ListJobsResponse toResponse(SchedulerProtos.ListJobsResponse p) {
        List<Job> jobs = new ArrayList<>(p.getJobsCount());
        for (SchedulerProtos.Job j : p.getJobsList()) jobs.add(toJob(j));
        return new ListJobsResponse(jobs, p.getNextPageToken());
    }

    public static SchedulerProtos.UpdateJobRequest toProto(UpdateJobRequest r) {
        SchedulerProtos.UpdateJobRequest.Builder b = SchedulerProtos.UpdateJobRequest.newBuilder()
                .setJob(toProto(r.job()));
        if (!r.updateMask().isEmpty()) {
            b.setUpdateMask(FieldMask.newBuilder().addAllPaths(r.updateMask()));
        }
        return b.build();
    }

    public static SchedulerProtos.DeleteJobRequest toProto(DeleteJobRequest r) {
        return SchedulerProtos.DeleteJobRequest.newBuilder().setName(r.name()).build();
    }

    public static SchedulerProtos.PauseJobRequest toProto(PauseJobRequest r) {
        return SchedulerProtos.PauseJobRequest.newBuilder().setName(r.name()).build();
    }

    public static SchedulerProtos.ResumeJobRequest toProto(ResumeJobRequest r) {
        return SchedulerProtos.ResumeJobRequest.newBuilder().setName(r.name()).build();
    }

    public static SchedulerProtos.RunJobRequest toProto(RunJobRequest r) {
        return SchedulerProtos.RunJobRequest.newBuilder().setName(r.name()).build();
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
