package net.kairos.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * 원격 스케줄러의 Job 레코드 (클라이언트가 다루는 필드만).
 * name 형식: projects/{project}/locations/{location}/jobs/{jobId}
 */
public record Job(
        String name,
        String description,
        String schedule,        // unix-cron, 예: "*/5 * * * *"
        String timeZone,        // tz database id, 비우면 서버 기본(UTC)
        JobTarget target,       // HttpTarget 또는 PubsubTarget
        JobRetryConfig retryConfig,
        Duration attemptDeadline,
        State state,            // 출력 전용
        Instant userUpdateTime, // 출력 전용
        Instant scheduleTime,   // 출력 전용
        Instant lastAttemptTime // 출력 전용
) {
    public enum State {
        UNSPECIFIED, ENABLED, PAUSED, DISABLED, UPDATE_FAILED;

        public static State from(String s) {
            if (s == null) return UNSPECIFIED;
            try { return State.valueOf(s.toUpperCase(Locale.ROOT)); } catch (IllegalArgumentException e) { return UNSPECIFIED; }
        }
    }

    public static Job ofNew(String name, String description, String schedule, String timeZone, JobTarget target) {
        return new Job(name, description, schedule, timeZone, target, null, null, null, null, null, null);
    }

    public Job withName(String newName) {
        return new Job(newName, description, schedule, timeZone, target, retryConfig, attemptDeadline,
                state, userUpdateTime, scheduleTime, lastAttemptTime);
    }

    public Job withState(State newState) {
        return new Job(name, description, schedule, timeZone, target, retryConfig, attemptDeadline,
                newState, userUpdateTime, scheduleTime, lastAttemptTime);
    }
}
