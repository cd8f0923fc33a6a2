package net.kairos.core.model;

import java.time.Duration;

/** 서버 측에서 Job 실행 실패 시 적용하는 재시도 설정. 클라이언트 RPC 재시도와는 무관. */
public record JobRetryConfig(
        int retryCount,
        Duration maxRetryDuration,
        Duration minBackoffDuration,
        Duration maxBackoffDuration,
        int maxDoublings
) {
}
