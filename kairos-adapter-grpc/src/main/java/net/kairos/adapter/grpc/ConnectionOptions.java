package net.kairos.adapter.grpc;

import java.time.Duration;

/**
 * gRPC 채널/호출 옵션.
 *
 * @param plaintext             TLS 없이 접속 (로컬/테스트 서버용)
 * @param callTimeout           시도 1회의 deadline, null 이면 없음
 * @param keepAliveTime         null 이면 gRPC 기본값
 * @param idleTimeout           null 이면 gRPC 기본값
 * @param maxInboundMessageSize 응답 메시지 최대 크기
 * @param userAgent             null 이면 gRPC 기본값
 * @param shutdownTimeout       close 시 채널 종료 대기
 */
public record ConnectionOptions(
        boolean plaintext,
        Duration callTimeout,
        Duration keepAliveTime,
        Duration idleTimeout,
        int maxInboundMessageSize,
        String userAgent,
        Duration shutdownTimeout
) {
    public ConnectionOptions {
        if (maxInboundMessageSize <= 0) maxInboundMessageSize = Integer.MAX_VALUE;
        if (shutdownTimeout == null) shutdownTimeout = Duration.ofSeconds(5);
    }

    /** TLS, deadline 없음, 응답 크기 제한 없음 */
    public static ConnectionOptions defaults() {
        return new ConnectionOptions(false, null, null, null, Integer.MAX_VALUE, null, Duration.ofSeconds(5));
    }

    public ConnectionOptions withPlaintext(boolean value) {
        return new ConnectionOptions(value, callTimeout, keepAliveTime, idleTimeout, maxInboundMessageSize, userAgent, shutdownTimeout);
    }

    public ConnectionOptions withCallTimeout(Duration value) {
        return new ConnectionOptions(plaintext, value, keepAliveTime, idleTimeout, maxInboundMessageSize, userAgent, shutdownTimeout);
    }
}
