package net.kairos.adapter.grpc.mapper;

import com.google.protobuf.Duration;
import com.google.protobuf.Timestamp;

import java.time.Instant;

/** java.time ↔ protobuf well-known type. 메시지 기본값(0초)은 null 로 본다 */
public final class ProtoTimes {
    private ProtoTimes() {}

    public static Instant toInstant(Timestamp ts) {
        if (ts == null || (ts.getSeconds() == 0 && ts.getNanos() == 0)) return null;
        return Instant.ofEpochSecond(ts.getSeconds(), ts.getNanos());
    }

    public static Timestamp toTimestamp(Instant instant) {
        return Timestamp.newBuilder()
                .setSeconds(instant.getEpochSecond())
                .setNanos(instant.getNano())
                .build();
    }

    public static java.time.Duration toDuration(Duration d) {
        if (d == null || (d.getSeconds() == 0 && d.getNanos() == 0)) return null;
        return java.time.Duration.ofSeconds(d.getSeconds(), d.getNanos());
    }

    public static Duration toProto(java.time.Duration d) {
        return Duration.newBuilder()
                .setSeconds(d.getSeconds())
                .setNanos(d.getNano())
                .build();
    }
}
