package net.kairos.core.rpc;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/** 요청된 대기 시간을 기록만 하고 즉시 완료하는 테스트용 타이머 */
public final class RecordingBackoffTimer implements BackoffTimer {
    private final List<Duration> delays = new CopyOnWriteArrayList<>();

    @Override
    public CompletableFuture<Void> delay(Duration duration) {
        delays.add(duration);
        return CompletableFuture.completedFuture(null);
    }

    public List<Duration> delays() {
        return List.copyOf(delays);
    }
}
