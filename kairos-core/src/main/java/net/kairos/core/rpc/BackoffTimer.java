package net.kairos.core.rpc;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/** 재시도 사이 대기. 스레드를 붙잡지 않고 지연 후 완료되는 future 를 돌려준다. */
@FunctionalInterface
public interface BackoffTimer {
    CompletableFuture<Void> delay(Duration duration);

    /** JDK delayedExecutor 기반 기본 구현 */
    static BackoffTimer system() {
        return d -> {
            long nanos;
            try {
                nanos = d.toNanos();
            } catch (ArithmeticException e) {
                nanos = Long.MAX_VALUE; // 약 292년, 사실상 무한 대기
            }
            if (nanos <= 0) return CompletableFuture.completedFuture(null);
            return CompletableFuture.runAsync(() -> { },
                    CompletableFuture.delayedExecutor(nanos, TimeUnit.NANOSECONDS));
        };
    }
}
