package net.kairos.integration.spring.sched;

import net.kairos.core.rpc.BackoffTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Spring TaskScheduler 로 재시도 대기.
 * 컨텍스트 종료/미초기화 등으로 예약이 거부되면 대기가 예외 완료된다.
 */
public final class TaskSchedulerBackoffTimer implements BackoffTimer {
    private static final Logger log = LoggerFactory.getLogger(TaskSchedulerBackoffTimer.class);

    private final TaskScheduler scheduler;

    public TaskSchedulerBackoffTimer(TaskScheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    @Override
    public CompletableFuture<Void> delay(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> done = new CompletableFuture<>();
        try {
            scheduler.schedule(() -> done.complete(null), Instant.now().plus(duration));
        } catch (RuntimeException e) {
            // TaskRejectedException(종료 후), IllegalStateException(initialize 전) 등
            log.warn("backoff wait of {} could not be scheduled: {}", duration, e.toString());
            done.completeExceptionally(e);
        }
        return done;
    }
}
