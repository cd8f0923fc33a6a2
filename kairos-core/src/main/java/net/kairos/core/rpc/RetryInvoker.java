package net.kairos.core.rpc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 재시도 실행기.
 * <p>
 * 시도 → 실패 시 상태 코드 분류 → (재시도 가능 + 남은 횟수) 이면 백오프 후 재시도, 아니면 즉시 실패.
 * 호출마다 독립된 future 체인으로 돌며, 대기 중에도 스레드를 점유하지 않는다.
 * 재시도가 소진되면 마지막 오류를 그대로 돌려준다.
 * <p>
 * 이미 끝난 시도/대기는 루프로 이어가고, 아직 진행 중인 것에만 콜백을 건다.
 * 따라서 동기 완료가 연속돼도 스택이 쌓이지 않는다. 콜백 안의 예외도 결과 future 로 전달된다.
 */
public final class RetryInvoker {
    private static final Logger log = LoggerFactory.getLogger(RetryInvoker.class);

    private final BackoffTimer timer;

    public RetryInvoker() {
        this(BackoffTimer.system());
    }

    public RetryInvoker(BackoffTimer timer) {
        this.timer = Objects.requireNonNull(timer, "timer");
    }

    /**
     * @param policy  재시도 정책, null 이면 {@link RetryPolicy#defaults()}
     * @param handle  첫 시도에 넘길 클라이언트 핸들
     * @param attempt 한 번의 호출
     * @return 성공 값, 또는 {@link RpcStatusException} 으로 예외 완료되는 future
     */
    public <H, T> CompletableFuture<T> invoke(RetryPolicy policy, H handle, Attempt<H, T> attempt) {
        Objects.requireNonNull(attempt, "attempt");
        RetryPolicy p = policy == null ? RetryPolicy.defaults() : policy;
        CompletableFuture<T> result = new CompletableFuture<>();
        guard(result, () -> run(p, attempt, handle, 0, result));
        return result;
    }

    /** 다음 시도에 쓸 핸들/순번과 그 전에 기다릴 대기 */
    private record Next<H>(H handle, int index, CompletableFuture<Void> backoff, RpcStatusException lastError) {
    }

    private <H, T> void run(RetryPolicy policy, Attempt<H, T> attempt, H handle, int index,
                            CompletableFuture<T> result) {
        H current = handle;
        int i = index;
        while (!result.isDone()) { // 호출자가 cancel 하면 더 시도하지 않음
            CompletableFuture<AttemptResult<T, H>> stage = start(attempt, current);
            if (!stage.isDone()) {
                H h = current;
                int n = i;
                stage.whenComplete((r, t) -> guard(result, () -> {
                    Next<H> next = decide(policy, h, n, outcome(r, t, h), result);
                    if (next != null && waited(policy, attempt, next, result)) {
                        run(policy, attempt, next.handle(), next.index(), result);
                    }
                }));
                return;
            }

            H h = current;
            AttemptResult<T, H> done = stage.handle((r, t) -> outcome(r, t, h)).join();
            Next<H> next = decide(policy, current, i, done, result);
            if (next == null || !waited(policy, attempt, next, result)) return;
            current = next.handle();
            i = next.index();
        }
    }

    /** 시도 시작. 던진 예외와 null stage 도 실패 stage 로 바꾼다 */
    private static <H, T> CompletableFuture<AttemptResult<T, H>> start(Attempt<H, T> attempt, H handle) {
        CompletableFuture<AttemptResult<T, H>> f = new CompletableFuture<>();
        try {
            CompletionStage<AttemptResult<T, H>> stage = attempt.call(handle);
            if (stage == null) throw new IllegalStateException("attempt returned null stage");
            stage.whenComplete((r, t) -> {
                if (t != null) f.completeExceptionally(t); else f.complete(r);
            });
        } catch (Throwable t) {
            f.completeExceptionally(t);
        }
        return f;
    }

    private static <H, T> AttemptResult<T, H> outcome(AttemptResult<T, H> r, Throwable t, H handle) {
        if (t != null) return AttemptResult.failure(RpcStatusException.from(t), handle);
        if (r == null) {
            return AttemptResult.failure(
                    new RpcStatusException(StatusCode.UNKNOWN, "attempt completed without a result"), handle);
        }
        return r;
    }

    /** 결과를 확정하면 null, 재시도하면 다음 시도 정보 */
    private <H, T> Next<H> decide(RetryPolicy policy, H handle, int index, AttemptResult<T, H> outcome,
                                  CompletableFuture<T> result) {
        if (outcome.isSuccess()) {
            if (index > 0) log.debug("attempt {} succeeded after {} retries", index + 1, index);
            result.complete(outcome.value());
            return null;
        }

        RpcStatusException error = outcome.error();
        if (!policy.isRetryable(error.code())) {
            log.debug("attempt {} failed with non-retryable {}", index + 1, error.code());
            result.completeExceptionally(error);
            return null;
        }
        if (index + 1 >= policy.maxAttempts()) {
            log.warn("giving up after {} attempts, last status {}: {}",
                    index + 1, error.code(), error.description());
            result.completeExceptionally(error);
            return null;
        }

        Duration delay = policy.delayFor(index);
        H next = outcome.handle() != null ? outcome.handle() : handle;
        log.debug("attempt {} failed with {}, retrying in {}", index + 1, error.code(), delay);
        CompletableFuture<Void> wait;
        try {
            wait = timer.delay(delay);
            if (wait == null) throw new IllegalStateException("backoff timer returned null");
        } catch (Throwable t) {
            error.addSuppressed(t);
            result.completeExceptionally(error);
            return null;
        }
        return new Next<>(next, index + 1, wait, error);
    }

    /**
     * 대기가 이미 끝났으면 true (호출자가 바로 다음 시도).
     * 진행 중이면 끝날 때 run 을 이어가도록 걸고 false.
     */
    private <H, T> boolean waited(RetryPolicy policy, Attempt<H, T> attempt, Next<H> next,
                                  CompletableFuture<T> result) {
        if (!next.backoff().isDone()) {
            next.backoff().whenComplete((v, t) -> guard(result, () -> {
                if (t != null) fail(result, next.lastError(), t);
                else run(policy, attempt, next.handle(), next.index(), result);
            }));
            return false;
        }
        if (next.backoff().isCompletedExceptionally()) {
            Throwable t = next.backoff().handle((v, e) -> e).join();
            fail(result, next.lastError(), t);
            return false;
        }
        return true;
    }

    // 타이머 실패는 재시도 불가로 보고 마지막 오류에 덧붙여 종료
    private static void fail(CompletableFuture<?> result, RpcStatusException lastError, Throwable timerError) {
        lastError.addSuppressed(timerError);
        result.completeExceptionally(lastError);
    }

    private static void guard(CompletableFuture<?> result, Runnable step) {
        try {
            step.run();
        } catch (Throwable t) {
            result.completeExceptionally(RpcStatusException.from(t));
        }
    }
}
