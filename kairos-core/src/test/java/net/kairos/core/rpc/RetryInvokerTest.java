package net.kairos.core.rpc;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;

class RetryInvokerTest {

    // 50ms 고정, 20회, UNAVAILABLE 만 재시도
    private static final RetryPolicy FIXED_50MS = RetryPolicy.builder()
            .initialDelay(Duration.ofMillis(50))
            .maxDelay(Duration.ofSeconds(60))
            .backoffFactor(1)
            .maxAttempts(20)
            .retryableCodes(StatusCode.UNAVAILABLE)
            .build();

    RecordingBackoffTimer timer;
    RetryInvoker invoker;

    /** 시도마다 받은 핸들을 기록하는 가짜 클라이언트 핸들 */
    static final class Handle {
        final String id;
        Handle(String id) { this.id = id; }
    }

    @BeforeEach
    void setUp() {
        timer = new RecordingBackoffTimer();
        invoker = new RetryInvoker(timer);
    }

    @Test
    void first_success_means_one_attempt_and_no_delay() {
        AtomicInteger calls = new AtomicInteger();

        String result = invoker.<Handle, String>invoke(FIXED_50MS, new Handle("h"), h -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(AttemptResult.success("ok"));
        }).join();

        assertEquals("ok", result);
        assertEquals(1, calls.get());
        assertThat(timer.delays()).isEmpty();
    }

    @Test
    void three_unavailable_then_success_makes_four_attempts_with_50ms_each() {
        AtomicInteger calls = new AtomicInteger();

        String result = invoker.<Handle, String>invoke(FIXED_50MS, new Handle("h"), h -> {
            int n = calls.incrementAndGet();
            if (n <= 3) return failed(StatusCode.UNAVAILABLE, h);
            return CompletableFuture.completedFuture(AttemptResult.success("done"));
        }).join();

        assertEquals("done", result);
        assertEquals(4, calls.get());
        assertThat(timer.delays()).containsExactly(
                Duration.ofMillis(50), Duration.ofMillis(50), Duration.ofMillis(50));
    }

    @Test
    void non_retryable_code_stops_after_first_attempt() {
        AtomicInteger calls = new AtomicInteger();

        var future = invoker.<Handle, String>invoke(FIXED_50MS, new Handle("h"), h -> {
            calls.incrementAndGet();
            return failed(StatusCode.INVALID_ARGUMENT, h);
        });

        assertThatThrownBy(future::join)
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOfSatisfying(RpcStatusException.class,
                        e -> assertThat(e.code()).isEqualTo(StatusCode.INVALID_ARGUMENT));
        assertEquals(1, calls.get());
        assertThat(timer.delays()).isEmpty();
    }

    @Test
    void persistent_retryable_failure_makes_exactly_maxAttempts_attempts_and_returns_last_error() {
        AtomicInteger calls = new AtomicInteger();
        var policy = FIXED_50MS.toBuilder().maxAttempts(5).build();

        var future = invoker.<Handle, String>invoke(policy, new Handle("h"), h -> {
            int n = calls.incrementAndGet();
            return CompletableFuture.completedFuture(
                    AttemptResult.failure(RpcStatusException.of(StatusCode.UNAVAILABLE, "try " + n), h));
        });

        assertThatThrownBy(future::join)
                .cause()
                .isInstanceOfSatisfying(RpcStatusException.class, e -> {
                    assertThat(e.code()).isEqualTo(StatusCode.UNAVAILABLE);
                    assertThat(e.description()).isEqualTo("try 5");
                });
        assertEquals(5, calls.get());
        assertThat(timer.delays()).hasSize(4); // 마지막 실패 뒤에는 대기하지 않음
    }

    @Test
    void max_attempts_one_never_retries() {
        AtomicInteger calls = new AtomicInteger();

        var future = invoker.<Handle, String>invoke(RetryPolicy.noRetry(), new Handle("h"), h -> {
            calls.incrementAndGet();
            return failed(StatusCode.UNAVAILABLE, h);
        });

        assertThatThrownBy(future::join).cause().isInstanceOf(RpcStatusException.class);
        assertEquals(1, calls.get());
    }

    @Test
    void exponential_policy_uses_zero_based_attempt_index_as_exponent() {
        var policy = RetryPolicy.builder()
                .initialDelay(Duration.ofMillis(10))
                .maxDelay(Duration.ofMillis(50))
                .backoffFactor(2)
                .maxAttempts(6)
                .build();

        var future = invoker.<Handle, String>invoke(policy, new Handle("h"), h -> failed(StatusCode.UNKNOWN, h));

        assertThatThrownBy(future::join).cause().isInstanceOf(RpcStatusException.class);
        assertThat(timer.delays()).containsExactly(
                Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofMillis(40),
                Duration.ofMillis(50), Duration.ofMillis(50));
    }

    @Test
    void handle_returned_with_failure_is_passed_to_next_attempt() {
        List<String> seen = Collections.synchronizedList(new ArrayList<>());

        String result = invoker.<Handle, String>invoke(FIXED_50MS, new Handle("first"), h -> {
            seen.add(h.id);
            if (seen.size() == 1) {
                // 재연결된 핸들을 돌려준다
                return CompletableFuture.completedFuture(AttemptResult.failure(
                        RpcStatusException.of(StatusCode.UNAVAILABLE, "reset"), new Handle("reconnected")));
            }
            return CompletableFuture.completedFuture(AttemptResult.success(h.id));
        }).join();

        assertEquals("reconnected", result);
        assertThat(seen).containsExactly("first", "reconnected");
    }

    @Test
    void null_policy_falls_back_to_defaults() {
        AtomicInteger calls = new AtomicInteger();

        var future = invoker.<Handle, String>invoke(null, new Handle("h"), h -> {
            calls.incrementAndGet();
            return failed(StatusCode.UNKNOWN, h);
        });

        assertThatThrownBy(future::join).cause().isInstanceOf(RpcStatusException.class);
        assertEquals(RetryPolicy.DEFAULT_MAX_ATTEMPTS, calls.get());
        assertThat(timer.delays()).hasSize(RetryPolicy.DEFAULT_MAX_ATTEMPTS - 1)
                .allMatch(d -> d.equals(RetryPolicy.DEFAULT_INITIAL_DELAY));
    }

    @Test
    void thrown_exception_and_plain_failed_future_are_classified_as_unknown() {
        AtomicInteger calls = new AtomicInteger();
        var policy = FIXED_50MS.toBuilder().retryableCodes(StatusCode.UNKNOWN).maxAttempts(3).build();

        String result = invoker.<Handle, String>invoke(policy, new Handle("h"), h -> {
            int n = calls.incrementAndGet();
            if (n == 1) throw new IllegalStateException("sync boom");
            if (n == 2) return CompletableFuture.failedFuture(new RuntimeException("async boom"));
            return CompletableFuture.completedFuture(AttemptResult.success("third"));
        }).join();

        assertEquals("third", result);
        assertEquals(3, calls.get());
    }

    @Test
    void system_timer_does_not_block_concurrent_invocations() {
        var real = new RetryInvoker(BackoffTimer.system());
        var slow = RetryPolicy.fixed(Duration.ofSeconds(2), 2);
        AtomicInteger slowCalls = new AtomicInteger();

        // 첫 호출은 2초 대기에 들어감
        var pending = real.<Handle, String>invoke(slow, new Handle("a"), h -> {
            if (slowCalls.incrementAndGet() == 1) return failed(StatusCode.UNAVAILABLE, h);
            return CompletableFuture.completedFuture(AttemptResult.success("slow"));
        });

        // 대기 중에도 다른 호출은 바로 끝난다
        String quick = real.<Handle, String>invoke(slow, new Handle("b"),
                h -> CompletableFuture.completedFuture(AttemptResult.success("quick")))
                .orTimeout(500, TimeUnit.MILLISECONDS)
                .join();

        assertEquals("quick", quick);
        assertThat(pending).isNotDone();
        await().atMost(Duration.ofSeconds(5)).until(pending::isDone);
        assertEquals("slow", pending.join());
    }

    @Test
    void cancelled_result_stops_further_attempts() throws Exception {
        var policy = RetryPolicy.fixed(Duration.ofMillis(200), 10);
        var real = new RetryInvoker(BackoffTimer.system());
        AtomicInteger calls = new AtomicInteger();

        var future = real.<Handle, String>invoke(policy, new Handle("h"), h -> {
            calls.incrementAndGet();
            return failed(StatusCode.UNAVAILABLE, h);
        });
        future.cancel(true);

        Thread.sleep(600); // 대기 3회분
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void long_run_of_synchronous_failures_with_zero_delay_completes_without_stack_growth() {
        var policy = RetryPolicy.builder()
                .initialDelay(Duration.ZERO)
                .maxDelay(Duration.ZERO)
                .maxAttempts(100_000)
                .retryableCodes(StatusCode.UNAVAILABLE)
                .build();
        var real = new RetryInvoker(BackoffTimer.system());
        AtomicInteger calls = new AtomicInteger();

        var future = real.<Handle, String>invoke(policy, new Handle("h"), h -> {
            calls.incrementAndGet();
            return failed(StatusCode.UNAVAILABLE, h);
        });

        assertThat(future).isDone();
        assertThatThrownBy(future::join)
                .cause()
                .isInstanceOfSatisfying(RpcStatusException.class,
                        e -> assertThat(e.code()).isEqualTo(StatusCode.UNAVAILABLE));
        assertEquals(100_000, calls.get());
    }

    @Test
    void timer_that_throws_fails_the_call_with_last_error() {
        var boom = new IllegalStateException("scheduler is shut down");
        var broken = new RetryInvoker(d -> { throw boom; });
        AtomicInteger calls = new AtomicInteger();

        var future = broken.<Handle, String>invoke(FIXED_50MS, new Handle("h"), h -> {
            calls.incrementAndGet();
            return failed(StatusCode.UNAVAILABLE, h);
        });

        assertThat(future).isDone();
        assertThatThrownBy(future::join)
                .cause()
                .isInstanceOfSatisfying(RpcStatusException.class, e -> {
                    assertThat(e.code()).isEqualTo(StatusCode.UNAVAILABLE);
                    assertThat(e.getSuppressed()).containsExactly(boom);
                });
        assertEquals(1, calls.get());
    }

    @Test
    void timer_failing_later_fails_the_call() {
        var wait = new CompletableFuture<Void>();
        var pending = new RetryInvoker(d -> wait);

        var future = pending.<Handle, String>invoke(FIXED_50MS, new Handle("h"), h -> failed(StatusCode.UNAVAILABLE, h));
        assertThat(future).isNotDone();

        wait.completeExceptionally(new IllegalStateException("rejected"));

        assertThat(future).isDone();
        assertThatThrownBy(future::join)
                .cause()
                .isInstanceOfSatisfying(RpcStatusException.class,
                        e -> assertThat(e.getSuppressed()).hasSize(1));
    }

    @Test
    void attempt_completing_with_null_result_is_treated_as_unknown() {
        var policy = FIXED_50MS.toBuilder().maxAttempts(2).build();
        AtomicInteger calls = new AtomicInteger();

        var future = invoker.<Handle, String>invoke(policy, new Handle("h"), h -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(null);
        });

        assertThat(future).isDone();
        assertThatThrownBy(future::join)
                .cause()
                .isInstanceOfSatisfying(RpcStatusException.class,
                        e -> assertThat(e.code()).isEqualTo(StatusCode.UNKNOWN));
        assertEquals(1, calls.get()); // UNKNOWN 은 이 정책에서 재시도 대상이 아님
    }

    @Test
    void asynchronous_failures_keep_retrying_until_success() {
        var real = new RetryInvoker(BackoffTimer.system());
        var policy = RetryPolicy.fixed(Duration.ofMillis(1), 10);
        AtomicInteger calls = new AtomicInteger();

        String result = real.<Handle, String>invoke(policy, new Handle("h"), h -> {
            int n = calls.incrementAndGet();
            return CompletableFuture.supplyAsync(() -> n < 4
                    ? AttemptResult.<String, Handle>failure(RpcStatusException.of(StatusCode.UNAVAILABLE, "x"), h)
                    : AttemptResult.<String, Handle>success("async"));
        }).orTimeout(5, TimeUnit.SECONDS).join();

        assertEquals("async", result);
        assertEquals(4, calls.get());
    }

    private static CompletableFuture<AttemptResult<String, Handle>> failed(StatusCode code, Handle h) {
        return CompletableFuture.completedFuture(AttemptResult.failure(RpcStatusException.of(code, code.name()), h));
    }
}
