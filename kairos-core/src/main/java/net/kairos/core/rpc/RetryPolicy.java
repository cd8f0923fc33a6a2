package net.kairos.core.rpc;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * RPC 재시도 설정. 불변이며 호출마다 값으로 넘긴다.
 * <p>
 * 시도 i(0부터) 실패 후 대기 = min(maxDelay, initialDelay * backoffFactor^i).
 * backoffFactor 가 1 이면 항상 initialDelay (고정 간격 모드).
 */
public final class RetryPolicy {
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(50);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);
    public static final double DEFAULT_BACKOFF_FACTOR = 1.0;
    public static final int DEFAULT_MAX_ATTEMPTS = 20;

    private static final RetryPolicy DEFAULTS = builder().build();

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double backoffFactor;
    private final int maxAttempts;
    private final Set<StatusCode> retryableCodes;

    private RetryPolicy(Builder b) {
        this.initialDelay = b.initialDelay;
        this.maxDelay = b.maxDelay;
        this.backoffFactor = b.backoffFactor;
        this.maxAttempts = b.maxAttempts;
        this.retryableCodes = b.retryableCodes.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(b.retryableCodes));
    }

    /** 50ms 고정 간격, 최대 20회, UNAVAILABLE/UNKNOWN 재시도 */
    public static RetryPolicy defaults() {
        return DEFAULTS;
    }

    /** 고정 백오프 정책 */
    public static RetryPolicy fixed(Duration delay, int maxAttempts) {
        return builder().initialDelay(delay).maxDelay(delay).backoffFactor(1.0).maxAttempts(maxAttempts).build();
    }

    /** 재시도 없이 한 번만 시도 */
    public static RetryPolicy noRetry() {
        return builder().maxAttempts(1).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .initialDelay(initialDelay)
                .maxDelay(maxDelay)
                .backoffFactor(backoffFactor)
                .maxAttempts(maxAttempts)
                .retryableCodes(retryableCodes);
    }

    public Duration initialDelay() { return initialDelay; }

    public Duration maxDelay() { return maxDelay; }

    public double backoffFactor() { return backoffFactor; }

    public int maxAttempts() { return maxAttempts; }

    public Set<StatusCode> retryableCodes() { return retryableCodes; }

    public boolean isRetryable(StatusCode code) {
        return retryableCodes.contains(code);
    }

    /** attempt 번째(0부터) 시도가 실패한 뒤 다음 시도 전까지의 대기 */
    public Duration delayFor(int attempt) {
        if (attempt < 0) throw new IllegalArgumentException("attempt must be >= 0: " + attempt);
        if (backoffFactor == 1.0) {
            return initialDelay.compareTo(maxDelay) <= 0 ? initialDelay : maxDelay;
        }
        // 나노초 단위로 계산해 1ms 미만 값도 잘리지 않게 한다
        double raw = nanos(initialDelay) * Math.pow(backoffFactor, attempt);
        // pow 가 무한대로 가거나 long 범위를 넘으면 maxDelay 로 잘린다
        if (raw >= nanos(maxDelay) || raw >= Long.MAX_VALUE) {
            return maxDelay;
        }
        return Duration.ofNanos((long) raw);
    }

    private static double nanos(Duration d) {
        return d.getSeconds() * 1_000_000_000d + d.getNano();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RetryPolicy that)) return false;
        return Double.compare(that.backoffFactor, backoffFactor) == 0
                && maxAttempts == that.maxAttempts
                && initialDelay.equals(that.initialDelay)
                && maxDelay.equals(that.maxDelay)
                && retryableCodes.equals(that.retryableCodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(initialDelay, maxDelay, backoffFactor, maxAttempts, retryableCodes);
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
                "initialDelay=" + initialDelay +
                ", maxDelay=" + maxDelay +
                ", backoffFactor=" + backoffFactor +
                ", maxAttempts=" + maxAttempts +
                ", retryableCodes=" + retryableCodes +
                '}';
    }

    public static final class Builder {
        private Duration initialDelay = DEFAULT_INITIAL_DELAY;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private double backoffFactor = DEFAULT_BACKOFF_FACTOR;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Set<StatusCode> retryableCodes = Set.of(StatusCode.UNAVAILABLE, StatusCode.UNKNOWN);

        private Builder() {}

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
            return this;
        }

        public Builder backoffFactor(double backoffFactor) {
            this.backoffFactor = backoffFactor;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder retryableCodes(Set<StatusCode> retryableCodes) {
            this.retryableCodes = Set.copyOf(Objects.requireNonNull(retryableCodes, "retryableCodes"));
            return this;
        }

        public Builder retryableCodes(StatusCode... codes) {
            return retryableCodes(Set.of(codes));
        }

        public RetryPolicy build() {
            if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
            if (!(backoffFactor >= 1.0)) throw new IllegalArgumentException("backoffFactor must be >= 1: " + backoffFactor);
            if (initialDelay.isNegative()) throw new IllegalArgumentException("initialDelay must not be negative");
            if (maxDelay.isNegative()) throw new IllegalArgumentException("maxDelay must not be negative");
            return new RetryPolicy(this);
        }
    }
}
