package net.kairos.adapter.grpc;

import io.grpc.Channel;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 같은 엔드포인트로 연결된 채널 N개. 호출마다 라운드로빈으로 하나를 고른다.
 * 각 채널은 gRPC 가 동시 호출을 보장하므로 별도 락은 두지 않는다.
 */
public final class ChannelPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ChannelPool.class);

    private final List<ManagedChannel> channels;
    private final AtomicInteger cursor = new AtomicInteger();
    private final ConnectionOptions options;

    private ChannelPool(List<ManagedChannel> channels, ConnectionOptions options) {
        if (channels.isEmpty()) throw new IllegalArgumentException("channel pool must not be empty");
        this.channels = List.copyOf(channels);
        this.options = options;
    }

    /** endpoint 로 poolSize 개의 채널을 연다 (poolSize 가 1 미만이면 1) */
    public static ChannelPool connect(String endpoint, int poolSize, ConnectionOptions options) {
        Objects.requireNonNull(endpoint, "endpoint");
        ConnectionOptions opts = options == null ? ConnectionOptions.defaults() : options;
        String target = normalizeTarget(endpoint);
        int size = Math.max(1, poolSize);

        List<ManagedChannel> list = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            list.add(build(target, opts));
        }
        log.info("Opened {} channel(s) to {} (plaintext={})", size, target, opts.plaintext());
        return new ChannelPool(list, opts);
    }

    /** 이미 만든 채널로 풀 구성 (in-process 테스트 등) */
    public static ChannelPool of(List<ManagedChannel> channels) {
        return new ChannelPool(channels, ConnectionOptions.defaults());
    }

    /**
     * "https://host" → "host:443", "http://host" → "host:80", 그 외는 그대로.
     * gRPC target 에는 http(s) 스킴 resolver 가 없다.
     */
    static String normalizeTarget(String endpoint) {
        String e = endpoint.trim();
        int defaultPort;
        if (e.startsWith("https://")) {
            e = e.substring("https://".length());
            defaultPort = 443;
        } else if (e.startsWith("http://")) {
            e = e.substring("http://".length());
            defaultPort = 80;
        } else {
            return e;
        }
        if (e.endsWith("/")) e = e.substring(0, e.length() - 1);
        return e.contains(":") ? e : e + ":" + defaultPort;
    }

    private static ManagedChannel build(String target, ConnectionOptions opts) {
        ManagedChannelBuilder<?> b = ManagedChannelBuilder.forTarget(target);
        if (opts.plaintext()) b.usePlaintext(); else b.useTransportSecurity();
        b.maxInboundMessageSize(opts.maxInboundMessageSize());
        if (opts.keepAliveTime() != null) b.keepAliveTime(opts.keepAliveTime().toMillis(), TimeUnit.MILLISECONDS);
        if (opts.idleTimeout() != null) b.idleTimeout(opts.idleTimeout().toMillis(), TimeUnit.MILLISECONDS);
        if (opts.userAgent() != null && !opts.userAgent().isBlank()) b.userAgent(opts.userAgent());
        return b.build();
    }

    public Channel next() {
        int i = Math.floorMod(cursor.getAndIncrement(), channels.size());
        return channels.get(i);
    }

    public int size() {
        return channels.size();
    }

    public boolean isShutdown() {
        return channels.stream().allMatch(ManagedChannel::isShutdown);
    }

    @Override
    public void close() throws InterruptedException {
        for (ManagedChannel c : channels) c.shutdown();
        long deadline = System.nanoTime() + options.shutdownTimeout().toNanos();
        for (ManagedChannel c : channels) {
            long left = deadline - System.nanoTime();
            if (left <= 0 || !c.awaitTermination(left, TimeUnit.NANOSECONDS)) {
                log.warn("Channel did not terminate in {}, forcing shutdown", options.shutdownTimeout());
                c.shutdownNow();
            }
        }
    }
}
