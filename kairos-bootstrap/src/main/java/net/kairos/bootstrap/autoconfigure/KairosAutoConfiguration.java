package net.kairos.bootstrap.autoconfigure;

import net.kairos.adapter.grpc.ChannelPool;
import net.kairos.adapter.grpc.ConnectionOptions;
import net.kairos.adapter.grpc.GrpcSchedulerStub;
import net.kairos.bootstrap.catalog.CatalogRegistrar;
import net.kairos.bootstrap.props.KairosProperties;
import net.kairos.core.rpc.RetryInvoker;
import net.kairos.core.rpc.RetryPolicy;
import net.kairos.core.rpc.StatusCode;
import net.kairos.core.service.SchedulerClient;
import net.kairos.core.spi.*;
import net.kairos.integration.spring.KairosSpringConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.core.annotation.Order;

import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

@AutoConfiguration
@EnableConfigurationProperties(KairosProperties.class)
@Import(KairosSpringConfig.class) // integration-spring: backoff timer / invoker / cron validator
public class KairosAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(KairosAutoConfiguration.class);

    // --- 연결 ---

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "kairos.auth", name = "token")
    public TokenSource tokenSource(KairosProperties props) {
        return TokenSource.fixed(props.getAuth().getToken());
    }

    @Bean
    @ConditionalOnMissingBean
    public ChannelPool kairosChannelPool(KairosProperties props) {
        return ChannelPool.connect(props.getEndpoint(), props.getPoolSize(), connectionOptions(props));
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerStub schedulerStub(ChannelPool pool,
                                       ObjectProvider<TokenSource> tokens,
                                       KairosProperties props) {
        return new GrpcSchedulerStub(pool, tokens.getIfAvailable(), props.getAudience(), connectionOptions(props));
    }

    @Bean
    @ConditionalOnMissingBean
    public OperationsClient operationsClient() {
        return OperationsClient.unsupported();
    }

    // --- 클라이언트 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public SchedulerClient schedulerClient(SchedulerStub stub,
                                           OperationsClient operations,
                                           RetryInvoker invoker,
                                           ScheduleValidator validator,
                                           KairosProperties props) {
        RetryPolicy policy = retryPolicy(props.getRetry());
        log.info("Scheduler client: endpoint={} pool={} retry={}", props.getEndpoint(), props.getPoolSize(), policy);
        return new SchedulerClient(stub, operations, invoker, policy, validator);
    }

    @Bean
    @ConditionalOnMissingBean
    public CatalogRegistrar catalogRegistrar(SchedulerClient client) {
        return new CatalogRegistrar(client);
    }

    @Bean
    @Order(0) // 다른 ApplicationRunner 보다 먼저 Job 을 맞춘다
    @ConditionalOnProperty(prefix = "kairos.catalog", name = "enabled", havingValue = "true")
    public ApplicationRunner kairosCatalogRunner(CatalogRegistrar registrar, KairosProperties props) {
        log.info("Catalog runner: parent={} jobs=\n{}", props.getCatalog().getParent(),
                props.getCatalog().getJobs().stream()
                        .map(KairosProperties.JobDef::toString)
                        .collect(Collectors.joining("\n")));
        return args -> registrar.register(props.getCatalog());
    }

    // --- 프로퍼티 변환 ---

    static ConnectionOptions connectionOptions(KairosProperties props) {
        KairosProperties.Connection c = props.getConnection();
        return new ConnectionOptions(
                c.isPlaintext(),
                c.getCallTimeout(),
                c.getKeepAliveTime(),
                c.getIdleTimeout(),
                c.getMaxInboundMessageSize(),
                c.getUserAgent(),
                null);
    }

    /** 잘못된 값은 기동 시 IllegalArgumentException */
    static RetryPolicy retryPolicy(KairosProperties.Retry r) {
        Set<StatusCode> codes = EnumSet.noneOf(StatusCode.class);
        for (String s : r.getRetryableCodes()) codes.add(StatusCode.from(s));
        return RetryPolicy.builder()
                .initialDelay(r.getInitialDelay())
                .maxDelay(r.getMaxDelay())
                .backoffFactor(r.getBackoffFactor())
                .maxAttempts(r.getMaxAttempts())
                .retryableCodes(codes)
                .build();
    }
}
