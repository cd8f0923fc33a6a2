package net.kairos.integration.spring;

import net.kairos.core.rpc.BackoffTimer;
import net.kairos.core.rpc.RetryInvoker;
import net.kairos.core.spi.ScheduleValidator;
import net.kairos.integration.spring.cron.CronUtilsScheduleValidator;
import net.kairos.integration.spring.sched.TaskSchedulerBackoffTimer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class KairosSpringConfig {

    // 재시도 대기 전용 스케줄러. 대기 중에는 스레드를 잡지 않으므로 작은 풀로 충분
    @Bean
    public ThreadPoolTaskScheduler kairosBackoffScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(2);
        s.setThreadNamePrefix("kairos-backoff-");
        s.setDaemon(true);
        s.setWaitForTasksToCompleteOnShutdown(false);
        return s;
    }

    @Bean
    public BackoffTimer backoffTimer(ThreadPoolTaskScheduler kairosBackoffScheduler) {
        return new TaskSchedulerBackoffTimer(kairosBackoffScheduler);
    }

    @Bean
    public RetryInvoker retryInvoker(BackoffTimer backoffTimer) {
        return new RetryInvoker(backoffTimer);
    }

    @Bean
    public ScheduleValidator scheduleValidator() {
        return new CronUtilsScheduleValidator();
    }
}
