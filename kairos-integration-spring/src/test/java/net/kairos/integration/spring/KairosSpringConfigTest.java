package net.kairos.integration.spring;

import net.kairos.core.rpc.BackoffTimer;
import net.kairos.core.rpc.RetryInvoker;
import net.kairos.core.spi.ScheduleValidator;
import net.kairos.integration.spring.cron.CronUtilsScheduleValidator;
import net.kairos.integration.spring.sched.TaskSchedulerBackoffTimer;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import static org.assertj.core.api.Assertions.*;

class KairosSpringConfigTest {

    @Test
    void registers_retry_infrastructure() {
        try (var ctx = new AnnotationConfigApplicationContext(KairosSpringConfig.class)) {
            assertThat(ctx.getBean(BackoffTimer.class)).isInstanceOf(TaskSchedulerBackoffTimer.class);
            assertThat(ctx.getBean(ScheduleValidator.class)).isInstanceOf(CronUtilsScheduleValidator.class);
            assertThat(ctx.getBean(RetryInvoker.class)).isNotNull();
        }
    }
}
