package net.kairos.core.spi;

import java.util.Optional;

/** Job 스케줄(cron) 과 time zone 을 호출 전에 검사 */
@FunctionalInterface
public interface ScheduleValidator {
    /** 문제가 없으면 empty, 있으면 사유 */
    Optional<String> validate(String schedule, String timeZone);

    static ScheduleValidator noop() {
        return (schedule, timeZone) -> Optional.empty();
    }
}
