package net.kairos.integration.spring.cron;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.parser.CronParser;
import net.kairos.core.spi.ScheduleValidator;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** unix-cron(5필드) + tz database id 검증. 원격 서비스와 같은 문법 */
public final class CronUtilsScheduleValidator implements ScheduleValidator {
    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    // 파싱 성공한 식만 담는 LRU(최대 256개)
    private static final Map<String, Cron> CACHE = new LruMap<>(256);

    @Override
    public Optional<String> validate(String schedule, String timeZone) {
        if (timeZone != null && !timeZone.isBlank()) {
            try {
                ZoneId.of(timeZone);
            } catch (DateTimeException e) {
                return Optional.of("unknown time zone '" + timeZone + "'");
            }
        }
        if (schedule == null || schedule.isBlank()) return Optional.empty();

        String expr = schedule.trim();
        synchronized (CACHE) {
            if (CACHE.containsKey(expr)) return Optional.empty();
        }
        try {
            Cron cron = PARSER.parse(expr).validate();
            synchronized (CACHE) { CACHE.put(expr, cron); }
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            return Optional.of(e.getMessage() == null ? "invalid cron expression" : e.getMessage());
        }
    }

    static int cachedCount() { synchronized (CACHE) { return CACHE.size(); } }
    static void invalidateAll() { synchronized (CACHE) { CACHE.clear(); } }

    // --- 내부 LRU ---
    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K, V> eldest) { return size() > max; }
    }
}
