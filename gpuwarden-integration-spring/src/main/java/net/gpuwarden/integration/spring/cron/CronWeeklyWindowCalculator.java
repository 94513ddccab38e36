package net.gpuwarden.integration.spring.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import net.gpuwarden.core.spi.WeeklyWindowCalculator;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * cron-utils 기반 주간 창 계산.
 * 창 시작 = now 이하의 가장 최근 cron 실행 시각 (Quartz 문법).
 */
public final class CronWeeklyWindowCalculator implements WeeklyWindowCalculator {
    /** 월요일 00:00 */
    public static final String DEFAULT_RESET_CRON = "0 0 0 ? * MON";

    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.QUARTZ));

    private final String cronExpr;
    private final ZoneId zone;
    private final ExecutionTime executionTime;

    public CronWeeklyWindowCalculator(String cronExpr, ZoneId zone) {
        this.cronExpr = Objects.requireNonNull(cronExpr);
        this.zone = Objects.requireNonNull(zone);
        this.executionTime = ExecutionTime.forCron(PARSER.parse(cronExpr));
    }

    public static CronWeeklyWindowCalculator mondayUtc() {
        return new CronWeeklyWindowCalculator(DEFAULT_RESET_CRON, ZoneId.of("UTC"));
    }

    @Override
    public Instant windowStart(Instant now) {
        Objects.requireNonNull(now);
        ZonedDateTime base = now.atZone(zone);
        ZonedDateTime next = executionTime.nextExecution(base).orElseThrow(
                () -> new IllegalStateException("No next execution for [" + cronExpr + "] at " + base));
        // now 가 실행 시각과 정확히 같으면 next 는 그 다음 회차이므로 last(next) == now
        ZonedDateTime start = executionTime.lastExecution(next).orElseThrow(
                () -> new IllegalStateException("No last execution for [" + cronExpr + "] at " + base));
        return start.toInstant();
    }

    public String cronExpr() { return cronExpr; }

    @Override
    public String toString() { return "CronWeeklyWindowCalculator[" + cronExpr + " " + zone + "]"; }
}
