package net.gpuwarden.core.spi;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

public interface WeeklyWindowCalculator {
    /** now 가 속한 주간 창의 시작 시각 */
    Instant windowStart(Instant now);

    /** 월요일 00:00 UTC 고정 */
    static WeeklyWindowCalculator mondayUtc() {
        return now -> now.atOffset(ZoneOffset.UTC)
                .truncatedTo(ChronoUnit.DAYS)
                .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
                .toInstant();
    }
}
