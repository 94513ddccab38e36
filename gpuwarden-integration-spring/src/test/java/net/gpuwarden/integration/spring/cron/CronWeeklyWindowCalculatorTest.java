package net.gpuwarden.integration.spring.cron;

import net.gpuwarden.core.spi.WeeklyWindowCalculator;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronWeeklyWindowCalculatorTest {

    private final CronWeeklyWindowCalculator monday = CronWeeklyWindowCalculator.mondayUtc();

    @Test
    void midWeek_mapsToThePreviousMonday() {
        assertThat(monday.windowStart(Instant.parse("2026-10-14T10:00:00Z")))
                .isEqualTo(Instant.parse("2026-10-12T00:00:00Z"));
    }

    @Test
    void exactlyAtReset_startsTheNewWindow() {
        assertThat(monday.windowStart(Instant.parse("2026-10-19T00:00:00Z")))
                .isEqualTo(Instant.parse("2026-10-19T00:00:00Z"));
        assertThat(monday.windowStart(Instant.parse("2026-10-18T23:59:59Z")))
                .isEqualTo(Instant.parse("2026-10-12T00:00:00Z"));
    }

    @Test
    void agreesWithTheFixedMondayCalculator() {
        WeeklyWindowCalculator fixed = WeeklyWindowCalculator.mondayUtc();
        Instant t = Instant.parse("2026-01-01T00:00:00Z");
        for (int i = 0; i < 60; i++) {
            assertThat(monday.windowStart(t)).as("at %s", t).isEqualTo(fixed.windowStart(t));
            t = t.plusSeconds(37 * 3600 + 11);
        }
    }

    @Test
    void customScheduleAndZone() {
        // 일요일 09:00 서울 = 토요일 00:00 UTC
        var sundaySeoul = new CronWeeklyWindowCalculator("0 0 9 ? * SUN", ZoneId.of("Asia/Seoul"));

        assertThat(sundaySeoul.windowStart(Instant.parse("2026-10-14T10:00:00Z")))
                .isEqualTo(Instant.parse("2026-10-11T00:00:00Z"));
    }

    @Test
    void invalidExpression_isRejected() {
        assertThatThrownBy(() -> new CronWeeklyWindowCalculator("every monday", ZoneId.of("UTC")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
