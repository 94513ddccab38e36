package net.gpuwarden.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SessionTest {

    private static final Instant START = Instant.parse("2026-10-14T10:00:00Z");

    @Test
    void measuredDuration_isTheLargerOfReportedAndWallClock() {
        Session reportedAhead = session(Duration.ofMinutes(30).toMillis());
        Session reportedBehind = session(Duration.ofMinutes(5).toMillis());
        Instant now = START.plus(Duration.ofMinutes(10));

        assertThat(reportedAhead.measuredDurationMs(now)).isEqualTo(Duration.ofMinutes(30).toMillis());
        assertThat(reportedBehind.measuredDurationMs(now)).isEqualTo(Duration.ofMinutes(10).toMillis());
    }

    @Test
    void dueForShutdown_atDeadline_orWhenBudgetUsedUp() {
        Session s = session(0);
        assertThat(s.dueForShutdown(START.plus(Duration.ofMinutes(59)))).isFalse();
        assertThat(s.dueForShutdown(START.plus(Duration.ofHours(1)))).isTrue();
        assertThat(session(Duration.ofHours(1).toMillis()).dueForShutdown(START)).isTrue();
    }

    private static Session session(long durationMs) {
        return new Session(1L, 2L, Provider.KAGGLE, START, durationMs, Duration.ofHours(1).toMillis(),
                START.plus(Duration.ofHours(1)), true, null, null, START, START);
    }
}
