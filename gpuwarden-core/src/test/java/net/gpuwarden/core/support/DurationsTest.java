package net.gpuwarden.core.support;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class DurationsTest {

    @Test
    void human_formatsDurations() {
        assertThat(Durations.human(Duration.ofMinutes(504))).isEqualTo("8h 24m");
        assertThat(Durations.human(Duration.ofSeconds(185))).isEqualTo("3m 5s");
        assertThat(Durations.human(Duration.ofSeconds(-3))).isEqualTo("0s");
        assertThat(Durations.human(null)).isEqualTo("-");
    }
}
