package net.gpuwarden.core.support;

import java.time.Duration;

public final class Durations {
    private Durations() {}

    /** 사람이 읽는 형태: 8h 24m, 3m 5s, 0s */
    public static String human(Duration d) {
        if (d == null) return "-";
        if (d.isNegative()) d = Duration.ZERO;
        long h = d.toHours();
        int m = d.toMinutesPart();
        int s = d.toSecondsPart();
        if (h > 0) return h + "h " + m + "m";
        if (m > 0) return m + "m " + s + "s";
        return s + "s";
    }

    public static Duration min(Duration a, Duration b) { return a.compareTo(b) <= 0 ? a : b; }

    public static Duration positiveOrZero(Duration d) { return d.isNegative() ? Duration.ZERO : d; }
}
