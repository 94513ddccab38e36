package net.gpuwarden.core.quota;

public enum QuotaLevel {
    OK, WARNING, CRITICAL, EXCEEDED;

    static final double WARNING_RATIO = 0.80;
    static final double CRITICAL_RATIO = 0.95;

    /** used / limit 비율로 단계 판정. limit <= 0 이면 판정 불가로 OK. */
    public static QuotaLevel of(long used, long limit) {
        if (limit <= 0) return OK;
        if (used >= limit) return EXCEEDED;
        double ratio = (double) used / limit;
        if (ratio >= CRITICAL_RATIO) return CRITICAL;
        if (ratio >= WARNING_RATIO) return WARNING;
        return OK;
    }
}
