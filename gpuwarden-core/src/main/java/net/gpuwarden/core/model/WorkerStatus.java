package net.gpuwarden.core.model;

/**
 * offline → starting → pending → online → offline.
 * starting → offline (예약 해제), {pending, online, unhealthy} → offline (정지/워치독/하트비트 타임아웃).
 */
public enum WorkerStatus {
    OFFLINE, STARTING, PENDING, ONLINE, UNHEALTHY;

    public static WorkerStatus from(String s) { return WorkerStatus.valueOf(s); }

    public String code() { return name(); }

    /** 원격 자원이 떠 있다고 간주하는 상태 (쿼터 계산상 online 취급) */
    public boolean isLive() {
        return this == PENDING || this == ONLINE || this == UNHEALTHY;
    }

    /** 재사용 후보: unhealthy 는 제외 */
    public boolean isReusable() { return this == ONLINE; }
}
