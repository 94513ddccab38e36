package net.gpuwarden.core.model;

/** 프로바이더 쿼터 계열 */
public enum QuotaFamily {
    /** 주간 사용량 상한, 계정 단위 동시 실행 제한 */
    USAGE_METERED,
    /** 주간 상한 없음, 세션 종료 후 강제 휴지기 */
    COOLDOWN_METERED
}
