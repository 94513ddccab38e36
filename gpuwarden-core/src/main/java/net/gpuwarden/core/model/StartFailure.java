package net.gpuwarden.core.model;

/** 예약/기동 실패 분류. 호출자에게는 예외가 아닌 결과로 전달된다. */
public enum StartFailure {
    QUOTA_EXCEEDED("QuotaExceeded"),
    COOLDOWN_ACTIVE("CooldownActive"),
    CONCURRENT_SESSION_CONFLICT("ConcurrentSessionConflict"),
    RESERVATION_TOKEN_MISMATCH("ReservationTokenMismatch"),
    PROVISIONING_FAILED("ProvisioningFailed"),
    NOT_CONFIGURED("NotConfigured"),
    WORKER_NOT_FOUND("WorkerNotFound");

    private final String code;

    StartFailure(String code) { this.code = code; }

    public String code() { return code; }
}
