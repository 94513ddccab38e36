package net.gpuwarden.core.model;

public record StartResult(boolean success,
                          long workerId,
                          Long sessionId,
                          String endpointUrl,
                          StartFailure failure,
                          String message) {

    public static StartResult started(long workerId, long sessionId, String endpointUrl) {
        return new StartResult(true, workerId, sessionId, endpointUrl, null, null);
    }

    public static StartResult failed(long workerId, StartFailure failure, String message) {
        return new StartResult(false, workerId, null, null, failure, message);
    }

    /** 실패 코드 (예: "QuotaExceeded"), 성공이면 null */
    public String reason() { return failure == null ? null : failure.code(); }
}
