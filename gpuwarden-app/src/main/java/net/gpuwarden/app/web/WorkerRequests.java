package net.gpuwarden.app.web;

/** HTTP 요청 바디 */
final class WorkerRequests {
    private WorkerRequests() {}

    record Define(String name, String provider, String accountId, String capabilities) {}

    record Register(String endpointUrl) {}

    /** runtimeSeconds: 원격이 잰 세션 경과 시간, 모르면 null */
    record Heartbeat(Long runtimeSeconds) {}

    record Health(boolean healthy, String error) {}

    record Start(String reason) {}

    record Stop(String reason) {}

    record ForceShutdown(String note) {}

    record Ensure(String provider, Long maxWaitSeconds, Long pollIntervalSeconds, String reason) {}
}
