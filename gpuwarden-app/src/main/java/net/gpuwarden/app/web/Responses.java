package net.gpuwarden.app.web;

import net.gpuwarden.core.maintenance.WatchdogStatus;
import net.gpuwarden.core.model.EnsureResult;
import net.gpuwarden.core.model.HeartbeatAck;
import net.gpuwarden.core.model.StartResult;
import net.gpuwarden.core.model.StopResult;
import net.gpuwarden.core.model.Worker;
import net.gpuwarden.core.model.WorkerStatusView;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 응답 바디 변환. 시간은 ISO-8601, 기간은 초 단위 정수.
 * null 값이 섞이므로 Map.of 대신 LinkedHashMap 을 쓴다.
 */
final class Responses {
    private Responses() {}

    static Map<String, Object> worker(Worker w) {
        Map<String, Object> m = ok();
        m.put("workerId", w.id());
        m.put("name", w.name());
        m.put("provider", w.provider().code());
        m.put("workerStatus", w.status().code());
        m.put("accountId", w.accountId());
        m.put("capabilities", w.capabilities());
        return m;
    }

    static Map<String, Object> ack(long workerId, HeartbeatAck ack) {
        Map<String, Object> m = ok();
        m.put("workerId", workerId);
        m.put("accepted", ack.accepted());
        m.put("workerStatus", ack.status().code());
        m.put("shouldShutdown", ack.shouldShutdown());
        return m;
    }

    static Map<String, Object> start(StartResult r) {
        Map<String, Object> m = r.success() ? ok() : error(r.reason(), r.message());
        m.put("workerId", r.workerId());
        m.put("sessionId", r.sessionId());
        m.put("endpointUrl", r.endpointUrl());
        return m;
    }

    static Map<String, Object> stop(StopResult r) {
        Map<String, Object> m = ok();
        m.put("workerId", r.workerId());
        m.put("sessionId", r.sessionId());
        m.put("closed", r.closed());
        m.put("reason", r.reason() == null ? null : r.reason().code());
        m.put("measuredSeconds", r.measuredSeconds());
        m.put("chargedSeconds", r.chargedSeconds());
        m.put("weeklyUsageSeconds", r.weeklyUsageSeconds());
        m.put("cooldownUntil", iso(r.cooldownUntil()));
        return m;
    }

    static Map<String, Object> ensure(EnsureResult r) {
        Map<String, Object> m = r.available() ? ok() : error("Unavailable", r.reason());
        m.put("available", r.available());
        m.put("workerId", r.workerId());
        m.put("endpointUrl", r.endpointUrl());
        m.put("startedNew", r.startedNew());
        return m;
    }

    static Map<String, Object> status(WorkerStatusView v) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("workerId", v.workerId());
        m.put("name", v.name());
        m.put("provider", v.provider().code());
        m.put("workerStatus", v.status().code());
        m.put("quotaUsedSeconds", seconds(v.quotaUsed()));
        m.put("quotaRemainingSeconds", seconds(v.quotaRemaining()));
        m.put("quotaLevel", v.quotaLevel() == null ? null : v.quotaLevel().name());
        m.put("sessionRuntimeSeconds", seconds(v.sessionRuntime()));
        m.put("cooldownRemainingSeconds", seconds(v.cooldownRemaining()));
        m.put("autoShutdownAt", iso(v.autoShutdownAt()));
        m.put("lastHeartbeatAt", iso(v.lastHeartbeatAt()));
        return m;
    }

    static Map<String, Object> watchdog(WatchdogStatus s) {
        Map<String, Object> m = ok();
        m.put("recovered", s.recovered());
        m.put("lastCheckAt", iso(s.lastCheckAt()));
        m.put("shutdownsPerformed", s.shutdownsPerformed());
        m.put("activeSessions", s.activeSessions());
        return m;
    }

    static Map<String, Object> error(String reason, String message) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("status", "error");
        m.put("reason", reason);
        m.put("message", message);
        m.put("ts", Instant.now().toString());
        return m;
    }

    private static Map<String, Object> ok() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("status", "ok");
        m.put("ts", Instant.now().toString());
        return m;
    }

    private static Long seconds(Duration d) { return d == null ? null : d.toSeconds(); }

    private static String iso(Instant t) { return t == null ? null : t.toString(); }
}
