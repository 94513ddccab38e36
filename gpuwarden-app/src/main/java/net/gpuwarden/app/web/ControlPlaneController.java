package net.gpuwarden.app.web;

import net.gpuwarden.core.maintenance.Watchdog;
import net.gpuwarden.core.maintenance.WatchdogStatus;
import net.gpuwarden.core.model.AvailabilityPreferences;
import net.gpuwarden.core.model.EnsureResult;
import net.gpuwarden.core.model.Provider;
import net.gpuwarden.core.model.ShutdownReason;
import net.gpuwarden.core.model.StartFailure;
import net.gpuwarden.core.model.StartResult;
import net.gpuwarden.core.model.StopResult;
import net.gpuwarden.core.model.WorkerStatusView;
import net.gpuwarden.core.service.ReservationCoordinator;
import net.gpuwarden.core.service.WorkerAvailabilityService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * 작업 측(소비자)과 운영자가 쓰는 엔드포인트.
 * 기동 실패는 예외가 아니라 409 + 실패 코드로 돌려준다.
 */
@RestController
@RequestMapping("/api/gpu")
public class ControlPlaneController {

    private static final Logger log = LoggerFactory.getLogger(ControlPlaneController.class);

    private final WorkerAvailabilityService availability;
    private final ReservationCoordinator coordinator;
    private final Watchdog watchdog;

    public ControlPlaneController(WorkerAvailabilityService availability,
                                  ReservationCoordinator coordinator,
                                  Watchdog watchdog) {
        this.availability = availability;
        this.coordinator = coordinator;
        this.watchdog = watchdog;
    }

    @PostMapping("/ensure")
    public ResponseEntity<Map<String, Object>> ensure(@RequestBody(required = false) WorkerRequests.Ensure req) throws Exception {
        AvailabilityPreferences prefs = req == null ? AvailabilityPreferences.any() : new AvailabilityPreferences(
                req.provider() == null || req.provider().isBlank() ? null : Provider.from(req.provider()),
                req.maxWaitSeconds() == null ? null : Duration.ofSeconds(req.maxWaitSeconds()),
                req.pollIntervalSeconds() == null ? null : Duration.ofSeconds(req.pollIntervalSeconds()),
                req.reason());
        EnsureResult r = availability.ensureAvailable(prefs);
        log.info("[GPU_HTTP] action=ENSURE provider={} available={} worker={} startedNew={}",
                prefs.provider(), r.available(), r.workerId(), r.startedNew());
        return ResponseEntity.status(r.available() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(Responses.ensure(r));
    }

    @GetMapping("/workers")
    public ResponseEntity<List<Map<String, Object>>> list() throws Exception {
        return ResponseEntity.ok(availability.listStatus().stream().map(Responses::status).toList());
    }

    @GetMapping("/workers/{id}")
    public ResponseEntity<Map<String, Object>> status(@PathVariable("id") long id) throws Exception {
        WorkerStatusView v = availability.getStatus(id);
        return ResponseEntity.ok(Responses.status(v));
    }

    @PostMapping("/workers/{id}/start")
    public ResponseEntity<Map<String, Object>> start(@PathVariable("id") long id,
                                                     @RequestBody(required = false) WorkerRequests.Start req) throws Exception {
        String reason = req == null || req.reason() == null ? "manual" : req.reason();
        StartResult r = coordinator.startSession(id, reason);
        log.info("[GPU_HTTP] action=START worker={} success={} failure={}", id, r.success(), r.reason());
        HttpStatus code = r.success() ? HttpStatus.OK
                : r.failure() == StartFailure.WORKER_NOT_FOUND ? HttpStatus.NOT_FOUND
                : HttpStatus.CONFLICT;
        return ResponseEntity.status(code).body(Responses.start(r));
    }

    @PostMapping("/workers/{id}/stop")
    public ResponseEntity<Map<String, Object>> stop(@PathVariable("id") long id,
                                                    @RequestBody(required = false) WorkerRequests.Stop req) throws Exception {
        ShutdownReason reason = req == null || req.reason() == null
                ? ShutdownReason.ADMIN_OVERRIDE
                : ShutdownReason.from(req.reason());
        // 원격에도 종료를 알린 뒤 닫는다
        StopResult r = watchdog.shutdown(id, reason, "stop requested over http");
        log.info("[GPU_HTTP] action=STOP worker={} reason={} closed={}", id, reason.code(), r.closed());
        return ResponseEntity.ok(Responses.stop(r));
    }

    @PostMapping("/workers/{id}/force-shutdown")
    public ResponseEntity<Map<String, Object>> forceShutdown(@PathVariable("id") long id,
                                                             @RequestBody(required = false) WorkerRequests.ForceShutdown req) throws Exception {
        String note = req == null || req.note() == null ? "operator request" : req.note();
        StopResult r = watchdog.forceShutdown(id, note);
        log.warn("[GPU_HTTP] action=FORCE_SHUTDOWN worker={} closed={} note={}", id, r.closed(), note);
        return ResponseEntity.ok(Responses.stop(r));
    }

    @DeleteMapping("/workers/{id}/reservation")
    public ResponseEntity<Map<String, Object>> release(@PathVariable("id") long id,
                                                       @RequestParam("token") String token) throws Exception {
        boolean released = coordinator.releaseReservation(id, token, "released by operator");
        return ResponseEntity.ok(Map.of("status", "ok", "workerId", id, "released", released));
    }

    @GetMapping("/watchdog")
    public ResponseEntity<Map<String, Object>> watchdogStatus() throws Exception {
        WatchdogStatus s = watchdog.status();
        return ResponseEntity.ok(Responses.watchdog(s));
    }
}
