package net.gpuwarden.app.web;

import net.gpuwarden.core.model.HeartbeatAck;
import net.gpuwarden.core.model.NewWorker;
import net.gpuwarden.core.model.Provider;
import net.gpuwarden.core.model.StopResult;
import net.gpuwarden.core.model.Worker;
import net.gpuwarden.core.service.WorkerRegistrationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Map;

/**
 * 원격 워커가 호출하는 엔드포인트: 등록, 하트비트, 자기 정지 보고.
 */
@RestController
@RequestMapping("/api/gpu/workers")
public class WorkerController {

    private static final Logger log = LoggerFactory.getLogger(WorkerController.class);

    private final WorkerRegistrationService registration;

    public WorkerController(WorkerRegistrationService registration) {
        this.registration = registration;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> define(@RequestBody WorkerRequests.Define req) throws Exception {
        if (req == null) throw new IllegalArgumentException("worker definition is required");
        Worker w = registration.createOrUpdate(
                new NewWorker(req.name(), Provider.from(req.provider()), req.accountId(), req.capabilities()));
        log.info("[GPU_HTTP] action=DEFINE worker={} name={} provider={}", w.id(), w.name(), w.provider());
        return ResponseEntity.ok(Responses.worker(w));
    }

    @PostMapping("/{id}/register")
    public ResponseEntity<Map<String, Object>> register(@PathVariable("id") long id,
                                                        @RequestBody(required = false) WorkerRequests.Register req) throws Exception {
        HeartbeatAck ack = registration.register(id, req == null ? null : req.endpointUrl());
        return ResponseEntity.ok(Responses.ack(id, ack));
    }

    @PostMapping("/{id}/heartbeat")
    public ResponseEntity<Map<String, Object>> heartbeat(@PathVariable("id") long id,
                                                         @RequestBody(required = false) WorkerRequests.Heartbeat req) throws Exception {
        Duration runtime = req == null || req.runtimeSeconds() == null ? null : Duration.ofSeconds(req.runtimeSeconds());
        HeartbeatAck ack = registration.heartbeat(id, runtime);
        return ResponseEntity.ok(Responses.ack(id, ack));
    }

    @PostMapping("/{id}/shutdown")
    public ResponseEntity<Map<String, Object>> reportShutdown(@PathVariable("id") long id) throws Exception {
        StopResult r = registration.reportShutdown(id);
        log.info("[GPU_HTTP] action=SELF_SHUTDOWN worker={} closed={}", id, r.closed());
        return ResponseEntity.ok(Responses.stop(r));
    }

    @PostMapping("/{id}/health")
    public ResponseEntity<Map<String, Object>> health(@PathVariable("id") long id,
                                                      @RequestBody WorkerRequests.Health req) throws Exception {
        if (req.healthy()) registration.markHealthy(id);
        else registration.markUnhealthy(id, req.error() == null ? "unhealthy" : req.error());
        return ResponseEntity.ok(Map.of("status", "ok", "workerId", id, "healthy", req.healthy()));
    }
}
