package net.gpuwarden.app.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.gpuwarden.core.model.ProvisionResult;
import net.gpuwarden.core.spi.Provisioner;
import net.gpuwarden.core.spi.RemoteShutdownNotifier;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:ControlPlaneApiTest;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000",
        "gpuwarden.scheduler.enabled=false",
        "gpuwarden.notifier.enabled=false",
        "gpuwarden.catalog.workers[0].name=kaggle-api",
        "gpuwarden.catalog.workers[0].provider=KAGGLE",
        "gpuwarden.catalog.workers[0].account-id=acct-api",
        "gpuwarden.catalog.workers[1].name=colab-api",
        "gpuwarden.catalog.workers[1].provider=COLAB",
        "gpuwarden.catalog.workers[1].account-id=acct-api",
        "gpuwarden.catalog.workers[2].name=kaggle-nocred",
        "gpuwarden.catalog.workers[2].provider=KAGGLE",
        "gpuwarden.catalog.workers[2].account-id=acct-missing",
        "gpuwarden.credentials.accounts.acct-api.token=t0k3n"
})
@AutoConfigureMockMvc
class ControlPlaneApiTest {

    static final List<Long> notifiedWorkers = new CopyOnWriteArrayList<>();

    @TestConfiguration
    static class LaunchEverything {
        @Bean
        RemoteShutdownNotifier recordingNotifier() {
            return w -> notifiedWorkers.add(w.id());
        }

        @Bean
        Provisioner provisioner() {
            return req -> ProvisionResult.launched(
                    "http://" + req.worker().name() + ".internal:8000", "kernel-" + req.worker().id());
        }
    }

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper mapper;

    @Test
    void kaggleSession_startRegisterHeartbeatReuseStop() throws Exception {
        long id = workerId("kaggle-api");

        mvc.perform(post("/api/gpu/workers/{id}/start", id).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"api test\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.endpointUrl").value("http://kaggle-api.internal:8000"));

        mvc.perform(get("/api/gpu/workers/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.workerStatus").value("PENDING"))
                .andExpect(jsonPath("$.autoShutdownAt").isNotEmpty());

        mvc.perform(post("/api/gpu/workers/{id}/register", id).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"endpointUrl\":\"https://kaggle-api.tunnel.example\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(true))
                .andExpect(jsonPath("$.workerStatus").value("ONLINE"));

        mvc.perform(post("/api/gpu/workers/{id}/heartbeat", id).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"runtimeSeconds\":60}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.shouldShutdown").value(false));

        mvc.perform(post("/api/gpu/ensure").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"provider\":\"kaggle\",\"maxWaitSeconds\":1}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.available").value(true))
                .andExpect(jsonPath("$.startedNew").value(false))
                .andExpect(jsonPath("$.workerId").value(id))
                .andExpect(jsonPath("$.endpointUrl").value("https://kaggle-api.tunnel.example"));

        // 살아있는 워커는 다시 기동할 수 없다
        mvc.perform(post("/api/gpu/workers/{id}/start", id))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value("error"));

        mvc.perform(post("/api/gpu/workers/{id}/stop", id).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"job_completed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.closed").value(true))
                .andExpect(jsonPath("$.reason").value("job_completed"));
        assertThat(notifiedWorkers).contains(id);

        mvc.perform(get("/api/gpu/workers/{id}", id))
                .andExpect(jsonPath("$.workerStatus").value("OFFLINE"))
                .andExpect(jsonPath("$.quotaLevel").value("OK"));

        // 두 번째 정지는 아무것도 닫지 않는다
        mvc.perform(post("/api/gpu/workers/{id}/stop", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.closed").value(false));
        assertThat(Collections.frequency(notifiedWorkers, id)).isEqualTo(1);
    }

    @Test
    void colabSession_entersCooldownAfterStop() throws Exception {
        long id = workerId("colab-api");

        // 세션 없는 자원의 등록은 거절
        mvc.perform(post("/api/gpu/workers/{id}/register", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(false))
                .andExpect(jsonPath("$.shouldShutdown").value(true));

        mvc.perform(post("/api/gpu/workers/{id}/start", id)).andExpect(status().isOk());

        mvc.perform(post("/api/gpu/workers/{id}/force-shutdown", id).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"note\":\"api test\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.closed").value(true))
                .andExpect(jsonPath("$.reason").value("admin_override"))
                .andExpect(jsonPath("$.cooldownUntil").isNotEmpty());

        mvc.perform(post("/api/gpu/workers/{id}/start", id))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value("CooldownActive"));

        mvc.perform(post("/api/gpu/ensure").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"provider\":\"COLAB\",\"maxWaitSeconds\":1}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.available").value(false));
    }

    @Test
    void missingCredentials_areReportedAsNotConfigured() throws Exception {
        long id = workerId("kaggle-nocred");

        mvc.perform(post("/api/gpu/workers/{id}/start", id))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value("NotConfigured"));

        mvc.perform(get("/api/gpu/workers/{id}", id))
                .andExpect(jsonPath("$.workerStatus").value("OFFLINE"));
    }

    @Test
    void badInput_mapsToClientErrors() throws Exception {
        mvc.perform(get("/api/gpu/workers/{id}", 999_999))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("bad_request"));

        mvc.perform(post("/api/gpu/workers/{id}/heartbeat", 999_999))
                .andExpect(status().isBadRequest());

        mvc.perform(post("/api/gpu/workers/{id}/start", 999_999))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.reason").value("WorkerNotFound"));

        mvc.perform(post("/api/gpu/ensure").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"provider\":\"TPU\"}"))
                .andExpect(status().isBadRequest());

        long id = workerId("kaggle-api");
        mvc.perform(post("/api/gpu/workers/{id}/stop", id).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"because\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void workersCanBeDefinedOverHttp_andWatchdogReportsRecovery() throws Exception {
        mvc.perform(post("/api/gpu/workers").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"kaggle-extra\",\"provider\":\"KAGGLE\",\"accountId\":\"acct-api\",\"capabilities\":\"t4x2\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.workerStatus").value("OFFLINE"))
                .andExpect(jsonPath("$.capabilities").value("t4x2"));

        assertThat(workerId("kaggle-extra")).isPositive();

        mvc.perform(get("/api/gpu/watchdog"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recovered").value(true));
    }

    private long workerId(String name) throws Exception {
        MvcResult res = mvc.perform(get("/api/gpu/workers")).andExpect(status().isOk()).andReturn();
        for (JsonNode n : mapper.readTree(res.getResponse().getContentAsString())) {
            if (name.equals(n.path("name").asText())) return n.path("workerId").asLong();
        }
        throw new AssertionError("worker not listed: " + name);
    }
}
