package net.gpuwarden.bootstrap.spi;

import net.gpuwarden.core.model.Worker;
import net.gpuwarden.core.spi.RemoteShutdownNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

/**
 * 원격 워커에 POST {endpointUrl}/shutdown.
 * 엔드포인트를 모르면 알릴 곳이 없으므로 건너뛴다. 전송 실패는 호출자에게 던진다.
 */
public class HttpShutdownNotifier implements RemoteShutdownNotifier {
    private static final Logger log = LoggerFactory.getLogger(HttpShutdownNotifier.class);

    static final String BODY = "{\"reason\":\"auto-shutdown\"}";

    private final RestClient restClient;

    public HttpShutdownNotifier(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public void notifyShutdown(Worker worker) {
        String endpoint = worker.endpointUrl();
        if (endpoint == null || endpoint.isBlank()) {
            log.info("Worker {} has no endpoint; skipping shutdown notification", worker.id());
            return;
        }
        String url = endpoint.endsWith("/") ? endpoint + "shutdown" : endpoint + "/shutdown";
        restClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .body(BODY)
                .retrieve()
                .toBodilessEntity();
        log.info("Shutdown signal sent to worker {} at {}", worker.id(), url);
    }
}
