package net.gpuwarden.bootstrap.catalog;

import net.gpuwarden.bootstrap.props.GpuWardenProperties;
import net.gpuwarden.core.model.NewWorker;
import net.gpuwarden.core.model.Provider;
import net.gpuwarden.core.model.Worker;
import net.gpuwarden.core.service.WorkerRegistrationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** 설정에 선언된 워커를 레지스트리에 반영 (이름 기준 멱등) */
public class WorkerCatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(WorkerCatalogRegistrar.class);

    private final WorkerRegistrationService registration;

    public WorkerCatalogRegistrar(WorkerRegistrationService registration) {
        this.registration = registration;
    }

    public int register(GpuWardenProperties.Catalog catalog) throws Exception {
        int n = 0;
        for (var def : catalog.getWorkers()) {
            if (def.getName() == null || def.getProvider() == null) {
                throw new IllegalArgumentException("worker.name and worker.provider are required: " + def);
            }
            Worker w = registration.createOrUpdate(new NewWorker(
                    def.getName().trim(),
                    Provider.from(def.getProvider()),
                    def.getAccountId(),
                    def.getCapabilities()));
            log.debug("Catalog worker '{}' -> id={} status={}", w.name(), w.id(), w.status());
            n++;
        }
        log.info("Catalog registered: workers={}", n);
        return n;
    }
}
