package net.gpuwarden.bootstrap.spi;

import net.gpuwarden.core.model.ProvisionRequest;
import net.gpuwarden.core.model.ProvisionResult;
import net.gpuwarden.core.spi.Provisioner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provisioner 빈이 없을 때 쓰인다. 기동은 항상 실패로 보고되고 예약은 바로 해제된다.
 */
public class UnconfiguredProvisioner implements Provisioner {
    private static final Logger log = LoggerFactory.getLogger(UnconfiguredProvisioner.class);

    @Override
    public ProvisionResult launch(ProvisionRequest request) {
        log.warn("No Provisioner bean is configured; cannot launch worker {} on {}",
                request.worker().id(), request.worker().provider());
        return ProvisionResult.failed("no provisioner configured for " + request.worker().provider().code());
    }
}
