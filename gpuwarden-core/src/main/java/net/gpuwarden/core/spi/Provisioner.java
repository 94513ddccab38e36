package net.gpuwarden.core.spi;

import net.gpuwarden.core.model.ProvisionRequest;
import net.gpuwarden.core.model.ProvisionResult;

/**
 * 원격 커널 생성/기동. 수 분이 걸릴 수 있고 내부 재시도는 하지 않는다.
 * 실패는 ProvisionResult.failed 로 돌려주거나 예외로 던져도 된다.
 */
@FunctionalInterface
public interface Provisioner {
    ProvisionResult launch(ProvisionRequest request) throws Exception;
}
