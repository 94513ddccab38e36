package net.gpuwarden.core.maintenance;

import net.gpuwarden.core.model.Session;
import net.gpuwarden.core.model.Worker;

/**
 * 워치독이 세션을 닫기 전에 호출하는 원격 정지 동작.
 * 실패해도 세션은 닫힌다.
 */
@FunctionalInterface
public interface ShutdownCallback {
    void onShutdown(Worker worker, Session session) throws Exception;
}
