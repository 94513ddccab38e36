package net.gpuwarden.core.spi;

import net.gpuwarden.core.model.Worker;

/** 원격 자원에 정지를 요청 (best-effort). 실패는 예외로 알린다. */
@FunctionalInterface
public interface RemoteShutdownNotifier {
    void notifyShutdown(Worker worker) throws Exception;
}
