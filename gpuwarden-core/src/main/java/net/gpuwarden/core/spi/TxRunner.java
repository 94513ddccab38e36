package net.gpuwarden.core.spi;

import java.util.concurrent.Callable;

/**
 * 트랜잭션 경계. 저장소 구현은 이 경계 안에서만 동작한다.
 * requiresNew 는 바깥 트랜잭션을 잠시 떼어내고 새로 커밋한다 (예약 1/3단계처럼 짧게 끝나야 하는 구간).
 */
public interface TxRunner {
    <T> T required(Callable<T> body) throws Exception;

    <T> T requiresNew(Callable<T> body) throws Exception;

    default void required(Work body) throws Exception {
        required(() -> { body.run(); return null; });
    }

    default void requiresNew(Work body) throws Exception {
        requiresNew(() -> { body.run(); return null; });
    }

    @FunctionalInterface
    interface Work {
        void run() throws Exception;
    }
}
