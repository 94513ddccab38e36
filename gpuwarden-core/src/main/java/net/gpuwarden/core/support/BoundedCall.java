package net.gpuwarden.core.support;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 외부 호출을 시간 제한 안에서 기다린다.
 * 제한을 넘기면 기다림만 멈추고 호출 자체는 끊지 않는다 (원격 자원은 정지 "요청"만 한다).
 */
public final class BoundedCall {
    private BoundedCall() {}

    public static <T> T call(ExecutorService executor, Callable<T> body, Duration timeout) throws Exception {
        Future<T> f = executor.submit(body);
        try {
            return f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) throw ex;
            if (cause instanceof Error err) throw err;
            throw e;
        } catch (TimeoutException e) {
            throw new TimeoutException("call did not complete within " + Durations.human(timeout));
        }
    }

    /** 데몬 스레드 풀 (JVM 종료를 막지 않음) */
    public static ExecutorService daemonPool(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newCachedThreadPool(tf);
    }
}
