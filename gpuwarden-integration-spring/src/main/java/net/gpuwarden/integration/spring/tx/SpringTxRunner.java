package net.gpuwarden.integration.spring.tx;

import net.gpuwarden.adapter.jdbc.TxContext;
import net.gpuwarden.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * 스프링 트랜잭션 경계 위에서 TxContext 로 커넥션을 넘긴다.
 * 본문이 던진 checked 예외는 롤백 후 그대로 다시 던진다.
 */
public final class SpringTxRunner implements TxRunner {
    private final PlatformTransactionManager tm;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.tm = tm;
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRED, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        // 바깥 트랜잭션의 커넥션은 잠시 내려놓는다
        Connection suspended = TxContext.get();
        TxContext.clear();
        try {
            return execute(TransactionDefinition.PROPAGATION_REQUIRES_NEW, body);
        } finally {
            if (suspended != null) TxContext.set(suspended);
        }
    }

    private <T> T execute(int propagation, Callable<T> body) throws Exception {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);

        try {
            return tpl.execute(status -> {
                // 이미 TxContext가 있다면 그대로 사용 (중첩 호출)
                if (TxContext.get() != null) return call(body);

                // 스프링 트랜잭션의 물리 커넥션을 끌어와 TxContext에 꽂아줌
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return call(body);
                } finally {
                    TxContext.clear();
                    DataSourceUtils.releaseConnection(con, ds); // 스프링이 관리하는 방식으로 반납
                }
            });
        } catch (BodyFailure f) {
            throw f.checked;
        }
    }

    private static <T> T call(Callable<T> body) {
        try {
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new BodyFailure(e);
        }
    }

    /** TransactionTemplate 을 통과시키기 위한 포장 (롤백 유발용) */
    private static final class BodyFailure extends RuntimeException {
        final Exception checked;

        BodyFailure(Exception checked) {
            super(checked);
            this.checked = checked;
        }
    }
}
