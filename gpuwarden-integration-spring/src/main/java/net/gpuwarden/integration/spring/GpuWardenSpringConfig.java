package net.gpuwarden.integration.spring;

import net.gpuwarden.adapter.jdbc.repo.JdbcSessionRepository;
import net.gpuwarden.adapter.jdbc.repo.JdbcWorkerRepository;
import net.gpuwarden.core.spi.Clock;
import net.gpuwarden.core.spi.SessionRepository;
import net.gpuwarden.core.spi.TxRunner;
import net.gpuwarden.core.spi.WorkerRepository;
import net.gpuwarden.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Instant;

@Configuration
public class GpuWardenSpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // Repository 구현 등록 (adapter-jdbc 재사용)
    @Bean public WorkerRepository workerRepository(DataSource ds) { return new JdbcWorkerRepository(ds); }
    @Bean public SessionRepository sessionRepository(DataSource ds) { return new JdbcSessionRepository(ds); }

    @Bean public Clock systemClock() { return Instant::now; }
}
