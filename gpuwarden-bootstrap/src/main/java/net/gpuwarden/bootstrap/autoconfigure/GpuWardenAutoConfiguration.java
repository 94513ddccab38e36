package net.gpuwarden.bootstrap.autoconfigure;

import net.gpuwarden.bootstrap.catalog.WorkerCatalogRegistrar;
import net.gpuwarden.bootstrap.props.GpuWardenProperties;
import net.gpuwarden.bootstrap.spi.HttpShutdownNotifier;
import net.gpuwarden.bootstrap.spi.PropertiesCredentialProvider;
import net.gpuwarden.bootstrap.spi.UnconfiguredProvisioner;
import net.gpuwarden.core.maintenance.HeartbeatMonitor;
import net.gpuwarden.core.maintenance.MaintenanceService;
import net.gpuwarden.core.maintenance.Watchdog;
import net.gpuwarden.core.model.Provider;
import net.gpuwarden.core.quota.ProviderQuota;
import net.gpuwarden.core.quota.QuotaEvaluator;
import net.gpuwarden.core.quota.QuotaPolicy;
import net.gpuwarden.core.service.ReservationCoordinator;
import net.gpuwarden.core.service.SessionLifecycleService;
import net.gpuwarden.core.service.WorkerAvailabilityService;
import net.gpuwarden.core.service.WorkerRegistrationService;
import net.gpuwarden.core.spi.Clock;
import net.gpuwarden.core.spi.CredentialProvider;
import net.gpuwarden.core.spi.Provisioner;
import net.gpuwarden.core.spi.RemoteShutdownNotifier;
import net.gpuwarden.core.spi.SessionRepository;
import net.gpuwarden.core.spi.TxRunner;
import net.gpuwarden.core.spi.WeeklyWindowCalculator;
import net.gpuwarden.core.spi.WorkerRepository;
import net.gpuwarden.core.support.BoundedCall;
import net.gpuwarden.integration.spring.GpuWardenSpringConfig;
import net.gpuwarden.integration.spring.cron.CronWeeklyWindowCalculator;
import net.gpuwarden.integration.spring.sched.GpuWardenSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.ExecutorService;

@AutoConfiguration
@EnableConfigurationProperties(GpuWardenProperties.class)
@Import(GpuWardenSpringConfig.class) // integration-spring: repos/tx/clock wiring
public class GpuWardenAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(GpuWardenAutoConfiguration.class);

    public static final String CALL_EXECUTOR = "gpuwardenCallExecutor";

    // --- 쿼터 ---

    @Bean
    @ConditionalOnMissingBean
    public WeeklyWindowCalculator weeklyWindowCalculator(GpuWardenProperties props) {
        var q = props.getQuota();
        return new CronWeeklyWindowCalculator(q.getWeeklyResetCron(), ZoneId.of(q.getZone()));
    }

    @Bean
    @ConditionalOnMissingBean
    public QuotaPolicy quotaPolicy(GpuWardenProperties props) {
        var q = props.getQuota();
        var kaggle = q.getKaggle();
        var colab = q.getColab();
        return QuotaPolicy.of(List.of(
                new ProviderQuota(Provider.KAGGLE, kaggle.getSessionLimit(), kaggle.getWeeklyLimit(), null,
                        q.getSafetyFactor(), kaggle.getMaxConcurrentSessions()),
                new ProviderQuota(Provider.COLAB, colab.getSessionLimit(), null, colab.getCooldown(),
                        q.getSafetyFactor(), colab.getMaxConcurrentSessions())
        ));
    }

    @Bean
    @ConditionalOnMissingBean
    public QuotaEvaluator quotaEvaluator(QuotaPolicy policy, WeeklyWindowCalculator weeklyWindow) {
        return new QuotaEvaluator(policy, weeklyWindow);
    }

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean(CredentialProvider.class)
    public CredentialProvider credentialProvider(GpuWardenProperties props) {
        return new PropertiesCredentialProvider(props.getCredentials().getAccounts());
    }

    @Bean
    @ConditionalOnMissingBean(Provisioner.class)
    public Provisioner provisioner() {
        return new UnconfiguredProvisioner();
    }

    @Bean
    @ConditionalOnMissingBean(RemoteShutdownNotifier.class)
    @ConditionalOnProperty(prefix = "gpuwarden.notifier", name = "enabled", havingValue = "true", matchIfMissing = true)
    public RemoteShutdownNotifier remoteShutdownNotifier(GpuWardenProperties props) {
        var n = props.getNotifier();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) n.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) n.getReadTimeout().toMillis());
        return new HttpShutdownNotifier(RestClient.builder().requestFactory(requestFactory).build());
    }

    /** 외부 호출(프로비저너, 정지 콜백)을 시간 제한 안에서 기다리기 위한 풀 */
    @Bean(name = CALL_EXECUTOR, destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = CALL_EXECUTOR)
    public ExecutorService gpuwardenCallExecutor() {
        return BoundedCall.daemonPool("gpuwarden-call");
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public SessionLifecycleService sessionLifecycle(WorkerRepository workers,
                                                    SessionRepository sessions,
                                                    QuotaEvaluator quota,
                                                    TxRunner tx,
                                                    Clock clock) {
        return new SessionLifecycleService(workers, sessions, quota, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReservationCoordinator reservationCoordinator(WorkerRepository workers,
                                                         SessionRepository sessions,
                                                         QuotaEvaluator quota,
                                                         Provisioner provisioner,
                                                         CredentialProvider credentials,
                                                         TxRunner tx,
                                                         Clock clock,
                                                         @Qualifier(CALL_EXECUTOR) ExecutorService executor,
                                                         GpuWardenProperties props) {
        var c = new ReservationCoordinator(workers, sessions, quota, provisioner, credentials, tx, clock, executor);
        c.setReservationTtl(props.getReservation().getTtl());
        c.setProvisionTimeout(props.getReservation().getProvisionTimeout());
        return c;
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkerRegistrationService workerRegistration(WorkerRepository workers,
                                                        SessionLifecycleService lifecycle,
                                                        TxRunner tx,
                                                        Clock clock) {
        return new WorkerRegistrationService(workers, lifecycle, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkerAvailabilityService workerAvailability(WorkerRepository workers,
                                                        SessionRepository sessions,
                                                        ReservationCoordinator coordinator,
                                                        QuotaEvaluator quota,
                                                        TxRunner tx,
                                                        Clock clock) {
        return new WorkerAvailabilityService(workers, sessions, coordinator, quota, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public Watchdog watchdog(SessionRepository sessions,
                             WorkerRepository workers,
                             SessionLifecycleService lifecycle,
                             TxRunner tx,
                             Clock clock,
                             @Qualifier(CALL_EXECUTOR) ExecutorService executor,
                             ObjectProvider<RemoteShutdownNotifier> notifier,
                             GpuWardenProperties props) {
        var w = new Watchdog(sessions, workers, lifecycle, tx, clock, executor);
        w.setCallbackTimeout(props.getWatchdog().getCallbackTimeout());
        notifier.ifAvailable(n -> w.registerShutdownCallback(Watchdog.notifying(n)));
        return w;
    }

    @Bean
    @ConditionalOnMissingBean
    public HeartbeatMonitor heartbeatMonitor(WorkerRepository workers,
                                             SessionLifecycleService lifecycle,
                                             TxRunner tx,
                                             Clock clock,
                                             Watchdog watchdog,
                                             GpuWardenProperties props) {
        var m = new HeartbeatMonitor(workers, lifecycle, tx, clock);
        m.setTimeout(props.getHeartbeat().getTimeout());
        m.awaitRecoveryOf(watchdog);
        return m;
    }

    @Bean
    @ConditionalOnMissingBean
    public MaintenanceService maintenance(WorkerRepository workers,
                                          QuotaEvaluator quota,
                                          TxRunner tx,
                                          Clock clock) {
        return new MaintenanceService(workers, quota, tx, clock);
    }

    // --- 스케줄러 등록 (프로퍼티로 주기 제어) ---

    @Bean
    @ConditionalOnProperty(prefix = "gpuwarden.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public GpuWardenSchedulers gpuwardenSchedulers(Watchdog watchdog,
                                                   HeartbeatMonitor heartbeats,
                                                   MaintenanceService maintenance) {
        // @Scheduled의 딜레이는 gpuwarden.scheduler.*-delay-ms 키에서 읽힘
        return new GpuWardenSchedulers(watchdog, heartbeats, maintenance);
    }

    @Bean
    @ConditionalOnProperty(prefix = "gpuwarden.watchdog", name = "recover-on-startup", havingValue = "true", matchIfMissing = true)
    public SmartInitializingSingleton watchdogRecoveryRunner(Watchdog watchdog) {
        // @Scheduled 작업 등록(컨텍스트 refresh 완료) 전에 돈다
        return watchdog::recoverOrphans;
    }

    // --- 카탈로그 ---

    @Bean
    public WorkerCatalogRegistrar workerCatalogRegistrar(WorkerRegistrationService registration) {
        return new WorkerCatalogRegistrar(registration);
    }

    @Bean
    @ConditionalOnProperty(prefix = "gpuwarden.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner catalogRunner(WorkerCatalogRegistrar registrar, GpuWardenProperties props) {
        log.info("Catalog runner: {} worker(s) declared", props.getCatalog().getWorkers().size());
        return args -> registrar.register(props.getCatalog());
    }
}
