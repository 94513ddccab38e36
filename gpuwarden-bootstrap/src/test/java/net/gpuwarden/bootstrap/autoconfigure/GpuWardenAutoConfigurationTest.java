package net.gpuwarden.bootstrap.autoconfigure;

import net.gpuwarden.bootstrap.catalog.WorkerCatalogRegistrar;
import net.gpuwarden.bootstrap.props.GpuWardenProperties;
import net.gpuwarden.bootstrap.spi.HttpShutdownNotifier;
import net.gpuwarden.bootstrap.spi.UnconfiguredProvisioner;
import net.gpuwarden.core.maintenance.HeartbeatMonitor;
import net.gpuwarden.core.maintenance.MaintenanceService;
import net.gpuwarden.core.maintenance.Watchdog;
import net.gpuwarden.core.model.ProvisionResult;
import net.gpuwarden.core.model.Provider;
import net.gpuwarden.core.model.Worker;
import net.gpuwarden.core.quota.QuotaPolicy;
import net.gpuwarden.core.service.ReservationCoordinator;
import net.gpuwarden.core.service.WorkerAvailabilityService;
import net.gpuwarden.core.service.WorkerRegistrationService;
import net.gpuwarden.core.spi.CredentialProvider;
import net.gpuwarden.core.spi.Provisioner;
import net.gpuwarden.core.spi.RemoteShutdownNotifier;
import net.gpuwarden.core.spi.TxRunner;
import net.gpuwarden.core.spi.WeeklyWindowCalculator;
import net.gpuwarden.core.spi.WorkerRepository;
import net.gpuwarden.integration.spring.sched.GpuWardenSchedulers;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GpuWardenAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    DataSourceAutoConfiguration.class,
                    DataSourceTransactionManagerAutoConfiguration.class,
                    FlywayAutoConfiguration.class,
                    GpuWardenAutoConfiguration.class))
            .withPropertyValues(
                    "spring.datasource.url=jdbc:h2:mem:autoconfig;DB_CLOSE_DELAY=-1",
                    "spring.datasource.username=sa",
                    "spring.flyway.locations=classpath:db/migration/h2");

    @Test
    void wiresTheControlPlane_withDefaults() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(TxRunner.class);
            assertThat(ctx).hasSingleBean(WorkerRepository.class);
            assertThat(ctx).hasSingleBean(ReservationCoordinator.class);
            assertThat(ctx).hasSingleBean(WorkerRegistrationService.class);
            assertThat(ctx).hasSingleBean(WorkerAvailabilityService.class);
            assertThat(ctx).hasSingleBean(Watchdog.class);
            assertThat(ctx).hasSingleBean(HeartbeatMonitor.class);
            assertThat(ctx).hasSingleBean(MaintenanceService.class);
            assertThat(ctx).hasSingleBean(GpuWardenSchedulers.class);
            assertThat(ctx.getBean(Provisioner.class)).isInstanceOf(UnconfiguredProvisioner.class);
            assertThat(ctx.getBean(RemoteShutdownNotifier.class)).isInstanceOf(HttpShutdownNotifier.class);
            // 복구 패스는 refresh 중에, 스케줄 등록보다 먼저 끝난다
            assertThat(ctx.getBean(Watchdog.class).isRecovered()).isTrue();

            QuotaPolicy policy = ctx.getBean(QuotaPolicy.class);
            assertThat(policy.of(Provider.KAGGLE).safeWeeklyLimit()).isEqualTo(Duration.ofHours(21));
            assertThat(policy.of(Provider.KAGGLE).maxConcurrentSessions()).isEqualTo(1);
            assertThat(policy.of(Provider.COLAB).cooldown()).isEqualTo(Duration.ofHours(36));
            assertThat(ctx.getBean(ReservationCoordinator.class).getReservationTtl()).isEqualTo(Duration.ofMinutes(5));
        });
    }

    @Test
    void startupRecovery_canBeLeftToTheFirstTick() {
        runner.withPropertyValues("gpuwarden.watchdog.recover-on-startup=false")
                .run(ctx -> {
                    Watchdog watchdog = ctx.getBean(Watchdog.class);
                    assertThat(watchdog.isRecovered()).isFalse();
                    assertThat(watchdog.runOnce()).isZero();
                    assertThat(watchdog.isRecovered()).isTrue();
                });
    }

    @Test
    void quotasAndWindow_followProperties() {
        runner.withPropertyValues(
                        "gpuwarden.quota.safety-factor=0.5",
                        "gpuwarden.quota.kaggle.weekly-limit=20h",
                        "gpuwarden.quota.colab.max-concurrent-sessions=2",
                        "gpuwarden.quota.weekly-reset-cron=0 0 0 ? * SUN",
                        "gpuwarden.reservation.ttl=2m")
                .run(ctx -> {
                    QuotaPolicy policy = ctx.getBean(QuotaPolicy.class);
                    assertThat(policy.of(Provider.KAGGLE).safeWeeklyLimit()).isEqualTo(Duration.ofHours(10));
                    assertThat(policy.of(Provider.KAGGLE).safeSessionLimit()).isEqualTo(Duration.ofHours(6));
                    assertThat(policy.of(Provider.COLAB).limitsConcurrency()).isTrue();

                    WeeklyWindowCalculator window = ctx.getBean(WeeklyWindowCalculator.class);
                    assertThat(window.windowStart(Instant.parse("2026-10-14T10:00:00Z")))
                            .isEqualTo(Instant.parse("2026-10-11T00:00:00Z"));
                    assertThat(ctx.getBean(ReservationCoordinator.class).getReservationTtl()).isEqualTo(Duration.ofMinutes(2));
                });
    }

    @Test
    void userBeans_replaceTheDefaults_andSchedulersCanBeTurnedOff() {
        runner.withUserConfiguration(CustomSpi.class)
                .withPropertyValues("gpuwarden.scheduler.enabled=false", "gpuwarden.notifier.enabled=false")
                .run(ctx -> {
                    assertThat(ctx.getBean(Provisioner.class)).isSameAs(ctx.getBean(CustomSpi.class).provisioner);
                    assertThat(ctx).doesNotHaveBean(GpuWardenSchedulers.class);
                    assertThat(ctx).doesNotHaveBean(RemoteShutdownNotifier.class);
                });
    }

    @Test
    void catalogAndCredentials_comeFromProperties() {
        runner.withPropertyValues(
                        "gpuwarden.catalog.workers[0].name=kaggle-main",
                        "gpuwarden.catalog.workers[0].provider=kaggle",
                        "gpuwarden.catalog.workers[0].account-id=acct-1",
                        "gpuwarden.catalog.workers[1].name=colab-main",
                        "gpuwarden.catalog.workers[1].provider=COLAB",
                        "gpuwarden.credentials.accounts.acct-1.username=someone",
                        "gpuwarden.credentials.accounts.acct-1.key=s3cr3t")
                .run(ctx -> {
                    var registrar = ctx.getBean(WorkerCatalogRegistrar.class);
                    var props = ctx.getBean(GpuWardenProperties.class);
                    assertThat(registrar.register(props.getCatalog())).isEqualTo(2);
                    // 두 번 돌려도 같은 워커
                    assertThat(registrar.register(props.getCatalog())).isEqualTo(2);

                    TxRunner tx = ctx.getBean(TxRunner.class);
                    WorkerRepository workers = ctx.getBean(WorkerRepository.class);
                    List<Worker> all = tx.required(workers::findAll);
                    assertThat(all).extracting(Worker::name).containsExactlyInAnyOrder("kaggle-main", "colab-main");

                    CredentialProvider credentials = ctx.getBean(CredentialProvider.class);
                    assertThat(credentials.get("acct-1")).hasValueSatisfying(c -> {
                        assertThat(c.get("key")).isEqualTo("s3cr3t");
                        assertThat(c.toString()).doesNotContain("s3cr3t");
                    });
                    assertThat(credentials.get("acct-2")).isEmpty();
                });
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomSpi {
        final Provisioner provisioner = req -> ProvisionResult.launched("http://custom", "k-1");

        @Bean
        Provisioner customProvisioner() {
            return provisioner;
        }
    }
}
