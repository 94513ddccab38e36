package net.gpuwarden.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties("gpuwarden")
public class GpuWardenProperties {
    private Quota quota = new Quota();
    private Reservation reservation = new Reservation();
    private Heartbeat heartbeat = new Heartbeat();
    private Watchdog watchdog = new Watchdog();
    private Scheduler scheduler = new Scheduler();
    private Catalog catalog = new Catalog();
    private Credentials credentials = new Credentials();
    private Notifier notifier = new Notifier();

    public Quota getQuota() {
        return quota;
    }

    public void setQuota(Quota quota) {
        this.quota = quota;
    }

    public Reservation getReservation() {
        return reservation;
    }

    public void setReservation(Reservation reservation) {
        this.reservation = reservation;
    }

    public Heartbeat getHeartbeat() {
        return heartbeat;
    }

    public void setHeartbeat(Heartbeat heartbeat) {
        this.heartbeat = heartbeat;
    }

    public Watchdog getWatchdog() {
        return watchdog;
    }

    public void setWatchdog(Watchdog watchdog) {
        this.watchdog = watchdog;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public Credentials getCredentials() {
        return credentials;
    }

    public void setCredentials(Credentials credentials) {
        this.credentials = credentials;
    }

    public Notifier getNotifier() {
        return notifier;
    }

    public void setNotifier(Notifier notifier) {
        this.notifier = notifier;
    }

    /** 프로바이더 한도. 공식 값을 적고 safetyFactor 로 깎는다. */
    public static class Quota {
        private double safetyFactor = 0.7;
        private String weeklyResetCron = "0 0 0 ? * MON";
        private String zone = "UTC";
        private UsageLimits kaggle = new UsageLimits();
        private CooldownLimits colab = new CooldownLimits();

        public double getSafetyFactor() {
            return safetyFactor;
        }

        public void setSafetyFactor(double safetyFactor) {
            this.safetyFactor = safetyFactor;
        }

        public String getWeeklyResetCron() {
            return weeklyResetCron;
        }

        public void setWeeklyResetCron(String weeklyResetCron) {
            this.weeklyResetCron = weeklyResetCron;
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }

        public UsageLimits getKaggle() {
            return kaggle;
        }

        public void setKaggle(UsageLimits kaggle) {
            this.kaggle = kaggle;
        }

        public CooldownLimits getColab() {
            return colab;
        }

        public void setColab(CooldownLimits colab) {
            this.colab = colab;
        }
    }

    public static class UsageLimits {
        private Duration sessionLimit = Duration.ofHours(12);
        private Duration weeklyLimit = Duration.ofHours(30);
        private int maxConcurrentSessions = 1;

        public Duration getSessionLimit() {
            return sessionLimit;
        }

        public void setSessionLimit(Duration sessionLimit) {
            this.sessionLimit = sessionLimit;
        }

        public Duration getWeeklyLimit() {
            return weeklyLimit;
        }

        public void setWeeklyLimit(Duration weeklyLimit) {
            this.weeklyLimit = weeklyLimit;
        }

        public int getMaxConcurrentSessions() {
            return maxConcurrentSessions;
        }

        public void setMaxConcurrentSessions(int maxConcurrentSessions) {
            this.maxConcurrentSessions = maxConcurrentSessions;
        }
    }

    public static class CooldownLimits {
        private Duration sessionLimit = Duration.ofHours(12);
        private Duration cooldown = Duration.ofHours(36);
        private int maxConcurrentSessions = 0; // 0 = 제한 없음

        public Duration getSessionLimit() {
            return sessionLimit;
        }

        public void setSessionLimit(Duration sessionLimit) {
            this.sessionLimit = sessionLimit;
        }

        public Duration getCooldown() {
            return cooldown;
        }

        public void setCooldown(Duration cooldown) {
            this.cooldown = cooldown;
        }

        public int getMaxConcurrentSessions() {
            return maxConcurrentSessions;
        }

        public void setMaxConcurrentSessions(int maxConcurrentSessions) {
            this.maxConcurrentSessions = maxConcurrentSessions;
        }
    }

    public static class Reservation {
        private Duration ttl = Duration.ofMinutes(5);
        private Duration provisionTimeout = Duration.ofMinutes(10);

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public Duration getProvisionTimeout() {
            return provisionTimeout;
        }

        public void setProvisionTimeout(Duration provisionTimeout) {
            this.provisionTimeout = provisionTimeout;
        }
    }

    public static class Heartbeat {
        private Duration timeout = Duration.ofMinutes(3);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Watchdog {
        private Duration callbackTimeout = Duration.ofSeconds(30);
        private boolean recoverOnStartup = true;

        public Duration getCallbackTimeout() {
            return callbackTimeout;
        }

        public void setCallbackTimeout(Duration callbackTimeout) {
            this.callbackTimeout = callbackTimeout;
        }

        public boolean isRecoverOnStartup() {
            return recoverOnStartup;
        }

        public void setRecoverOnStartup(boolean recoverOnStartup) {
            this.recoverOnStartup = recoverOnStartup;
        }
    }

    /** @Scheduled 주기는 gpuwarden.scheduler.*-delay-ms 키에서 직접 읽힌다 */
    public static class Scheduler {
        private boolean enabled = true;
        private long watchdogDelayMs = 60_000;
        private long heartbeatDelayMs = 60_000;
        private long maintenanceDelayMs = 60_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getWatchdogDelayMs() {
            return watchdogDelayMs;
        }

        public void setWatchdogDelayMs(long watchdogDelayMs) {
            this.watchdogDelayMs = watchdogDelayMs;
        }

        public long getHeartbeatDelayMs() {
            return heartbeatDelayMs;
        }

        public void setHeartbeatDelayMs(long heartbeatDelayMs) {
            this.heartbeatDelayMs = heartbeatDelayMs;
        }

        public long getMaintenanceDelayMs() {
            return maintenanceDelayMs;
        }

        public void setMaintenanceDelayMs(long maintenanceDelayMs) {
            this.maintenanceDelayMs = maintenanceDelayMs;
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<WorkerDef> workers = new ArrayList<>(); // ← 가변

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<WorkerDef> getWorkers() {
            return workers;
        }

        public void setWorkers(List<WorkerDef> workers) {
            this.workers = workers;
        }
    }

    public static class WorkerDef {
        private String name;
        private String provider;
        private String accountId;
        private String capabilities;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getAccountId() {
            return accountId;
        }

        public void setAccountId(String accountId) {
            this.accountId = accountId;
        }

        public String getCapabilities() {
            return capabilities;
        }

        public void setCapabilities(String capabilities) {
            this.capabilities = capabilities;
        }

        @Override
        public String toString() {
            return "WorkerDef{" +
                    "name='" + name + '\'' +
                    ", provider='" + provider + '\'' +
                    ", accountId='" + accountId + '\'' +
                    '}';
        }
    }

    /** 계정별 자격 증명 (accountId → 키/값). 값은 로그에 남기지 않는다. */
    public static class Credentials {
        private Map<String, Map<String, String>> accounts = new LinkedHashMap<>(); // ← 가변

        public Map<String, Map<String, String>> getAccounts() {
            return accounts;
        }

        public void setAccounts(Map<String, Map<String, String>> accounts) {
            this.accounts = accounts;
        }
    }

    /** 원격 워커 정지 알림 (POST {endpoint}/shutdown) */
    public static class Notifier {
        private boolean enabled = true;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }
}
