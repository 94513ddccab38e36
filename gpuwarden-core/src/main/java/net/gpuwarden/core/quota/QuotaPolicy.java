package net.gpuwarden.core.quota;

import net.gpuwarden.core.model.Provider;

import java.time.Duration;
import java.util.List;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** 프로바이더별 쿼터 설정 묶음 (불변) */
public final class QuotaPolicy {
    private final Map<Provider, ProviderQuota> quotas;

    private QuotaPolicy(Map<Provider, ProviderQuota> quotas) {
        this.quotas = Collections.unmodifiableMap(new EnumMap<>(quotas));
    }

    public static QuotaPolicy of(Collection<ProviderQuota> quotas) {
        Map<Provider, ProviderQuota> m = new EnumMap<>(Provider.class);
        for (ProviderQuota q : quotas) m.put(q.provider(), q);
        for (Provider p : Provider.values()) {
            if (!m.containsKey(p)) throw new IllegalArgumentException("quota not configured for " + p);
        }
        return new QuotaPolicy(m);
    }

    /** KAGGLE 12h/세션, 30h/주; COLAB 12h/세션, 휴지기 36h; 안전 계수 0.7 */
    public static QuotaPolicy defaults() {
        double f = ProviderQuota.DEFAULT_SAFETY_FACTOR;
        return of(List.of(
                ProviderQuota.usageMetered(Provider.KAGGLE, Duration.ofHours(12), Duration.ofHours(30), f),
                ProviderQuota.cooldownMetered(Provider.COLAB, Duration.ofHours(12), Duration.ofHours(36), f)
        ));
    }

    public ProviderQuota of(Provider provider) {
        return quotas.get(provider);
    }

    public Map<Provider, ProviderQuota> asMap() { return quotas; }
}
