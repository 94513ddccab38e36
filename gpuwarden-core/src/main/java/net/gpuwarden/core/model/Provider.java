package net.gpuwarden.core.model;

public enum Provider {
    KAGGLE(QuotaFamily.USAGE_METERED),
    COLAB(QuotaFamily.COOLDOWN_METERED);

    private final QuotaFamily family;

    Provider(QuotaFamily family) { this.family = family; }

    public QuotaFamily family() { return family; }

    public String code() { return name(); }

    public static Provider from(String s) {
        if (s == null) throw new IllegalArgumentException("provider is required");
        return Provider.valueOf(s.trim().toUpperCase());
    }
}
