package net.gpuwarden.core.model;

public record NewWorker(String name, Provider provider, String accountId, String capabilities) {
    public NewWorker {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("worker.name is required");
        if (provider == null) throw new IllegalArgumentException("worker.provider is required");
    }
}
