package net.gpuwarden.core.model;

public record EnsureResult(boolean available, Long workerId, String endpointUrl, boolean startedNew, String reason) {

    public static EnsureResult reused(Worker w) {
        return new EnsureResult(true, w.id(), w.endpointUrl(), false, null);
    }

    public static EnsureResult ready(Worker w, boolean startedNew) {
        return new EnsureResult(true, w.id(), w.endpointUrl(), startedNew, null);
    }

    public static EnsureResult unavailable(Long workerId, boolean startedNew, String reason) {
        return new EnsureResult(false, workerId, null, startedNew, reason);
    }
}
