package net.gpuwarden.core.model;

import java.time.Instant;

public record NewSession(long workerId, Provider provider, Instant sessionStartedAt,
                         long maxSessionDurationMs, Instant autoShutdownAt) {}
