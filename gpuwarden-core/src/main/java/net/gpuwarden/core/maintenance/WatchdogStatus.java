package net.gpuwarden.core.maintenance;

import java.time.Instant;

public record WatchdogStatus(boolean recovered, Instant lastCheckAt, long shutdownsPerformed, int activeSessions) {}
