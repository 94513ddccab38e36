package net.gpuwarden.core.model;

import java.util.Arrays;

public enum ShutdownReason {
    QUOTA_EXCEEDED("quota_exceeded"),
    ORPHANED_RECOVERY("orphaned_recovery"),
    ADMIN_OVERRIDE("admin_override"),
    JOB_COMPLETED("job_completed"),
    HEARTBEAT_LOST("heartbeat_lost");

    private final String code;

    ShutdownReason(String code) { this.code = code; }

    public String code() { return code; }

    public static ShutdownReason from(String code) {
        if (code == null) return null;
        return Arrays.stream(values())
                .filter(r -> r.code.equalsIgnoreCase(code) || r.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown shutdown reason: " + code));
    }
}
