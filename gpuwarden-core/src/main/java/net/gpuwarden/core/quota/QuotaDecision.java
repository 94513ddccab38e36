package net.gpuwarden.core.quota;

import net.gpuwarden.core.model.StartFailure;

public record QuotaDecision(boolean allowed, StartFailure failure, String reason) {

    public static QuotaDecision allow() { return new QuotaDecision(true, null, "ok"); }

    public static QuotaDecision deny(StartFailure failure, String reason) {
        return new QuotaDecision(false, failure, reason);
    }
}
