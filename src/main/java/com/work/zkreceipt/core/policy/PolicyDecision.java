package com.work.zkreceipt.core.policy;

import com.work.zkreceipt.core.model.NonProvableReason;

/**
 * 策略判定结果。reject 时 reason 可能为空，由调用方回落到 POLICY_VIOLATION。
 */
public final class PolicyDecision {

    private static final PolicyDecision ACCEPT = new PolicyDecision(true, null, "");

    private final boolean ok;
    private final NonProvableReason reason;
    private final String details;

    private PolicyDecision(boolean ok, NonProvableReason reason, String details) {
        this.ok = ok;
        this.reason = reason;
        this.details = details == null ? "" : details;
    }

    public static PolicyDecision accept() {
        return ACCEPT;
    }

    public static PolicyDecision reject(NonProvableReason reason, String details) {
        return new PolicyDecision(false, reason, details);
    }

    public boolean isOk() {
        return ok;
    }

    public NonProvableReason getReason() {
        return reason;
    }

    /**
     * reject 时的原因码，未给出时回落到 POLICY_VIOLATION。
     */
    public NonProvableReason reasonOrDefault() {
        return reason == null ? NonProvableReason.POLICY_VIOLATION : reason;
    }

    public String getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return ok ? "PolicyDecision{ok}" : "PolicyDecision{reject reason=" + reason + ", details=" + details + "}";
    }
}
