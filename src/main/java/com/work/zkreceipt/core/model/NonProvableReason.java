package com.work.zkreceipt.core.model;

/**
 * NON_PROVABLE 原因码（闭集，需与 claim taxonomy 文档中的 non_provable_reason_codes 一致）。
 */
public enum NonProvableReason {
    EVIDENCE_MISSING,
    EVIDENCE_CONFLICT,
    SOURCE_UNAVAILABLE,
    /** 预留：当前流水线不产生。 */
    FINALITY_TIMEOUT,
    POLICY_VIOLATION,
    /** 预留：当前流水线不产生。 */
    SCHEMA_INVALID,
    UNSUPPORTED_VENUE_CLAIM,
    PROOF_FAILURE
}
