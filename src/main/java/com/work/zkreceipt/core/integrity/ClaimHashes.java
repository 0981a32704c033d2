package com.work.zkreceipt.core.integrity;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.work.zkreceipt.core.model.ClaimType;
import com.work.zkreceipt.core.model.ProofRequest;
import com.work.zkreceipt.core.model.Venue;
import com.work.zkreceipt.core.support.CanonicalHasher;

/**
 * claim 哈希与公开输入的唯一计算口径（引擎、prover、verifier 共用）。
 */
public final class ClaimHashes {

    private ClaimHashes() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * PENDING 阶段的 claim 哈希：只绑定请求的身份字段。
     */
    public static String pendingClaimHash(ProofRequest request) {
        return CanonicalHasher.hashOf(
                "venue", request.getVenue().getSlug(),
                "claim_type", request.getClaimType().name(),
                "account_ref", request.getAccountRef(),
                "order_ref", request.getOrderRef(),
                "execution_ref", request.getExecutionRef());
    }

    /**
     * 终态 claim 哈希：绑定 statement，覆盖 PENDING 阶段的值。
     */
    public static String finalClaimHash(ClaimType claimType, String statement, String orderRef, String executionRef) {
        return CanonicalHasher.hashOf(
                "claim_type", claimType.name(),
                "statement", statement,
                "order_ref", orderRef,
                "execution_ref", executionRef);
    }

    /**
     * 交给 prover 的公开输入 {claim_hash, evidence_root, venue, claim_type}。
     */
    public static ObjectNode publicInputs(String claimHash, String evidenceRoot, Venue venue, ClaimType claimType) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("claim_hash", claimHash);
        node.put("evidence_root", evidenceRoot);
        node.put("venue", venue.getSlug());
        node.put("claim_type", claimType.name());
        return node;
    }

    public static String publicInputsHash(String claimHash, String evidenceRoot, Venue venue, ClaimType claimType) {
        return CanonicalHasher.hash(publicInputs(claimHash, evidenceRoot, venue, claimType));
    }
}
