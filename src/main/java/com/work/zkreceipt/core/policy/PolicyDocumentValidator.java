package com.work.zkreceipt.core.policy;

import com.work.zkreceipt.core.exception.PolicyDocumentException;
import com.work.zkreceipt.core.model.ClaimType;
import com.work.zkreceipt.core.model.NonProvableReason;
import com.work.zkreceipt.core.model.Venue;

import java.util.ArrayList;
import java.util.List;

/**
 * 策略文档一致性校验（启动期 fail-fast）：
 * - taxonomy 必须覆盖全部 claim 类型与全部原因码
 * - precedence 必须覆盖全部 venue，且每个 venue 两个偏好列表 key 都存在（可为空数组）
 */
public final class PolicyDocumentValidator {

    private PolicyDocumentValidator() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static void validate(ClaimTaxonomy taxonomy, SourcePrecedence precedence) {
        validateClaimTaxonomy(taxonomy);
        validateSourcePrecedence(precedence);
    }

    public static void validateClaimTaxonomy(ClaimTaxonomy taxonomy) {
        if (taxonomy == null) {
            throw new PolicyDocumentException("claim-taxonomy: document missing");
        }
        for (ClaimType c : ClaimType.values()) {
            if (!taxonomy.getClaimTypes().containsKey(c.name())) {
                throw new PolicyDocumentException("claim-taxonomy: missing claim type " + c.name());
            }
        }
        List<String> missing = new ArrayList<>();
        for (NonProvableReason r : NonProvableReason.values()) {
            if (!taxonomy.getNonProvableReasonCodes().contains(r.name())) {
                missing.add(r.name());
            }
        }
        if (!missing.isEmpty()) {
            throw new PolicyDocumentException("claim-taxonomy: missing required non_provable_reason_codes " + missing);
        }
    }

    public static void validateSourcePrecedence(SourcePrecedence precedence) {
        if (precedence == null) {
            throw new PolicyDocumentException("source-precedence: document missing");
        }
        for (Venue v : Venue.values()) {
            SourcePrecedence.VenueSources cfg = precedence.getVenues().get(v.getSlug());
            if (cfg == null) {
                throw new PolicyDocumentException("source-precedence: missing venue policy " + v.getSlug());
            }
            if (cfg.getOrderPlacedSourcesPreferred() == null || cfg.getTradeExecutedSourcesPreferred() == null) {
                throw new PolicyDocumentException("source-precedence: missing source preference lists for " + v.getSlug());
            }
        }
    }
}
