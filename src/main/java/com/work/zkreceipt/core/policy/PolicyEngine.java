package com.work.zkreceipt.core.policy;

import com.work.zkreceipt.core.model.ClaimType;
import com.work.zkreceipt.core.model.EvidenceBundle;
import com.work.zkreceipt.core.model.EvidenceItem;
import com.work.zkreceipt.core.model.NonProvableReason;
import com.work.zkreceipt.core.model.PolicyContext;
import com.work.zkreceipt.core.model.Venue;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.work.zkreceipt.core.support.ValidationUtils.requireNonEmpty;
import static com.work.zkreceipt.core.support.ValidationUtils.requireNonNull;

/**
 * 纯函数式策略引擎：(venue, claimType, bundle) -> accept / reject(reason)。
 * <p>
 * 判定顺序是契约的一部分，遇到第一个失败即返回：
 * <ol>
 *   <li>证据冲突 -> EVIDENCE_CONFLICT</li>
 *   <li>没有任何证据 -> EVIDENCE_MISSING</li>
 *   <li>缺少必需标签 -> EVIDENCE_MISSING</li>
 *   <li>存在偏好来源列表但没有任何证据来源命中 -> SOURCE_UNAVAILABLE</li>
 * </ol>
 * 冲突与缺失比来源问题更根本，必须先于来源判定报告。
 */
public class PolicyEngine {

    public static final String DEFAULT_POLICY_ID = "default-v0.1.0";
    public static final String DEFAULT_FINALITY_RULE_ID = "venue-default-finality-v0.1.0";

    private final ClaimTaxonomy claimTaxonomy;
    private final SourcePrecedence sourcePrecedence;
    private final String policyId;
    private final String finalityRuleId;

    public PolicyEngine(ClaimTaxonomy claimTaxonomy, SourcePrecedence sourcePrecedence) {
        this(claimTaxonomy, sourcePrecedence, DEFAULT_POLICY_ID, DEFAULT_FINALITY_RULE_ID);
    }

    public PolicyEngine(ClaimTaxonomy claimTaxonomy,
                        SourcePrecedence sourcePrecedence,
                        String policyId,
                        String finalityRuleId) {
        this.claimTaxonomy = requireNonNull(claimTaxonomy, "claimTaxonomy");
        this.sourcePrecedence = requireNonNull(sourcePrecedence, "sourcePrecedence");
        this.policyId = requireNonEmpty(policyId, "policyId");
        this.finalityRuleId = requireNonEmpty(finalityRuleId, "finalityRuleId");
    }

    public String policyId() {
        return policyId;
    }

    public String finalityRuleId() {
        return finalityRuleId;
    }

    public String sourcePrecedenceVersion() {
        String v = sourcePrecedence.getVersion();
        return v == null || v.trim().isEmpty() ? "unknown" : v;
    }

    public PolicyContext policyContext() {
        return new PolicyContext(policyId(), finalityRuleId(), sourcePrecedenceVersion());
    }

    public PolicyDecision evaluate(Venue venue, ClaimType claimType, EvidenceBundle bundle) {
        requireNonNull(venue, "venue");
        requireNonNull(claimType, "claimType");
        requireNonNull(bundle, "bundle");

        if (bundle.hasConflicts()) {
            return PolicyDecision.reject(NonProvableReason.EVIDENCE_CONFLICT,
                    "Conflicting evidence entries detected: " + String.join(", ", bundle.getConflicts()));
        }

        if (bundle.getItems().isEmpty()) {
            return PolicyDecision.reject(NonProvableReason.EVIDENCE_MISSING,
                    "No evidence artifacts were collected.");
        }

        List<String> missing = new ArrayList<>();
        for (String tag : requiredTags(claimType)) {
            if (!bundle.getObservedTags().contains(tag)) {
                missing.add(tag);
            }
        }
        if (!missing.isEmpty()) {
            return PolicyDecision.reject(NonProvableReason.EVIDENCE_MISSING,
                    "Missing required evidence tags: " + String.join(", ", missing));
        }

        List<String> preferred = preferredSources(venue, claimType);
        if (!preferred.isEmpty()) {
            Set<String> observedKinds = new LinkedHashSet<>();
            for (EvidenceItem item : bundle.getItems()) {
                observedKinds.add(item.getSourceKind());
            }
            boolean matched = false;
            for (String p : preferred) {
                if (observedKinds.contains(p)) {
                    matched = true;
                    break;
                }
            }
            if (!matched) {
                return PolicyDecision.reject(NonProvableReason.SOURCE_UNAVAILABLE,
                        "No acceptable preferred source kinds observed. Expected one of: " + String.join(", ", preferred));
            }
        }

        return PolicyDecision.accept();
    }

    List<String> requiredTags(ClaimType claimType) {
        return claimTaxonomy.requiredTags(claimType.name());
    }

    List<String> preferredSources(Venue venue, ClaimType claimType) {
        SourcePrecedence.VenueSources sources = sourcePrecedence.getVenues().get(venue.getSlug());
        if (sources == null) {
            return new ArrayList<>();
        }
        return sources.preferredFor(claimType);
    }
}
