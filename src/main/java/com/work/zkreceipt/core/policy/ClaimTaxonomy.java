package com.work.zkreceipt.core.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * claim taxonomy 文档：每种 claim 必须全部具备的证据标签，以及原因码闭集。
 * <pre>
 * { "claim_types": { "ORDER_PLACED": { "required_evidence_tags_all": [...] } },
 *   "non_provable_reason_codes": [...] }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ClaimTaxonomy {

    private Map<String, ClaimRule> claimTypes = new LinkedHashMap<>();
    private List<String> nonProvableReasonCodes = new ArrayList<>();

    public Map<String, ClaimRule> getClaimTypes() {
        return claimTypes;
    }

    public void setClaimTypes(Map<String, ClaimRule> claimTypes) {
        this.claimTypes = claimTypes == null ? new LinkedHashMap<>() : claimTypes;
    }

    public List<String> getNonProvableReasonCodes() {
        return nonProvableReasonCodes;
    }

    public void setNonProvableReasonCodes(List<String> nonProvableReasonCodes) {
        this.nonProvableReasonCodes = nonProvableReasonCodes == null ? new ArrayList<>() : nonProvableReasonCodes;
    }

    /**
     * 指定 claim 类型的必需标签；文档未声明时返回空列表。
     */
    public List<String> requiredTags(String claimType) {
        ClaimRule rule = claimTypes.get(claimType);
        if (rule == null || rule.getRequiredEvidenceTagsAll() == null) {
            return Collections.emptyList();
        }
        return rule.getRequiredEvidenceTagsAll();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ClaimRule {

        private List<String> requiredEvidenceTagsAll = new ArrayList<>();

        public ClaimRule() {
        }

        public ClaimRule(List<String> requiredEvidenceTagsAll) {
            setRequiredEvidenceTagsAll(requiredEvidenceTagsAll);
        }

        public List<String> getRequiredEvidenceTagsAll() {
            return requiredEvidenceTagsAll;
        }

        public void setRequiredEvidenceTagsAll(List<String> requiredEvidenceTagsAll) {
            this.requiredEvidenceTagsAll = requiredEvidenceTagsAll == null ? new ArrayList<>() : requiredEvidenceTagsAll;
        }
    }
}
