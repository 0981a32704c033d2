package com.work.zkreceipt.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * 生成 receipt 时生效的策略版本信息。
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class PolicyContext {

    private final String policyId;
    private final String finalityRuleId;
    private final String sourcePrecedenceVersion;

    public PolicyContext(String policyId, String finalityRuleId, String sourcePrecedenceVersion) {
        this.policyId = policyId;
        this.finalityRuleId = finalityRuleId;
        this.sourcePrecedenceVersion = sourcePrecedenceVersion;
    }

    public String getPolicyId() {
        return policyId;
    }

    public String getFinalityRuleId() {
        return finalityRuleId;
    }

    public String getSourcePrecedenceVersion() {
        return sourcePrecedenceVersion;
    }
}
