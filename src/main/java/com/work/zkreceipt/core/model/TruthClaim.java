package com.work.zkreceipt.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * receipt 所声明的事实。claimHash 在 PENDING 阶段基于请求字段计算，
 * 流水线生成 statement 后会整体重算并覆盖。
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class TruthClaim {

    private final ClaimType type;
    private final String statement;
    private final String claimHash;

    public TruthClaim(ClaimType type, String statement, String claimHash) {
        this.type = type;
        this.statement = statement;
        this.claimHash = claimHash;
    }

    public ClaimType getType() {
        return type;
    }

    public String getStatement() {
        return statement;
    }

    public String getClaimHash() {
        return claimHash;
    }
}
