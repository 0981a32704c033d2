package com.work.zkreceipt.demo.web.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Positive;

/**
 * 提交证明请求。venue 使用 slug（hyperliquid/base/solana/polymarket），claim_type 使用枚举名。
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class VerifyClaimRequest {

    @NotBlank(message = "venue 不能为空")
    private String venue;

    @NotBlank(message = "claim_type 不能为空")
    private String claimType;

    @NotBlank(message = "account_ref 不能为空")
    private String accountRef;

    @NotBlank(message = "order_ref 不能为空")
    private String orderRef;

    private String executionRef;

    /**
     * 透传给 adapter 的附加参数（必须是 JSON 对象）。
     */
    private JsonNode payload;

    /**
     * 是否在返回前等待后台流水线结束。
     */
    private boolean waitForResult = true;

    @Positive(message = "wait_timeout_ms 必须大于0")
    private Long waitTimeoutMs;

    public String getVenue() {
        return venue;
    }

    public void setVenue(String venue) {
        this.venue = venue;
    }

    public String getClaimType() {
        return claimType;
    }

    public void setClaimType(String claimType) {
        this.claimType = claimType;
    }

    public String getAccountRef() {
        return accountRef;
    }

    public void setAccountRef(String accountRef) {
        this.accountRef = accountRef;
    }

    public String getOrderRef() {
        return orderRef;
    }

    public void setOrderRef(String orderRef) {
        this.orderRef = orderRef;
    }

    public String getExecutionRef() {
        return executionRef;
    }

    public void setExecutionRef(String executionRef) {
        this.executionRef = executionRef;
    }

    public JsonNode getPayload() {
        return payload;
    }

    public void setPayload(JsonNode payload) {
        this.payload = payload;
    }

    public boolean isWaitForResult() {
        return waitForResult;
    }

    public void setWaitForResult(boolean waitForResult) {
        this.waitForResult = waitForResult;
    }

    public Long getWaitTimeoutMs() {
        return waitTimeoutMs;
    }

    public void setWaitTimeoutMs(Long waitTimeoutMs) {
        this.waitTimeoutMs = waitTimeoutMs;
    }
}
