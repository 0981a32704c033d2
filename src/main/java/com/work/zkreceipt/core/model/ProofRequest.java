package com.work.zkreceipt.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import static com.work.zkreceipt.core.support.ValidationUtils.requireNonNull;
import static com.work.zkreceipt.core.support.ValidationUtils.requireNonEmpty;

/**
 * 一次证明请求（提交后不可变）。
 * <p>
 * payload 为不透明的扩展字段，主要供模拟/测试类 adapter 读取（例如 simulate_conflict）。
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class ProofRequest {

    private final Venue venue;
    private final ClaimType claimType;
    private final String accountRef;
    private final String orderRef;
    private final String executionRef;
    private final ObjectNode payload;

    public ProofRequest(Venue venue,
                        ClaimType claimType,
                        String accountRef,
                        String orderRef,
                        String executionRef,
                        JsonNode payload) {
        this.venue = requireNonNull(venue, "venue");
        this.claimType = requireNonNull(claimType, "claimType");
        this.accountRef = requireNonEmpty(accountRef, "accountRef");
        this.orderRef = requireNonEmpty(orderRef, "orderRef");
        this.executionRef = normalizeOptional(executionRef);
        if (payload != null && !payload.isNull() && !payload.isObject()) {
            throw new IllegalArgumentException("payload 必须是 JSON 对象");
        }
        this.payload = payload instanceof ObjectNode
                ? ((ObjectNode) payload).deepCopy()
                : JsonNodeFactory.instance.objectNode();
    }

    public ProofRequest(Venue venue, ClaimType claimType, String accountRef, String orderRef, String executionRef) {
        this(venue, claimType, accountRef, orderRef, executionRef, null);
    }

    public Venue getVenue() {
        return venue;
    }

    public ClaimType getClaimType() {
        return claimType;
    }

    public String getAccountRef() {
        return accountRef;
    }

    public String getOrderRef() {
        return orderRef;
    }

    public String getExecutionRef() {
        return executionRef;
    }

    /**
     * 返回副本，调用方修改不会影响请求本身。
     */
    public ObjectNode getPayload() {
        return payload.deepCopy();
    }

    public boolean payloadFlag(String field) {
        JsonNode n = payload.get(field);
        return n != null && n.isBoolean() && n.booleanValue();
    }

    private static String normalizeOptional(String v) {
        if (v == null) return null;
        String t = v.trim();
        return t.isEmpty() ? null : t;
    }

    @Override
    public String toString() {
        return "ProofRequest{venue=" + venue.getSlug() + ", claimType=" + claimType
                + ", accountRef=" + accountRef + ", orderRef=" + orderRef + ", executionRef=" + executionRef + "}";
    }
}
