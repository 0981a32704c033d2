package com.work.zkreceipt.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import static com.work.zkreceipt.core.support.ValidationUtils.requireNonEmpty;
import static com.work.zkreceipt.core.support.ValidationUtils.requireNonNull;

/**
 * 对外返回的 receipt 聚合（不可变快照）。
 * <p>
 * 状态推进时由引擎通过 {@link #toBuilder()} 构造新快照整体替换，从不原地修改；
 * 因此 adapter / prover / verifier 拿到的永远是只读快照。
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class ZkReceipt {

    private final String receiptId;
    private final String version;
    private final ReceiptStatus status;
    private final TruthClaim claim;
    private final Subject subject;
    private final PolicyContext policy;
    private final Provenance provenance;
    private final Timing timing;
    private final ProofMetadata proof;
    private final Integrity integrity;
    private final NonProvable nonProvable;

    private ZkReceipt(Builder b) {
        this.receiptId = requireNonEmpty(b.receiptId, "receiptId");
        this.version = requireNonEmpty(b.version, "version");
        this.status = requireNonNull(b.status, "status");
        this.claim = requireNonNull(b.claim, "claim");
        this.subject = requireNonNull(b.subject, "subject");
        this.policy = requireNonNull(b.policy, "policy");
        this.provenance = requireNonNull(b.provenance, "provenance");
        this.timing = requireNonNull(b.timing, "timing");
        this.proof = requireNonNull(b.proof, "proof");
        this.integrity = requireNonNull(b.integrity, "integrity");
        this.nonProvable = b.nonProvable;
        if (status == ReceiptStatus.NON_PROVABLE && nonProvable == null) {
            throw new IllegalArgumentException("NON_PROVABLE receipt 必须携带 nonProvable");
        }
        if (status != ReceiptStatus.NON_PROVABLE && nonProvable != null) {
            throw new IllegalArgumentException("只有 NON_PROVABLE receipt 可以携带 nonProvable");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.receiptId = receiptId;
        b.version = version;
        b.status = status;
        b.claim = claim;
        b.subject = subject;
        b.policy = policy;
        b.provenance = provenance;
        b.timing = timing;
        b.proof = proof;
        b.integrity = integrity;
        b.nonProvable = nonProvable;
        return b;
    }

    public String getReceiptId() {
        return receiptId;
    }

    public String getVersion() {
        return version;
    }

    public ReceiptStatus getStatus() {
        return status;
    }

    public TruthClaim getClaim() {
        return claim;
    }

    public Subject getSubject() {
        return subject;
    }

    public PolicyContext getPolicy() {
        return policy;
    }

    public Provenance getProvenance() {
        return provenance;
    }

    public Timing getTiming() {
        return timing;
    }

    public ProofMetadata getProof() {
        return proof;
    }

    public Integrity getIntegrity() {
        return integrity;
    }

    public NonProvable getNonProvable() {
        return nonProvable;
    }

    @Override
    public String toString() {
        return "ZkReceipt{receiptId=" + receiptId + ", status=" + status
                + (nonProvable == null ? "" : ", reason=" + nonProvable.getReasonCode()) + "}";
    }

    public static final class Builder {
        private String receiptId;
        private String version;
        private ReceiptStatus status;
        private TruthClaim claim;
        private Subject subject;
        private PolicyContext policy;
        private Provenance provenance;
        private Timing timing;
        private ProofMetadata proof;
        private Integrity integrity;
        private NonProvable nonProvable;

        private Builder() {
        }

        public Builder receiptId(String receiptId) {
            this.receiptId = receiptId;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder status(ReceiptStatus status) {
            this.status = status;
            return this;
        }

        public Builder claim(TruthClaim claim) {
            this.claim = claim;
            return this;
        }

        public Builder subject(Subject subject) {
            this.subject = subject;
            return this;
        }

        public Builder policy(PolicyContext policy) {
            this.policy = policy;
            return this;
        }

        public Builder provenance(Provenance provenance) {
            this.provenance = provenance;
            return this;
        }

        public Builder timing(Timing timing) {
            this.timing = timing;
            return this;
        }

        public Builder proof(ProofMetadata proof) {
            this.proof = proof;
            return this;
        }

        public Builder integrity(Integrity integrity) {
            this.integrity = integrity;
            return this;
        }

        public Builder nonProvable(NonProvable nonProvable) {
            this.nonProvable = nonProvable;
            return this;
        }

        public ZkReceipt build() {
            return new ZkReceipt(this);
        }
    }
}
