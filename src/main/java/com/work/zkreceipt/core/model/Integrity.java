package com.work.zkreceipt.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Objects;

/**
 * 完整性链。signature 只是基于哈希的确定性占位，并非真实签名。
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class Integrity {

    private final String schemaHash;
    private final String receiptHash;
    private final String signer;
    private final String signature;

    public Integrity(String schemaHash, String receiptHash, String signer, String signature) {
        this.schemaHash = schemaHash;
        this.receiptHash = receiptHash;
        this.signer = signer;
        this.signature = signature;
    }

    public String getSchemaHash() {
        return schemaHash;
    }

    public String getReceiptHash() {
        return receiptHash;
    }

    public String getSigner() {
        return signer;
    }

    public String getSignature() {
        return signature;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Integrity)) return false;
        Integrity that = (Integrity) o;
        return Objects.equals(schemaHash, that.schemaHash)
                && Objects.equals(receiptHash, that.receiptHash)
                && Objects.equals(signer, that.signer)
                && Objects.equals(signature, that.signature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schemaHash, receiptHash, signer, signature);
    }
}
