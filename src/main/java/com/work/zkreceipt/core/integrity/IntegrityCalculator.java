package com.work.zkreceipt.core.integrity;

import com.work.zkreceipt.core.model.Integrity;
import com.work.zkreceipt.core.model.ReceiptStatus;
import com.work.zkreceipt.core.model.ZkReceipt;
import com.work.zkreceipt.core.support.CanonicalHasher;

import static com.work.zkreceipt.core.support.ValidationUtils.requireNonEmpty;
import static com.work.zkreceipt.core.support.ValidationUtils.requireNonNull;

/**
 * 完整性链计算：
 * <pre>
 * schema_hash  = H{schema, version}
 * receipt_hash = H{status, claim_hash, evidence_root, proof_hash}
 * signature    = H{signer, receipt_hash}
 * </pre>
 * 每次输入变化都整体重算，从不增量修补。
 */
public class IntegrityCalculator {

    static final String SCHEMA_NAME = "zkreceipt.schema.json";

    private final String signer;
    private final String receiptVersion;

    public IntegrityCalculator(String signer, String receiptVersion) {
        this.signer = requireNonEmpty(signer, "signer");
        this.receiptVersion = requireNonEmpty(receiptVersion, "receiptVersion");
    }

    public String getSigner() {
        return signer;
    }

    public String getReceiptVersion() {
        return receiptVersion;
    }

    public Integrity compute(ReceiptStatus status, String claimHash, String evidenceRoot, String proofHash) {
        return compute(signer, receiptVersion, status, claimHash, evidenceRoot, proofHash);
    }

    /**
     * 按 receipt 当前内容重算（用于校验已存 receipt 的 integrity 是否被篡改）。
     */
    public Integrity recompute(ZkReceipt receipt) {
        return compute(receipt.getIntegrity().getSigner(), receipt.getVersion(), receipt.getStatus(),
                receipt.getClaim().getClaimHash(),
                receipt.getProvenance().getEvidenceRoot(),
                receipt.getProof().getPublicInputsHash());
    }

    public static Integrity compute(String signer,
                                    String receiptVersion,
                                    ReceiptStatus status,
                                    String claimHash,
                                    String evidenceRoot,
                                    String proofHash) {
        requireNonNull(status, "status");
        String schemaHash = CanonicalHasher.hashOf(
                "schema", SCHEMA_NAME,
                "version", receiptVersion);
        String receiptHash = CanonicalHasher.hashOf(
                "status", status.name(),
                "claim_hash", claimHash,
                "evidence_root", evidenceRoot,
                "proof_hash", proofHash);
        String signature = CanonicalHasher.hashOf(
                "signer", signer,
                "receipt_hash", receiptHash);
        return new Integrity(schemaHash, receiptHash, signer, signature);
    }
}
