package com.work.zkreceipt.core.verifier;

import com.work.zkreceipt.core.integrity.ClaimHashes;
import com.work.zkreceipt.core.model.ProofBackend;
import com.work.zkreceipt.core.model.ReceiptStatus;
import com.work.zkreceipt.core.model.ZkReceipt;

/**
 * 链下一致性校验：重算公开输入哈希并与证明元数据中记录的值比对。
 * <p>
 * 只有同时满足以下条件才返回 true：
 * - status == PROVED
 * - proof.backend != NONE
 * - H{claim_hash, evidence_root, venue, claim_type} == proof.public_inputs_hash
 */
public class OffchainVerifier implements ReceiptVerifier {

    @Override
    public boolean verify(ZkReceipt receipt) {
        if (receipt == null || receipt.getStatus() != ReceiptStatus.PROVED) {
            return false;
        }
        if (receipt.getProof().getBackend() == ProofBackend.NONE) {
            return false;
        }
        String expected = ClaimHashes.publicInputsHash(
                receipt.getClaim().getClaimHash(),
                receipt.getProvenance().getEvidenceRoot(),
                receipt.getSubject().getVenue(),
                receipt.getClaim().getType());
        return expected.equals(receipt.getProof().getPublicInputsHash());
    }
}
