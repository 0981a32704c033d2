package com.work.zkreceipt.core.engine;

import com.work.zkreceipt.core.integrity.ClaimHashes;
import com.work.zkreceipt.core.integrity.IntegrityCalculator;
import com.work.zkreceipt.core.model.EvidenceBundle;
import com.work.zkreceipt.core.model.NonProvable;
import com.work.zkreceipt.core.model.NonProvableReason;
import com.work.zkreceipt.core.model.PolicyContext;
import com.work.zkreceipt.core.model.ProofMetadata;
import com.work.zkreceipt.core.model.ProofRequest;
import com.work.zkreceipt.core.model.Provenance;
import com.work.zkreceipt.core.model.ReceiptStatus;
import com.work.zkreceipt.core.model.Subject;
import com.work.zkreceipt.core.model.Timing;
import com.work.zkreceipt.core.model.TruthClaim;
import com.work.zkreceipt.core.model.ZkReceipt;

import java.time.Instant;

import static com.work.zkreceipt.core.support.ValidationUtils.requireNonNull;

/**
 * receipt 快照的构造与状态推进。每一次推进都重算 integrity 并刷新 updatedAt。
 */
class ReceiptAssembler {

    static final String PENDING_STATEMENT = "PENDING: statement unavailable until evidence collection completes";

    private final IntegrityCalculator integrity;

    ReceiptAssembler(IntegrityCalculator integrity) {
        this.integrity = requireNonNull(integrity, "integrity");
    }

    ZkReceipt pending(String receiptId, ProofRequest request, PolicyContext policy, Instant now) {
        String claimHash = ClaimHashes.pendingClaimHash(request);
        Provenance provenance = Provenance.empty();
        ProofMetadata proof = ProofMetadata.none();
        return ZkReceipt.builder()
                .receiptId(receiptId)
                .version(integrity.getReceiptVersion())
                .status(ReceiptStatus.PENDING)
                .claim(new TruthClaim(request.getClaimType(), PENDING_STATEMENT, claimHash))
                .subject(Subject.of(request))
                .policy(policy)
                .provenance(provenance)
                .timing(Timing.created(now))
                .proof(proof)
                .integrity(integrity.compute(ReceiptStatus.PENDING, claimHash,
                        provenance.getEvidenceRoot(), proof.getPublicInputsHash()))
                .build();
    }

    ZkReceipt proved(ZkReceipt base,
                     String claimHash,
                     String statement,
                     EvidenceBundle bundle,
                     ProofMetadata proof,
                     Instant now) {
        Provenance provenance = Provenance.of(bundle);
        return base.toBuilder()
                .status(ReceiptStatus.PROVED)
                .claim(new TruthClaim(base.getClaim().getType(), statement, claimHash))
                .provenance(provenance)
                .timing(base.getTiming().observed(now, now, bundle.getFinalityObservedAt()))
                .proof(proof)
                .integrity(integrity.compute(ReceiptStatus.PROVED, claimHash,
                        provenance.getEvidenceRoot(), proof.getPublicInputsHash()))
                .nonProvable(null)
                .build();
    }

    /**
     * NON_PROVABLE 终态：保留 claim 与 provenance，证明元数据回到 NONE 占位。
     */
    ZkReceipt nonProvable(ZkReceipt base, NonProvableReason reason, String details, Instant now) {
        ProofMetadata proof = ProofMetadata.none();
        return base.toBuilder()
                .status(ReceiptStatus.NON_PROVABLE)
                .nonProvable(new NonProvable(reason, details))
                .timing(base.getTiming().touched(now))
                .proof(proof)
                .integrity(integrity.compute(ReceiptStatus.NON_PROVABLE, base.getClaim().getClaimHash(),
                        base.getProvenance().getEvidenceRoot(), proof.getPublicInputsHash()))
                .build();
    }
}
