package com.work.zkreceipt.core.integrity;

import com.work.zkreceipt.core.model.ClaimType;
import com.work.zkreceipt.core.model.EvidenceBundle;
import com.work.zkreceipt.core.model.Integrity;
import com.work.zkreceipt.core.model.ProofRequest;
import com.work.zkreceipt.core.model.ReceiptStatus;
import com.work.zkreceipt.core.model.Venue;
import com.work.zkreceipt.core.support.CanonicalHasher;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class IntegrityCalculatorTest {

    private static final String CLAIM = CanonicalHasher.hashString("claim");
    private static final String ROOT = EvidenceBundle.emptyRoot();

    @Test
    public void compute_is_deterministic() {
        IntegrityCalculator a = new IntegrityCalculator("zkputer-dev-signer", "v0.1.0");
        IntegrityCalculator b = new IntegrityCalculator("zkputer-dev-signer", "v0.1.0");

        Integrity first = a.compute(ReceiptStatus.PROVED, CLAIM, ROOT, CanonicalHasher.ZERO_HASH);
        Integrity second = b.compute(ReceiptStatus.PROVED, CLAIM, ROOT, CanonicalHasher.ZERO_HASH);

        assertEquals(first, second);
        assertEquals(first, IntegrityCalculator.compute("zkputer-dev-signer", "v0.1.0",
                ReceiptStatus.PROVED, CLAIM, ROOT, CanonicalHasher.ZERO_HASH));
    }

    @Test
    public void chain_matches_documented_formula() {
        Integrity i = new IntegrityCalculator("signer-x", "v9").compute(ReceiptStatus.PENDING, CLAIM, ROOT, CanonicalHasher.ZERO_HASH);

        assertEquals(CanonicalHasher.hashOf("schema", "zkreceipt.schema.json", "version", "v9"), i.getSchemaHash());
        String receiptHash = CanonicalHasher.hashOf("status", "PENDING", "claim_hash", CLAIM,
                "evidence_root", ROOT, "proof_hash", CanonicalHasher.ZERO_HASH);
        assertEquals(receiptHash, i.getReceiptHash());
        assertEquals(CanonicalHasher.hashOf("signer", "signer-x", "receipt_hash", receiptHash), i.getSignature());
        assertEquals("signer-x", i.getSigner());
    }

    @Test
    public void every_input_changes_the_receipt_hash() {
        IntegrityCalculator calc = new IntegrityCalculator("zkputer-dev-signer", "v0.1.0");
        Integrity base = calc.compute(ReceiptStatus.PROVED, CLAIM, ROOT, CanonicalHasher.ZERO_HASH);

        assertNotEquals(base.getReceiptHash(), calc.compute(ReceiptStatus.NON_PROVABLE, CLAIM, ROOT, CanonicalHasher.ZERO_HASH).getReceiptHash());
        assertNotEquals(base.getReceiptHash(), calc.compute(ReceiptStatus.PROVED, ROOT, ROOT, CanonicalHasher.ZERO_HASH).getReceiptHash());
        assertNotEquals(base.getReceiptHash(), calc.compute(ReceiptStatus.PROVED, CLAIM, CLAIM, CanonicalHasher.ZERO_HASH).getReceiptHash());
        assertNotEquals(base.getReceiptHash(), calc.compute(ReceiptStatus.PROVED, CLAIM, ROOT, CLAIM).getReceiptHash());

        Integrity otherSigner = new IntegrityCalculator("other", "v0.1.0").compute(ReceiptStatus.PROVED, CLAIM, ROOT, CanonicalHasher.ZERO_HASH);
        assertEquals(base.getReceiptHash(), otherSigner.getReceiptHash());
        assertNotEquals(base.getSignature(), otherSigner.getSignature());
    }

    @Test
    public void pending_claim_hash_binds_execution_ref() {
        ProofRequest without = new ProofRequest(Venue.BASE, ClaimType.TRADE_EXECUTED, "acct-1", "order-1", null);
        ProofRequest with = new ProofRequest(Venue.BASE, ClaimType.TRADE_EXECUTED, "acct-1", "order-1", "exec-1");

        assertNotEquals(ClaimHashes.pendingClaimHash(without), ClaimHashes.pendingClaimHash(with));
        assertEquals(ClaimHashes.pendingClaimHash(with),
                ClaimHashes.pendingClaimHash(new ProofRequest(Venue.BASE, ClaimType.TRADE_EXECUTED, "acct-1", "order-1", "exec-1")));
    }

    @Test
    public void public_inputs_hash_uses_venue_slug() {
        String expected = CanonicalHasher.hashOf("claim_hash", CLAIM, "evidence_root", ROOT,
                "venue", "hyperliquid", "claim_type", "ORDER_PLACED");
        assertEquals(expected, ClaimHashes.publicInputsHash(CLAIM, ROOT, Venue.HYPERLIQUID, ClaimType.ORDER_PLACED));
    }
}
