package com.work.zkreceipt.demo.prover;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.work.zkreceipt.core.model.ProofBackend;
import com.work.zkreceipt.core.model.ProofMetadata;
import com.work.zkreceipt.core.model.VerificationMode;
import com.work.zkreceipt.core.prover.ProverBackend;
import com.work.zkreceipt.core.support.CanonicalHasher;

import static com.work.zkreceipt.core.support.ValidationUtils.requireNonNull;

/**
 * SP1 后端的 MVP 实现：不做真实证明，只产出与公共输入绑定的证明元数据。
 */
public class Sp1MvpProver implements ProverBackend {

    static final String CIRCUIT_ID = "trade-receipt-sp1";
    static final String CIRCUIT_VERSION = "v0.1.0";
    static final String VERIFIER_KEY_ID = "sp1-vk-001";
    static final String VERIFIER_KEY_HASH = CanonicalHasher.hashOf("backend", "SP1", "verifier_key", "001");

    @Override
    public ProofBackend backend() {
        return ProofBackend.SP1;
    }

    @Override
    public ProofMetadata prove(ObjectNode publicInputs) {
        requireNonNull(publicInputs, "publicInputs");
        String publicInputsHash = CanonicalHasher.hash(publicInputs);
        return new ProofMetadata(ProofBackend.SP1,
                CIRCUIT_ID,
                CIRCUIT_VERSION,
                VERIFIER_KEY_ID,
                VERIFIER_KEY_HASH,
                publicInputsHash,
                VerificationMode.OFFCHAIN,
                "boundless://sp1/" + publicInputsHash,
                null);
    }
}
