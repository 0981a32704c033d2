package com.work.zkreceipt.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.work.zkreceipt.core.support.CanonicalHasher;

import static com.work.zkreceipt.core.support.ValidationUtils.requireNonEmpty;
import static com.work.zkreceipt.core.support.ValidationUtils.requireNonNull;

/**
 * 与具体证明后端无关的证明描述，以及其绑定的公开输入哈希。
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class ProofMetadata {

    private static final ProofMetadata NONE = new ProofMetadata(
            ProofBackend.NONE, "none", "none", "none",
            CanonicalHasher.ZERO_HASH, CanonicalHasher.ZERO_HASH,
            VerificationMode.OFFCHAIN, null, null);

    private final ProofBackend backend;
    private final String circuitId;
    private final String circuitVersion;
    private final String verifierKeyId;
    private final String verifierKeyHash;
    private final String publicInputsHash;
    private final VerificationMode verificationMode;
    private final String proofArtifactRef;
    private final String anchoredRootRef;

    public ProofMetadata(ProofBackend backend,
                         String circuitId,
                         String circuitVersion,
                         String verifierKeyId,
                         String verifierKeyHash,
                         String publicInputsHash,
                         VerificationMode verificationMode,
                         String proofArtifactRef,
                         String anchoredRootRef) {
        this.backend = requireNonNull(backend, "backend");
        this.circuitId = requireNonEmpty(circuitId, "circuitId");
        this.circuitVersion = requireNonEmpty(circuitVersion, "circuitVersion");
        this.verifierKeyId = requireNonEmpty(verifierKeyId, "verifierKeyId");
        this.verifierKeyHash = requireNonEmpty(verifierKeyHash, "verifierKeyHash");
        this.publicInputsHash = requireNonEmpty(publicInputsHash, "publicInputsHash");
        this.verificationMode = requireNonNull(verificationMode, "verificationMode");
        this.proofArtifactRef = proofArtifactRef;
        this.anchoredRootRef = anchoredRootRef;
    }

    /**
     * “尚无证明”占位：PENDING 与 NON_PROVABLE receipt 都使用它。
     */
    public static ProofMetadata none() {
        return NONE;
    }

    public ProofBackend getBackend() {
        return backend;
    }

    public String getCircuitId() {
        return circuitId;
    }

    public String getCircuitVersion() {
        return circuitVersion;
    }

    public String getVerifierKeyId() {
        return verifierKeyId;
    }

    public String getVerifierKeyHash() {
        return verifierKeyHash;
    }

    public String getPublicInputsHash() {
        return publicInputsHash;
    }

    public VerificationMode getVerificationMode() {
        return verificationMode;
    }

    public String getProofArtifactRef() {
        return proofArtifactRef;
    }

    public String getAnchoredRootRef() {
        return anchoredRootRef;
    }
}
