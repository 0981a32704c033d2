package com.work.zkreceipt.core.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.work.zkreceipt.core.adapter.VenueAdapter;
import com.work.zkreceipt.core.adapter.VenueAdapterRegistry;
import com.work.zkreceipt.core.integrity.ClaimHashes;
import com.work.zkreceipt.core.metrics.ReceiptMetrics;
import com.work.zkreceipt.core.model.EvidenceBundle;
import com.work.zkreceipt.core.model.ExecutionAck;
import com.work.zkreceipt.core.model.NonProvableReason;
import com.work.zkreceipt.core.model.ProofMetadata;
import com.work.zkreceipt.core.model.ProofRequest;
import com.work.zkreceipt.core.model.ZkReceipt;
import com.work.zkreceipt.core.policy.PolicyDecision;
import com.work.zkreceipt.core.policy.PolicyEngine;
import com.work.zkreceipt.core.prover.ProverBackend;
import com.work.zkreceipt.core.support.Timestamps;
import com.work.zkreceipt.core.verifier.ReceiptVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 单个 receipt 的后台流水线：adapter -> policy -> statement -> prover -> verifier。
 * <p>
 * 阶段严格按序执行、不自动重试；任一阶段失败都在原地转换为 NON_PROVABLE 终态返回，
 * 不会作为异常抛出。只有非业务性故障（例如 verifier 自身崩溃）才会冒泡给调用方。
 */
class ReceiptPipeline {

    private static final Logger log = LoggerFactory.getLogger(ReceiptPipeline.class);

    static final String VERIFICATION_FAILED_DETAILS = "Offchain verification failed for produced proof metadata.";

    private final VenueAdapterRegistry adapters;
    private final PolicyEngine policyEngine;
    private final ProverBackend prover;
    private final ReceiptVerifier verifier;
    private final ReceiptAssembler assembler;
    private final ReceiptMetrics metrics;

    ReceiptPipeline(VenueAdapterRegistry adapters,
                    PolicyEngine policyEngine,
                    ProverBackend prover,
                    ReceiptVerifier verifier,
                    ReceiptAssembler assembler,
                    ReceiptMetrics metrics) {
        this.adapters = adapters;
        this.policyEngine = policyEngine;
        this.prover = prover;
        this.verifier = verifier;
        this.assembler = assembler;
        this.metrics = metrics;
    }

    /**
     * @param pending submit 时写入的 PENDING 快照
     * @return 终态快照（PROVED 或 NON_PROVABLE）
     */
    ZkReceipt run(ZkReceipt pending, ProofRequest request) {
        String receiptId = pending.getReceiptId();

        // 1) adapter 查找：没有注册则不调用任何 adapter 方法
        Optional<VenueAdapter> found = adapters.find(request.getVenue());
        if (!found.isPresent()) {
            return fail(pending, "adapter_lookup", NonProvableReason.UNSUPPORTED_VENUE_CLAIM,
                    "No adapter registered for venue " + request.getVenue().getSlug());
        }
        VenueAdapter adapter = found.get();

        // 2) 受理确认
        ExecutionAck ack;
        try {
            ack = adapter.acknowledge(request);
        } catch (RuntimeException e) {
            return fail(pending, "acknowledge", NonProvableReason.SOURCE_UNAVAILABLE, messageOf(e));
        }
        if (ack == null) {
            return fail(pending, "acknowledge", NonProvableReason.SOURCE_UNAVAILABLE,
                    "Venue adapter returned no acknowledgement.");
        }

        // 3) 证据采集
        EvidenceBundle bundle;
        try {
            bundle = adapter.collectEvidence(request, ack);
        } catch (RuntimeException e) {
            return fail(pending, "collect_evidence", NonProvableReason.SOURCE_UNAVAILABLE, messageOf(e));
        }
        if (bundle == null) {
            bundle = EvidenceBundle.empty();
        }

        // 4) 策略判定
        PolicyDecision decision = policyEngine.evaluate(request.getVenue(), request.getClaimType(), bundle);
        if (!decision.isOk()) {
            return fail(pending, "policy", decision.reasonOrDefault(), decision.getDetails());
        }

        // 5) 陈述生成（失败沿用 POLICY_VIOLATION）
        String statement;
        try {
            statement = adapter.buildStatement(request, ack, bundle);
        } catch (RuntimeException e) {
            return fail(pending, "build_statement", NonProvableReason.POLICY_VIOLATION, messageOf(e));
        }
        if (statement == null || statement.trim().isEmpty()) {
            return fail(pending, "build_statement", NonProvableReason.POLICY_VIOLATION,
                    "Venue adapter produced an empty statement.");
        }

        // 6) 重算 claim 哈希并证明
        String claimHash = ClaimHashes.finalClaimHash(request.getClaimType(), statement,
                request.getOrderRef(), request.getExecutionRef());
        String evidenceRoot = bundle.evidenceRoot();
        ObjectNode publicInputs = ClaimHashes.publicInputs(claimHash, evidenceRoot, request.getVenue(), request.getClaimType());
        ProofMetadata proof;
        try {
            proof = prover.prove(publicInputs);
        } catch (RuntimeException e) {
            return fail(pending, "prove", NonProvableReason.PROOF_FAILURE, messageOf(e));
        }
        if (proof == null) {
            return fail(pending, "prove", NonProvableReason.PROOF_FAILURE, "Prover returned no proof metadata.");
        }

        // 7) 组装 PROVED
        ZkReceipt proved = assembler.proved(pending, claimHash, statement, bundle, proof, Timestamps.now());

        // 8) 校验；不通过则降级
        if (!verifier.verify(proved)) {
            metrics.stageFailure("verify");
            log.warn("receipt verification failed receiptId={} backend={}", receiptId, proof.getBackend());
            return assembler.nonProvable(proved, NonProvableReason.PROOF_FAILURE, VERIFICATION_FAILED_DETAILS, Timestamps.now());
        }
        log.debug("receipt proved receiptId={} backend={} evidenceRoot={}", receiptId, proof.getBackend(), evidenceRoot);
        return proved;
    }

    private ZkReceipt fail(ZkReceipt pending, String stage, NonProvableReason reason, String details) {
        metrics.stageFailure(stage);
        log.warn("receipt stage failed receiptId={} stage={} reason={} details={}",
                pending.getReceiptId(), stage, reason, details);
        return assembler.nonProvable(pending, reason, details, Timestamps.now());
    }

    private static String messageOf(RuntimeException e) {
        String m = e.getMessage();
        return m == null || m.trim().isEmpty() ? e.getClass().getSimpleName() : m;
    }
}
