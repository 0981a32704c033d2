package com.work.zkreceipt.core.prover;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.work.zkreceipt.core.model.ProofBackend;
import com.work.zkreceipt.core.model.ProofMetadata;

/**
 * 证明后端端口。引擎只要求返回的 publicInputsHash 可由传入的公开输入复现。
 * 失败通过 {@link com.work.zkreceipt.core.exception.ProofGenerationException} 表达。
 */
public interface ProverBackend {

    ProofBackend backend();

    ProofMetadata prove(ObjectNode publicInputs);
}
