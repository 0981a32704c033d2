package com.work.zkreceipt.core.exception;

/**
 * 证明后端生成证明失败。流水线会把它转换为 NON_PROVABLE / PROOF_FAILURE。
 */
public class ProofGenerationException extends ReceiptException {

    public ProofGenerationException(String message) {
        super(message);
    }

    public ProofGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
