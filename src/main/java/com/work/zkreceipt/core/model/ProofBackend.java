package com.work.zkreceipt.core.model;

/**
 * 证明后端标识。NONE 为哨兵值，表示尚未证明或证明失败。
 */
public enum ProofBackend {
    SP1,
    PICO,
    NONE
}
