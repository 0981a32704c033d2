package com.work.zkreceipt.core.model;

/**
 * receipt 状态机：PENDING -> {PROVED, NON_PROVABLE}。
 */
public enum ReceiptStatus {
    PENDING,
    PROVED,
    NON_PROVABLE,
    /** 预留给后续的撤销流程，当前流水线不会产生。 */
    INVALIDATED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
