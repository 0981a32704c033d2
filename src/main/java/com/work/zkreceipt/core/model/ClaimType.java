package com.work.zkreceipt.core.model;

/**
 * 被证明的真实世界事件类型。
 */
public enum ClaimType {
    ORDER_PLACED,
    TRADE_EXECUTED
}
