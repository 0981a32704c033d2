package com.work.zkreceipt.core.metrics;

/**
 * 不记录任何 receipt 计数，未提供 ReceiptMetrics Bean 时装配。
 */
public class NoopReceiptMetrics implements ReceiptMetrics {
}
