package com.work.zkreceipt.core.exception;

import java.time.Duration;

/**
 * 等待超时：只限制调用方的等待时间，后台流水线不会被取消，结果最终仍会写入存储。
 * 调用方应改用 getReceipt 轮询。
 */
public class ReceiptWaitTimeoutException extends ReceiptException {

    private final String receiptId;
    private final Duration timeout;

    public ReceiptWaitTimeoutException(String receiptId, Duration timeout, Throwable cause) {
        super("timeout waiting for receipt task, receiptId=" + receiptId + ", timeout=" + timeout, cause);
        this.receiptId = receiptId;
        this.timeout = timeout;
    }

    public String getReceiptId() {
        return receiptId;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
