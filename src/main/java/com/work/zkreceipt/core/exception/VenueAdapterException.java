package com.work.zkreceipt.core.exception;

/**
 * adapter 受理/采集/陈述生成失败。流水线会把它转换为 NON_PROVABLE 终态。
 */
public class VenueAdapterException extends ReceiptException {

    public VenueAdapterException(String message) {
        super(message);
    }

    public VenueAdapterException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
