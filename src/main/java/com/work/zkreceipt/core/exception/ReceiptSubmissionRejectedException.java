package com.work.zkreceipt.core.exception;

/**
 * 后台执行队列已满，提交被拒绝。调用方可稍后重试。
 */
public class ReceiptSubmissionRejectedException extends ReceiptException {

    public ReceiptSubmissionRejectedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
