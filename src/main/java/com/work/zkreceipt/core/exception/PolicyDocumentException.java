package com.work.zkreceipt.core.exception;

/**
 * 策略文档缺失、无法解析或不满足约束。属于启动期错误，不可重试。
 */
public class PolicyDocumentException extends ReceiptException {

    public PolicyDocumentException(String message) {
        super(message);
    }

    public PolicyDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
