package com.work.zkreceipt.core.exception;

/**
 * 后台流水线本身发生了非业务性故障（区别于 NON_PROVABLE 业务结果）。
 */
public class ReceiptTaskFailedException extends ReceiptException {

    private final String receiptId;

    public ReceiptTaskFailedException(String receiptId, Throwable cause) {
        super("receipt task failed, receiptId=" + receiptId + ", err=" + cause, cause);
        this.receiptId = receiptId;
    }

    public String getReceiptId() {
        return receiptId;
    }
}
