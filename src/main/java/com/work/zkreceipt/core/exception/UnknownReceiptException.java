package com.work.zkreceipt.core.exception;

public class UnknownReceiptException extends ReceiptException {

    private final String receiptId;

    public UnknownReceiptException(String receiptId) {
        super("unknown receipt id: " + receiptId);
        this.receiptId = receiptId;
    }

    public String getReceiptId() {
        return receiptId;
    }
}
