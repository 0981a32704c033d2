package com.work.zkreceipt.demo.web.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.work.zkreceipt.core.model.ReceiptStatus;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReceiptVerificationView {

    private String receiptId;
    private ReceiptStatus status;
    private boolean verified;

    public String getReceiptId() {
        return receiptId;
    }

    public void setReceiptId(String receiptId) {
        this.receiptId = receiptId;
    }

    public ReceiptStatus getStatus() {
        return status;
    }

    public void setStatus(ReceiptStatus status) {
        this.status = status;
    }

    public boolean isVerified() {
        return verified;
    }

    public void setVerified(boolean verified) {
        this.verified = verified;
    }
}
