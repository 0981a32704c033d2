package com.work.zkreceipt.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class NonProvable {

    private final NonProvableReason reasonCode;
    private final String details;

    public NonProvable(NonProvableReason reasonCode, String details) {
        this.reasonCode = reasonCode;
        this.details = details == null ? "" : details;
    }

    public NonProvableReason getReasonCode() {
        return reasonCode;
    }

    public String getDetails() {
        return details;
    }
}
