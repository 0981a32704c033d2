package com.work.zkreceipt.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class Subject {

    private final Venue venue;
    private final String accountRef;
    private final String orderRef;
    private final String executionRef;

    public Subject(Venue venue, String accountRef, String orderRef, String executionRef) {
        this.venue = venue;
        this.accountRef = accountRef;
        this.orderRef = orderRef;
        this.executionRef = executionRef;
    }

    public static Subject of(ProofRequest request) {
        return new Subject(request.getVenue(), request.getAccountRef(), request.getOrderRef(), request.getExecutionRef());
    }

    public Venue getVenue() {
        return venue;
    }

    public String getAccountRef() {
        return accountRef;
    }

    public String getOrderRef() {
        return orderRef;
    }

    public String getExecutionRef() {
        return executionRef;
    }
}
