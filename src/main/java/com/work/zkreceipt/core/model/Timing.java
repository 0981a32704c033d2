package com.work.zkreceipt.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.work.zkreceipt.core.support.TimestampSerializer;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class Timing {

    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant executionObservedAt;
    private final Instant finalityObservedAt;

    public Timing(Instant createdAt, Instant updatedAt, Instant executionObservedAt, Instant finalityObservedAt) {
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.executionObservedAt = executionObservedAt;
        this.finalityObservedAt = finalityObservedAt;
    }

    public static Timing created(Instant now) {
        return new Timing(now, now, null, null);
    }

    public Timing touched(Instant now) {
        return new Timing(createdAt, now, executionObservedAt, finalityObservedAt);
    }

    public Timing observed(Instant now, Instant executionObservedAt, Instant finalityObservedAt) {
        return new Timing(createdAt, now, executionObservedAt, finalityObservedAt);
    }

    @JsonSerialize(using = TimestampSerializer.class)
    public Instant getCreatedAt() {
        return createdAt;
    }

    @JsonSerialize(using = TimestampSerializer.class)
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @JsonSerialize(using = TimestampSerializer.class)
    public Instant getExecutionObservedAt() {
        return executionObservedAt;
    }

    @JsonSerialize(using = TimestampSerializer.class)
    public Instant getFinalityObservedAt() {
        return finalityObservedAt;
    }
}
