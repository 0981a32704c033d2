package com.work.zkreceipt.core.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.work.zkreceipt.core.support.TimestampSerializer;

import java.time.Instant;

import static com.work.zkreceipt.core.support.ValidationUtils.requireNonEmpty;
import static com.work.zkreceipt.core.support.ValidationUtils.requireNonNull;

/**
 * 场所对订单的受理回执（每个请求由 adapter 产出一次）。
 */
public final class ExecutionAck {

    private final boolean accepted;
    private final String venueOrderRef;
    private final String acceptanceArtifactRef;
    private final String acceptanceArtifactHash;
    private final Instant acceptedAt;

    public ExecutionAck(boolean accepted,
                        String venueOrderRef,
                        String acceptanceArtifactRef,
                        String acceptanceArtifactHash,
                        Instant acceptedAt) {
        this.accepted = accepted;
        this.venueOrderRef = requireNonEmpty(venueOrderRef, "venueOrderRef");
        this.acceptanceArtifactRef = requireNonEmpty(acceptanceArtifactRef, "acceptanceArtifactRef");
        this.acceptanceArtifactHash = requireNonEmpty(acceptanceArtifactHash, "acceptanceArtifactHash");
        this.acceptedAt = requireNonNull(acceptedAt, "acceptedAt");
    }

    public boolean isAccepted() {
        return accepted;
    }

    public String getVenueOrderRef() {
        return venueOrderRef;
    }

    public String getAcceptanceArtifactRef() {
        return acceptanceArtifactRef;
    }

    public String getAcceptanceArtifactHash() {
        return acceptanceArtifactHash;
    }

    @JsonSerialize(using = TimestampSerializer.class)
    public Instant getAcceptedAt() {
        return acceptedAt;
    }
}
