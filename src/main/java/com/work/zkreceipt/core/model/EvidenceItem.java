package com.work.zkreceipt.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.work.zkreceipt.core.support.TimestampSerializer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.work.zkreceipt.core.support.ValidationUtils.requireNonEmpty;
import static com.work.zkreceipt.core.support.ValidationUtils.requireNonNull;

/**
 * 一条被观测到的证据工件。
 * <p>
 * sourceKind 参与 source precedence 判定；tags 表示该证据满足的语义标签（如 order_identity）。
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class EvidenceItem {

    private final String sourceId;
    private final String sourceKind;
    private final String artifactRef;
    private final String artifactHash;
    private final Instant observedAt;
    private final List<String> tags;

    public EvidenceItem(String sourceId,
                        String sourceKind,
                        String artifactRef,
                        String artifactHash,
                        Instant observedAt,
                        List<String> tags) {
        this.sourceId = requireNonEmpty(sourceId, "sourceId");
        this.sourceKind = requireNonEmpty(sourceKind, "sourceKind");
        this.artifactRef = requireNonEmpty(artifactRef, "artifactRef");
        this.artifactHash = requireNonEmpty(artifactHash, "artifactHash");
        this.observedAt = requireNonNull(observedAt, "observedAt");
        this.tags = tags == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(tags));
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getSourceKind() {
        return sourceKind;
    }

    public String getArtifactRef() {
        return artifactRef;
    }

    public String getArtifactHash() {
        return artifactHash;
    }

    @JsonSerialize(using = TimestampSerializer.class)
    public Instant getObservedAt() {
        return observedAt;
    }

    public List<String> getTags() {
        return tags;
    }
}
