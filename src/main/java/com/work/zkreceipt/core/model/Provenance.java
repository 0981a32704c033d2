package com.work.zkreceipt.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class Provenance {

    private final String evidenceRoot;
    private final List<EvidenceItem> evidenceItems;

    public Provenance(String evidenceRoot, List<EvidenceItem> evidenceItems) {
        this.evidenceRoot = evidenceRoot;
        this.evidenceItems = evidenceItems == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(evidenceItems));
    }

    public static Provenance empty() {
        return new Provenance(EvidenceBundle.emptyRoot(), null);
    }

    public static Provenance of(EvidenceBundle bundle) {
        return new Provenance(bundle.evidenceRoot(), bundle.getItems());
    }

    public String getEvidenceRoot() {
        return evidenceRoot;
    }

    public List<EvidenceItem> getEvidenceItems() {
        return evidenceItems;
    }
}
