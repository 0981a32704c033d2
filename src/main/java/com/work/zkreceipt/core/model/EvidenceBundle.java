package com.work.zkreceipt.core.model;

import com.work.zkreceipt.core.support.CanonicalHasher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 一次采集得到的证据集合。
 * <p>
 * observedTags 与 items 的 tags 可以不一致：adapter 可能在采集后剔除某些标签（例如来源不可信），
 * 策略判定只看 observedTags。
 */
public final class EvidenceBundle {

    private final List<EvidenceItem> items;
    private final Set<String> observedTags;
    private final List<String> conflicts;
    private final Instant finalityObservedAt;

    public EvidenceBundle(List<EvidenceItem> items,
                          Set<String> observedTags,
                          List<String> conflicts,
                          Instant finalityObservedAt) {
        this.items = items == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(items));
        this.observedTags = observedTags == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(observedTags));
        this.conflicts = conflicts == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(conflicts));
        this.finalityObservedAt = finalityObservedAt;
    }

    public static EvidenceBundle empty() {
        return new EvidenceBundle(null, null, null, null);
    }

    public List<EvidenceItem> getItems() {
        return items;
    }

    public Set<String> getObservedTags() {
        return observedTags;
    }

    public List<String> getConflicts() {
        return conflicts;
    }

    public Instant getFinalityObservedAt() {
        return finalityObservedAt;
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    /**
     * 证据根：对所有 artifactHash 排序后做规范化哈希，与采集顺序无关。
     */
    public String evidenceRoot() {
        List<String> leaves = new ArrayList<>(items.size());
        for (EvidenceItem item : items) {
            leaves.add(item.getArtifactHash());
        }
        Collections.sort(leaves);
        return CanonicalHasher.hashOf("leaves", leaves);
    }

    /**
     * 尚未采集证据时 provenance 使用的根。
     */
    public static String emptyRoot() {
        return CanonicalHasher.hashOf("empty", Boolean.TRUE);
    }
}
