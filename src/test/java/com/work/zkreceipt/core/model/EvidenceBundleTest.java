package com.work.zkreceipt.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EvidenceBundleTest {

    private static EvidenceItem item(String id, String hash) {
        return new EvidenceItem(id, "canonical_chain_state", "base://" + id, hash, Instant.EPOCH,
                Collections.singletonList("order_identity"));
    }

    @Test
    public void evidence_root_is_invariant_under_permutation() {
        List<EvidenceItem> items = Arrays.asList(item("a", "0x03"), item("b", "0x01"), item("c", "0x02"));
        String root = new EvidenceBundle(items, null, null, null).evidenceRoot();

        List<EvidenceItem> reversed = new ArrayList<>(items);
        Collections.reverse(reversed);
        assertEquals(root, new EvidenceBundle(reversed, null, null, null).evidenceRoot());

        List<EvidenceItem> rotated = Arrays.asList(items.get(1), items.get(2), items.get(0));
        assertEquals(root, new EvidenceBundle(rotated, null, null, null).evidenceRoot());
    }

    @Test
    public void evidence_root_depends_on_hashes_only() {
        String a = new EvidenceBundle(Collections.singletonList(item("a", "0x01")), null, null, null).evidenceRoot();
        String renamed = new EvidenceBundle(Collections.singletonList(item("other", "0x01")), null, null, null).evidenceRoot();
        String changed = new EvidenceBundle(Collections.singletonList(item("a", "0x02")), null, null, null).evidenceRoot();

        assertEquals(a, renamed);
        assertNotEquals(a, changed);
    }

    @Test
    public void empty_root_differs_from_root_of_no_leaves() {
        assertNotEquals(EvidenceBundle.emptyRoot(), EvidenceBundle.empty().evidenceRoot());
        assertEquals(EvidenceBundle.emptyRoot(), Provenance.empty().getEvidenceRoot());
    }

    @Test
    public void bundle_is_an_immutable_copy() {
        List<String> conflicts = new ArrayList<>();
        conflicts.add("source_value_mismatch");
        EvidenceBundle bundle = new EvidenceBundle(null, new HashSet<>(Arrays.asList("order_identity")), conflicts, null);
        conflicts.clear();

        assertTrue(bundle.hasConflicts());
        assertThrows(UnsupportedOperationException.class, () -> bundle.getObservedTags().add("x"));
        assertTrue(bundle.getItems().isEmpty());
    }
}
