package com.work.zkreceipt.core.policy;

import com.work.zkreceipt.core.model.ClaimType;
import com.work.zkreceipt.core.model.EvidenceBundle;
import com.work.zkreceipt.core.model.EvidenceItem;
import com.work.zkreceipt.core.model.NonProvableReason;
import com.work.zkreceipt.core.model.PolicyContext;
import com.work.zkreceipt.core.model.Venue;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class PolicyEngineTest {

    private static final Set<String> ORDER_TAGS =
            new HashSet<>(Arrays.asList("order_identity", "submission_timestamp", "venue_acceptance_artifact"));

    private final PolicyEngine engine = PolicyFixtures.defaultPolicyEngine();

    private static EvidenceItem item(String kind) {
        return new EvidenceItem("src", kind, "base://ack/order-1", "0x01", Instant.EPOCH, Collections.emptyList());
    }

    private static EvidenceBundle bundle(List<EvidenceItem> items, Set<String> tags, List<String> conflicts) {
        return new EvidenceBundle(items, tags, conflicts, null);
    }

    @Test
    public void accepts_complete_evidence_from_preferred_source() {
        PolicyDecision d = engine.evaluate(Venue.BASE, ClaimType.ORDER_PLACED,
                bundle(Collections.singletonList(item("canonical_chain_state")), ORDER_TAGS, null));
        assertTrue(d.isOk());
        assertNull(d.getReason());
    }

    @Test
    public void conflict_has_top_priority() {
        // 同时没有证据、缺 tag：仍然报告冲突
        PolicyDecision d = engine.evaluate(Venue.BASE, ClaimType.ORDER_PLACED,
                bundle(null, null, Arrays.asList("source_value_mismatch", "timestamp_skew")));
        assertFalse(d.isOk());
        assertEquals(NonProvableReason.EVIDENCE_CONFLICT, d.getReason());
        assertEquals("Conflicting evidence entries detected: source_value_mismatch, timestamp_skew", d.getDetails());
    }

    @Test
    public void empty_items_checked_before_tags() {
        PolicyDecision d = engine.evaluate(Venue.BASE, ClaimType.ORDER_PLACED, bundle(null, ORDER_TAGS, null));
        assertEquals(NonProvableReason.EVIDENCE_MISSING, d.getReason());
        assertEquals("No evidence artifacts were collected.", d.getDetails());
    }

    @Test
    public void missing_tags_reported_in_taxonomy_order() {
        PolicyDecision d = engine.evaluate(Venue.SOLANA, ClaimType.TRADE_EXECUTED,
                bundle(Collections.singletonList(item("canonical_chain_state")), ORDER_TAGS, null));
        assertEquals(NonProvableReason.EVIDENCE_MISSING, d.getReason());
        assertEquals("Missing required evidence tags: execution_identity, execution_timestamp, execution_artifact", d.getDetails());
    }

    @Test
    public void tags_checked_before_source_precedence() {
        PolicyDecision d = engine.evaluate(Venue.HYPERLIQUID, ClaimType.ORDER_PLACED,
                bundle(Collections.singletonList(item("venue_api_unsigned")), Collections.singleton("order_identity"), null));
        assertEquals(NonProvableReason.EVIDENCE_MISSING, d.getReason());
    }

    @Test
    public void no_preferred_source_is_source_unavailable() {
        PolicyDecision d = engine.evaluate(Venue.HYPERLIQUID, ClaimType.ORDER_PLACED,
                bundle(Collections.singletonList(item("canonical_chain_state")), ORDER_TAGS, null));
        assertEquals(NonProvableReason.SOURCE_UNAVAILABLE, d.getReason());
        assertEquals("No acceptable preferred source kinds observed. Expected one of: venue_signed_attestation", d.getDetails());
    }

    @Test
    public void empty_preference_list_skips_source_check() {
        SourcePrecedence precedence = PolicyFixtures.sourcePrecedence();
        precedence.getVenues().put("base", new SourcePrecedence.VenueSources(Collections.emptyList(), Collections.emptyList()));
        PolicyEngine relaxed = new PolicyEngine(PolicyFixtures.claimTaxonomy(), precedence);

        PolicyDecision d = relaxed.evaluate(Venue.BASE, ClaimType.ORDER_PLACED,
                bundle(Collections.singletonList(item("venue_api_unsigned")), ORDER_TAGS, null));
        assertTrue(d.isOk());
    }

    @Test
    public void reject_without_reason_defaults_to_policy_violation() {
        PolicyDecision d = PolicyDecision.reject(null, "custom rule");
        assertFalse(d.isOk());
        assertEquals(NonProvableReason.POLICY_VIOLATION, d.reasonOrDefault());
    }

    @Test
    public void policy_context_reflects_documents() {
        PolicyContext ctx = engine.policyContext();
        assertEquals(PolicyEngine.DEFAULT_POLICY_ID, ctx.getPolicyId());
        assertEquals(PolicyEngine.DEFAULT_FINALITY_RULE_ID, ctx.getFinalityRuleId());
        assertEquals("v0.1.0", ctx.getSourcePrecedenceVersion());

        SourcePrecedence unversioned = PolicyFixtures.sourcePrecedence();
        unversioned.setVersion(null);
        assertEquals("unknown", new PolicyEngine(PolicyFixtures.claimTaxonomy(), unversioned).sourcePrecedenceVersion());
    }
}
