package com.work.zkreceipt.demo.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.zkreceipt.core.exception.VenueAdapterException;
import com.work.zkreceipt.core.model.ClaimType;
import com.work.zkreceipt.core.model.EvidenceBundle;
import com.work.zkreceipt.core.model.EvidenceItem;
import com.work.zkreceipt.core.model.ExecutionAck;
import com.work.zkreceipt.core.model.ProofRequest;
import com.work.zkreceipt.core.model.Venue;
import com.work.zkreceipt.core.support.CanonicalHasher;
import com.work.zkreceipt.core.support.Timestamps;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SyntheticVenueAdapterTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    public void acknowledge_binds_order_and_time() {
        SyntheticVenueAdapter adapter = new SyntheticVenueAdapter(Venue.BASE);
        ExecutionAck ack = adapter.acknowledge(new ProofRequest(Venue.BASE, ClaimType.ORDER_PLACED, "acct-1", "order-1", null));

        assertTrue(ack.isAccepted());
        assertEquals("order-1", ack.getVenueOrderRef());
        assertEquals("base://ack/order-1", ack.getAcceptanceArtifactRef());
        assertEquals(CanonicalHasher.hashOf("venue", "base", "order_ref", "order-1",
                "accepted_at", Timestamps.format(ack.getAcceptedAt()), "kind", "acknowledgement"),
                ack.getAcceptanceArtifactHash());
    }

    @Test
    public void order_placed_evidence_has_primary_and_shadow() {
        SyntheticVenueAdapter adapter = new SyntheticVenueAdapter(Venue.HYPERLIQUID);
        ProofRequest request = new ProofRequest(Venue.HYPERLIQUID, ClaimType.ORDER_PLACED, "acct-3", "order-3", null);
        ExecutionAck ack = adapter.acknowledge(request);

        EvidenceBundle bundle = adapter.collectEvidence(request, ack);

        assertEquals(2, bundle.getItems().size());
        EvidenceItem primary = bundle.getItems().get(0);
        assertEquals("hyperliquid-primary", primary.getSourceId());
        assertEquals("venue_signed_attestation", primary.getSourceKind());
        assertEquals(ack.getAcceptanceArtifactHash(), primary.getArtifactHash());
        EvidenceItem shadow = bundle.getItems().get(1);
        assertEquals("venue_api_unsigned", shadow.getSourceKind());
        assertEquals("hyperliquid://api/order/order-3", shadow.getArtifactRef());
        assertTrue(bundle.getObservedTags().contains("venue_acceptance_artifact"));
        assertFalse(bundle.hasConflicts());
        assertNull(bundle.getFinalityObservedAt());
    }

    @Test
    public void chain_venues_use_canonical_chain_state() {
        for (Venue v : new Venue[]{Venue.BASE, Venue.SOLANA, Venue.POLYMARKET}) {
            SyntheticVenueAdapter adapter = new SyntheticVenueAdapter(v);
            ProofRequest request = new ProofRequest(v, ClaimType.ORDER_PLACED, "acct-1", "order-1", null);
            EvidenceBundle bundle = adapter.collectEvidence(request, adapter.acknowledge(request));
            assertEquals("canonical_chain_state", bundle.getItems().get(0).getSourceKind());
        }
    }

    @Test
    public void execution_item_only_with_execution_ref() {
        SyntheticVenueAdapter adapter = new SyntheticVenueAdapter(Venue.SOLANA);
        ProofRequest withRef = new ProofRequest(Venue.SOLANA, ClaimType.TRADE_EXECUTED, "acct-2", "order-2", "fill-1");
        EvidenceBundle full = adapter.collectEvidence(withRef, adapter.acknowledge(withRef));

        assertEquals(3, full.getItems().size());
        assertEquals("solana://execution/fill-1", full.getItems().get(2).getArtifactRef());
        assertTrue(full.getObservedTags().contains("execution_artifact"));
        assertNotNull(full.getFinalityObservedAt());

        ProofRequest withoutRef = new ProofRequest(Venue.SOLANA, ClaimType.TRADE_EXECUTED, "acct-2", "order-2", null);
        EvidenceBundle partial = adapter.collectEvidence(withoutRef, adapter.acknowledge(withoutRef));
        assertEquals(2, partial.getItems().size());
        assertFalse(partial.getObservedTags().contains("execution_identity"));
        assertNull(partial.getFinalityObservedAt());
    }

    @Test
    public void payload_switches_shape_the_bundle() throws Exception {
        SyntheticVenueAdapter adapter = new SyntheticVenueAdapter(Venue.BASE);
        ProofRequest request = new ProofRequest(Venue.BASE, ClaimType.ORDER_PLACED, "acct-1", "order-1", null,
                mapper.readTree("{\"simulate_conflict\": true, \"missing_tags\": [\"order_identity\", 3]}"));

        EvidenceBundle bundle = adapter.collectEvidence(request, adapter.acknowledge(request));

        assertEquals(1, bundle.getConflicts().size());
        assertEquals("source_value_mismatch", bundle.getConflicts().get(0));
        assertFalse(bundle.getObservedTags().contains("order_identity"));
        // 只影响 observed 集合，不影响 item 自身的 tags
        assertTrue(bundle.getItems().get(0).getTags().contains("order_identity"));
    }

    @Test
    public void source_outage_fails_acknowledgement() throws Exception {
        SyntheticVenueAdapter adapter = new SyntheticVenueAdapter(Venue.POLYMARKET);
        ProofRequest request = new ProofRequest(Venue.POLYMARKET, ClaimType.ORDER_PLACED, "acct-1", "order-1", null,
                mapper.readTree("{\"simulate_source_outage\": true}"));

        VenueAdapterException e = assertThrows(VenueAdapterException.class, () -> adapter.acknowledge(request));
        assertTrue(e.getMessage().contains("polymarket"));
    }
}
