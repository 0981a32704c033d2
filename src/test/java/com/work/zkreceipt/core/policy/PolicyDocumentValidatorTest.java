package com.work.zkreceipt.core.policy;

import com.work.zkreceipt.core.exception.PolicyDocumentException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class PolicyDocumentValidatorTest {

    @Test
    public void bundled_documents_are_valid() {
        ClaimTaxonomy taxonomy = PolicyFixtures.claimTaxonomy();
        SourcePrecedence precedence = PolicyFixtures.sourcePrecedence();

        assertDoesNotThrow(() -> PolicyDocumentValidator.validate(taxonomy, precedence));
        assertEquals(3, taxonomy.requiredTags("ORDER_PLACED").size());
        assertTrue(taxonomy.requiredTags("UNKNOWN_CLAIM").isEmpty());
    }

    @Test
    public void missing_reason_code_rejected() {
        ClaimTaxonomy taxonomy = PolicyFixtures.claimTaxonomy();
        taxonomy.getNonProvableReasonCodes().remove("PROOF_FAILURE");

        PolicyDocumentException e = assertThrows(PolicyDocumentException.class,
                () -> PolicyDocumentValidator.validateClaimTaxonomy(taxonomy));
        assertTrue(e.getMessage().contains("PROOF_FAILURE"));
        assertFalse(e.isRetryable());
    }

    @Test
    public void missing_claim_type_rejected() {
        ClaimTaxonomy taxonomy = PolicyFixtures.claimTaxonomy();
        taxonomy.getClaimTypes().remove("TRADE_EXECUTED");

        assertThrows(PolicyDocumentException.class, () -> PolicyDocumentValidator.validateClaimTaxonomy(taxonomy));
    }

    @Test
    public void missing_venue_or_list_rejected() {
        SourcePrecedence noVenue = PolicyFixtures.sourcePrecedence();
        noVenue.getVenues().remove("polymarket");
        assertThrows(PolicyDocumentException.class, () -> PolicyDocumentValidator.validateSourcePrecedence(noVenue));

        SourcePrecedence noList = PolicyFixtures.sourcePrecedence();
        noList.getVenues().get("solana").setTradeExecutedSourcesPreferred(null);
        PolicyDocumentException e = assertThrows(PolicyDocumentException.class,
                () -> PolicyDocumentValidator.validateSourcePrecedence(noList));
        assertTrue(e.getMessage().contains("solana"));
    }

    @Test
    public void loader_reports_missing_and_malformed_documents() {
        PolicyDocumentLoader loader = new PolicyDocumentLoader();

        assertThrows(PolicyDocumentException.class, () -> loader.loadClaimTaxonomy(null, "claim-taxonomy.json"));

        ByteArrayInputStream broken = new ByteArrayInputStream("{\"claim_types\": [".getBytes(StandardCharsets.UTF_8));
        PolicyDocumentException e = assertThrows(PolicyDocumentException.class,
                () -> loader.loadSourcePrecedence(broken, "source-precedence.json"));
        assertTrue(e.getMessage().contains("source-precedence.json"));
    }

    @Test
    public void loader_ignores_unknown_fields() {
        String json = "{\"version\":\"v2\",\"comment\":\"x\",\"venues\":{\"base\":{"
                + "\"order_placed_sources_preferred\":[\"canonical_chain_state\"],\"extra\":1}}}";
        SourcePrecedence doc = new PolicyDocumentLoader().loadSourcePrecedence(
                new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "inline");

        assertEquals("v2", doc.getVersion());
        assertNull(doc.getVenues().get("base").getTradeExecutedSourcesPreferred());
    }
}
