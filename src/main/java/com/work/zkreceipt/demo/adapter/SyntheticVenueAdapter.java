package com.work.zkreceipt.demo.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.work.zkreceipt.core.adapter.VenueAdapter;
import com.work.zkreceipt.core.exception.VenueAdapterException;
import com.work.zkreceipt.core.model.ClaimType;
import com.work.zkreceipt.core.model.EvidenceBundle;
import com.work.zkreceipt.core.model.EvidenceItem;
import com.work.zkreceipt.core.model.ExecutionAck;
import com.work.zkreceipt.core.model.ProofRequest;
import com.work.zkreceipt.core.model.Venue;
import com.work.zkreceipt.core.support.CanonicalHasher;
import com.work.zkreceipt.core.support.Timestamps;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.work.zkreceipt.core.support.ValidationUtils.requireNonNull;

/**
 * 内存版场所适配器，仅用于 demo，真实项目请替换为对接交易所/链的实现。
 * <p>
 * 生成形状固定的模拟证据；请求 payload 中的开关可用于演示失败路径：
 * - simulate_conflict: true  → 证据冲突 source_value_mismatch
 * - missing_tags: [...]      → 从 observed tags 中移除指定 tag
 * - simulate_source_outage: true → acknowledge 直接失败
 */
public class SyntheticVenueAdapter implements VenueAdapter {

    static final String SIGNED_ATTESTATION = "venue_signed_attestation";
    static final String CHAIN_STATE = "canonical_chain_state";
    static final String UNSIGNED_API = "venue_api_unsigned";
    static final String CONFLICT_VALUE_MISMATCH = "source_value_mismatch";

    private static final List<String> ACCEPTANCE_TAGS =
            Arrays.asList("order_identity", "submission_timestamp", "venue_acceptance_artifact");
    private static final List<String> API_TAGS = Arrays.asList("order_identity", "submission_timestamp");
    private static final List<String> EXECUTION_TAGS =
            Arrays.asList("execution_identity", "execution_timestamp", "execution_artifact");

    private final Venue venue;

    public SyntheticVenueAdapter(Venue venue) {
        this.venue = requireNonNull(venue, "venue");
    }

    @Override
    public Venue venue() {
        return venue;
    }

    @Override
    public ExecutionAck acknowledge(ProofRequest request) {
        if (request.payloadFlag("simulate_source_outage")) {
            throw new VenueAdapterException("Venue " + venue.getSlug() + " acknowledgement source unavailable.");
        }
        Instant acceptedAt = Timestamps.now();
        String artifactHash = CanonicalHasher.hashOf(
                "venue", venue.getSlug(),
                "order_ref", request.getOrderRef(),
                "accepted_at", Timestamps.format(acceptedAt),
                "kind", "acknowledgement");
        return new ExecutionAck(true, request.getOrderRef(),
                venue.getSlug() + "://ack/" + request.getOrderRef(), artifactHash, acceptedAt);
    }

    @Override
    public EvidenceBundle collectEvidence(ProofRequest request, ExecutionAck ack) {
        String slug = venue.getSlug();
        Set<String> observedTags = new LinkedHashSet<>(ACCEPTANCE_TAGS);
        List<String> conflicts = new ArrayList<>();
        if (request.payloadFlag("simulate_conflict")) {
            conflicts.add(CONFLICT_VALUE_MISMATCH);
        }

        List<EvidenceItem> items = new ArrayList<>();
        items.add(new EvidenceItem(slug + "-primary", acceptanceSourceKind(),
                ack.getAcceptanceArtifactRef(), ack.getAcceptanceArtifactHash(), ack.getAcceptedAt(), ACCEPTANCE_TAGS));
        items.add(new EvidenceItem(slug + "-api", UNSIGNED_API,
                slug + "://api/order/" + request.getOrderRef(),
                CanonicalHasher.hashOf("venue", slug, "api_order_ref", request.getOrderRef()),
                Timestamps.now(), API_TAGS));

        Instant finalityObservedAt = null;
        String executionRef = request.getExecutionRef();
        if (request.getClaimType() == ClaimType.TRADE_EXECUTED && executionRef != null) {
            observedTags.addAll(EXECUTION_TAGS);
            items.add(new EvidenceItem(slug + "-execution", acceptanceSourceKind(),
                    slug + "://execution/" + executionRef,
                    CanonicalHasher.hashOf("venue", slug, "order_ref", request.getOrderRef(), "execution_ref", executionRef),
                    Timestamps.now(), EXECUTION_TAGS));
            finalityObservedAt = Timestamps.now();
        }

        JsonNode missing = request.getPayload().get("missing_tags");
        if (missing != null && missing.isArray()) {
            for (JsonNode tag : missing) {
                if (tag.isTextual()) {
                    observedTags.remove(tag.asText());
                }
            }
        }
        return new EvidenceBundle(items, observedTags, conflicts, finalityObservedAt);
    }

    private String acceptanceSourceKind() {
        return venue == Venue.HYPERLIQUID ? SIGNED_ATTESTATION : CHAIN_STATE;
    }
}
