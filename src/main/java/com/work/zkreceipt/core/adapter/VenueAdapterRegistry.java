package com.work.zkreceipt.core.adapter;

import com.work.zkreceipt.core.model.Venue;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.work.zkreceipt.core.support.ValidationUtils.requireNonNull;

/**
 * venue -> adapter 注册表（构造后只读）。同一 venue 重复注册视为配置错误。
 */
public final class VenueAdapterRegistry {

    private final Map<Venue, VenueAdapter> adapters;

    public VenueAdapterRegistry(Collection<? extends VenueAdapter> adapters) {
        Map<Venue, VenueAdapter> map = new EnumMap<>(Venue.class);
        if (adapters != null) {
            for (VenueAdapter a : adapters) {
                requireNonNull(a, "adapter");
                Venue v = requireNonNull(a.venue(), "adapter.venue");
                if (map.putIfAbsent(v, a) != null) {
                    throw new IllegalArgumentException("duplicate adapter for venue " + v.getSlug());
                }
            }
        }
        this.adapters = Collections.unmodifiableMap(map);
    }

    public static VenueAdapterRegistry empty() {
        return new VenueAdapterRegistry(null);
    }

    public Optional<VenueAdapter> find(Venue venue) {
        return Optional.ofNullable(adapters.get(venue));
    }

    public Set<Venue> venues() {
        return adapters.keySet();
    }
}
