package com.work.zkreceipt.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 受支持的交易场所（闭集）。对外统一使用小写 slug。
 */
public enum Venue {
    HYPERLIQUID("hyperliquid"),
    BASE("base"),
    SOLANA("solana"),
    POLYMARKET("polymarket");

    private final String slug;

    Venue(String slug) {
        this.slug = slug;
    }

    @JsonValue
    public String getSlug() {
        return slug;
    }

    /**
     * 按 slug 解析（大小写不敏感）。
     *
     * @throws IllegalArgumentException 未知 venue
     */
    @JsonCreator
    public static Venue fromSlug(String slug) {
        if (slug != null) {
            String s = slug.trim();
            for (Venue v : values()) {
                if (v.slug.equalsIgnoreCase(s)) {
                    return v;
                }
            }
        }
        throw new IllegalArgumentException("unsupported venue: " + slug);
    }
}
