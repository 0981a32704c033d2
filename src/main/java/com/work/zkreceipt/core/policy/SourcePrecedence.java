package com.work.zkreceipt.core.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.work.zkreceipt.core.model.ClaimType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * source precedence 文档：每个 venue、每种 claim 可接受（偏好）的证据来源类型。
 * <pre>
 * { "version": "...",
 *   "venues": { "base": { "order_placed_sources_preferred": [...],
 *                         "trade_executed_sources_preferred": [...] } } }
 * </pre>
 * 列表为 null 表示文档缺失该 key（校验器据此报错），空列表表示“不限制来源”。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SourcePrecedence {

    private String version;
    private Map<String, VenueSources> venues = new LinkedHashMap<>();

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public Map<String, VenueSources> getVenues() {
        return venues;
    }

    public void setVenues(Map<String, VenueSources> venues) {
        this.venues = venues == null ? new LinkedHashMap<>() : venues;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class VenueSources {

        private List<String> orderPlacedSourcesPreferred;
        private List<String> tradeExecutedSourcesPreferred;

        public VenueSources() {
        }

        public VenueSources(List<String> orderPlacedSourcesPreferred, List<String> tradeExecutedSourcesPreferred) {
            this.orderPlacedSourcesPreferred = orderPlacedSourcesPreferred;
            this.tradeExecutedSourcesPreferred = tradeExecutedSourcesPreferred;
        }

        public List<String> getOrderPlacedSourcesPreferred() {
            return orderPlacedSourcesPreferred;
        }

        public void setOrderPlacedSourcesPreferred(List<String> orderPlacedSourcesPreferred) {
            this.orderPlacedSourcesPreferred = orderPlacedSourcesPreferred;
        }

        public List<String> getTradeExecutedSourcesPreferred() {
            return tradeExecutedSourcesPreferred;
        }

        public void setTradeExecutedSourcesPreferred(List<String> tradeExecutedSourcesPreferred) {
            this.tradeExecutedSourcesPreferred = tradeExecutedSourcesPreferred;
        }

        /**
         * 指定 claim 类型的偏好来源；缺失时视为空（不限制）。
         */
        public List<String> preferredFor(ClaimType claimType) {
            List<String> l;
            switch (claimType) {
                case ORDER_PLACED:
                    l = orderPlacedSourcesPreferred;
                    break;
                case TRADE_EXECUTED:
                    l = tradeExecutedSourcesPreferred;
                    break;
                default:
                    throw new IllegalStateException("unexpected claim type: " + claimType);
            }
            return l == null ? Collections.emptyList() : l;
        }
    }
}
