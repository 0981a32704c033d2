package com.work.zkreceipt.demo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 仅存在于 demo/业务包，用于从 application.yml 读取配置，
 * 再由 {@link ReceiptEngineConfiguration} 转换为 core 包所需的组件。
 */
@ConfigurationProperties(prefix = "zkreceipt")
public class ReceiptEngineProperties {

    /**
     * integrity.signer，参与签名哈希。
     */
    private String signer = "zkputer-dev-signer";

    /**
     * receipt schema 版本，参与 schema_hash。
     */
    private String receiptVersion = "v0.1.0";

    private String policyId = "default-v0.1.0";
    private String finalityRuleId = "venue-default-finality-v0.1.0";

    private String claimTaxonomyLocation = "classpath:policy/claim-taxonomy.json";
    private String sourcePrecedenceLocation = "classpath:policy/source-precedence.json";

    /**
     * 后台流水线线程数。
     */
    private int workerThreads = 8;

    /**
     * 后台有界队列容量；满了之后 submit 直接拒绝。
     */
    private int queueCapacity = 1024;

    /**
     * REST 调用方未指定时的默认等待时长。
     */
    private Duration defaultWaitTimeout = Duration.ofSeconds(3);

    /**
     * 单次等待上限，超出按上限截断。
     */
    private Duration maxWaitTimeout = Duration.ofSeconds(30);

    /**
     * 注册 synthetic adapter 的 venue（slug）。未列出的 venue 提交后得到 UNSUPPORTED_VENUE_CLAIM。
     */
    private List<String> enabledVenues = new ArrayList<>(Arrays.asList("hyperliquid", "base", "solana", "polymarket"));

    public String getSigner() {
        return signer;
    }

    public void setSigner(String signer) {
        this.signer = signer;
    }

    public String getReceiptVersion() {
        return receiptVersion;
    }

    public void setReceiptVersion(String receiptVersion) {
        this.receiptVersion = receiptVersion;
    }

    public String getPolicyId() {
        return policyId;
    }

    public void setPolicyId(String policyId) {
        this.policyId = policyId;
    }

    public String getFinalityRuleId() {
        return finalityRuleId;
    }

    public void setFinalityRuleId(String finalityRuleId) {
        this.finalityRuleId = finalityRuleId;
    }

    public String getClaimTaxonomyLocation() {
        return claimTaxonomyLocation;
    }

    public void setClaimTaxonomyLocation(String claimTaxonomyLocation) {
        this.claimTaxonomyLocation = claimTaxonomyLocation;
    }

    public String getSourcePrecedenceLocation() {
        return sourcePrecedenceLocation;
    }

    public void setSourcePrecedenceLocation(String sourcePrecedenceLocation) {
        this.sourcePrecedenceLocation = sourcePrecedenceLocation;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public Duration getDefaultWaitTimeout() {
        return defaultWaitTimeout;
    }

    public void setDefaultWaitTimeout(Duration defaultWaitTimeout) {
        this.defaultWaitTimeout = defaultWaitTimeout;
    }

    public Duration getMaxWaitTimeout() {
        return maxWaitTimeout;
    }

    public void setMaxWaitTimeout(Duration maxWaitTimeout) {
        this.maxWaitTimeout = maxWaitTimeout;
    }

    public List<String> getEnabledVenues() {
        return enabledVenues;
    }

    public void setEnabledVenues(List<String> enabledVenues) {
        this.enabledVenues = enabledVenues;
    }
}
