package com.work.zkreceipt.demo.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.zkreceipt.core.adapter.VenueAdapter;
import com.work.zkreceipt.core.adapter.VenueAdapterRegistry;
import com.work.zkreceipt.core.engine.ReceiptEngine;
import com.work.zkreceipt.core.exception.PolicyDocumentException;
import com.work.zkreceipt.core.integrity.IntegrityCalculator;
import com.work.zkreceipt.core.metrics.NoopReceiptMetrics;
import com.work.zkreceipt.core.metrics.ReceiptMetrics;
import com.work.zkreceipt.core.model.Venue;
import com.work.zkreceipt.core.policy.ClaimTaxonomy;
import com.work.zkreceipt.core.policy.PolicyDocumentLoader;
import com.work.zkreceipt.core.policy.PolicyDocumentValidator;
import com.work.zkreceipt.core.policy.PolicyEngine;
import com.work.zkreceipt.core.policy.SourcePrecedence;
import com.work.zkreceipt.core.prover.ProverBackend;
import com.work.zkreceipt.core.verifier.OffchainVerifier;
import com.work.zkreceipt.core.verifier.ReceiptVerifier;
import com.work.zkreceipt.demo.adapter.SyntheticVenueAdapter;
import com.work.zkreceipt.demo.prover.Sp1MvpProver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.work.zkreceipt.core.support.ValidationUtils.requirePositive;

/**
 * 将核心组件装配为 Spring Bean。
 * prover / verifier / metrics 均可由业务方提供同类型 Bean 覆盖。
 */
@Configuration
@EnableConfigurationProperties(ReceiptEngineProperties.class)
public class ReceiptEngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ReceiptEngineConfiguration.class);

    /**
     * 启动时加载并校验两份策略文档；任一文档缺失或不完整都会导致启动失败。
     */
    @Bean
    public PolicyEngine policyEngine(ReceiptEngineProperties properties,
                                     ResourceLoader resourceLoader,
                                     ObjectMapper objectMapper) {
        PolicyDocumentLoader loader = new PolicyDocumentLoader(objectMapper);
        String taxonomyLocation = properties.getClaimTaxonomyLocation();
        String precedenceLocation = properties.getSourcePrecedenceLocation();
        ClaimTaxonomy taxonomy;
        SourcePrecedence precedence;
        try (InputStream in = open(resourceLoader, taxonomyLocation)) {
            taxonomy = loader.loadClaimTaxonomy(in, taxonomyLocation);
        } catch (IOException e) {
            throw new PolicyDocumentException("failed to read " + taxonomyLocation, e);
        }
        try (InputStream in = open(resourceLoader, precedenceLocation)) {
            precedence = loader.loadSourcePrecedence(in, precedenceLocation);
        } catch (IOException e) {
            throw new PolicyDocumentException("failed to read " + precedenceLocation, e);
        }
        PolicyDocumentValidator.validate(taxonomy, precedence);
        log.info("policy documents loaded policyId={} sourcePrecedenceVersion={}",
                properties.getPolicyId(), precedence.getVersion());
        return new PolicyEngine(taxonomy, precedence, properties.getPolicyId(), properties.getFinalityRuleId());
    }

    @Bean
    public IntegrityCalculator integrityCalculator(ReceiptEngineProperties properties) {
        return new IntegrityCalculator(properties.getSigner(), properties.getReceiptVersion());
    }

    @Bean
    public VenueAdapterRegistry venueAdapterRegistry(ReceiptEngineProperties properties) {
        List<VenueAdapter> adapters = new ArrayList<>();
        for (String slug : properties.getEnabledVenues()) {
            adapters.add(new SyntheticVenueAdapter(Venue.fromSlug(slug)));
        }
        return new VenueAdapterRegistry(adapters);
    }

    @Bean
    @ConditionalOnMissingBean(ProverBackend.class)
    public ProverBackend proverBackend() {
        return new Sp1MvpProver();
    }

    @Bean
    @ConditionalOnMissingBean(ReceiptVerifier.class)
    public ReceiptVerifier receiptVerifier() {
        return new OffchainVerifier();
    }

    @Bean
    @ConditionalOnMissingBean(ReceiptMetrics.class)
    public ReceiptMetrics receiptMetrics() {
        return new NoopReceiptMetrics();
    }

    @Bean(destroyMethod = "shutdown")
    public ReceiptEngine receiptEngine(ReceiptEngineProperties properties,
                                       VenueAdapterRegistry adapters,
                                       PolicyEngine policyEngine,
                                       ProverBackend prover,
                                       ReceiptVerifier verifier,
                                       IntegrityCalculator integrity,
                                       ReceiptMetrics metrics) {
        return new ReceiptEngine(adapters, policyEngine, prover, verifier, integrity,
                receiptExecutor(properties), metrics);
    }

    private static ExecutorService receiptExecutor(ReceiptEngineProperties properties) {
        int threads = requirePositive(properties.getWorkerThreads(), "workerThreads");
        int capacity = requirePositive(properties.getQueueCapacity(), "queueCapacity");
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r);
            t.setName("receipt-worker-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        // 有界队列 + AbortPolicy：队列满时 submit 抛 RejectedExecutionException
        return new ThreadPoolExecutor(threads, threads,
                0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(capacity),
                tf,
                new ThreadPoolExecutor.AbortPolicy());
    }

    private static InputStream open(ResourceLoader resourceLoader, String location) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new PolicyDocumentException("policy document not found: " + location);
        }
        return resource.getInputStream();
    }
}
