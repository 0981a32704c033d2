package com.work.zkreceipt.core.engine;

import com.work.zkreceipt.core.adapter.VenueAdapterRegistry;
import com.work.zkreceipt.core.exception.ReceiptException;
import com.work.zkreceipt.core.exception.ReceiptSubmissionRejectedException;
import com.work.zkreceipt.core.exception.ReceiptTaskFailedException;
import com.work.zkreceipt.core.exception.ReceiptWaitTimeoutException;
import com.work.zkreceipt.core.exception.UnknownReceiptException;
import com.work.zkreceipt.core.integrity.IntegrityCalculator;
import com.work.zkreceipt.core.metrics.ReceiptMetrics;
import com.work.zkreceipt.core.model.ProofRequest;
import com.work.zkreceipt.core.model.ZkReceipt;
import com.work.zkreceipt.core.policy.PolicyEngine;
import com.work.zkreceipt.core.prover.ProverBackend;
import com.work.zkreceipt.core.support.Timestamps;
import com.work.zkreceipt.core.verifier.ReceiptVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.work.zkreceipt.core.support.ValidationUtils.requireNonEmpty;
import static com.work.zkreceipt.core.support.ValidationUtils.requireNonNull;
import static com.work.zkreceipt.core.support.ValidationUtils.requirePositive;

/**
 * receipt 编排引擎（门面）。
 * <p>
 * 对外契约：
 * - submit：同步写入 PENDING 并立即返回 id，流水线在后台 executor 中执行，submit 本身不做任何 I/O
 * - getReceipt：非阻塞快照读
 * - waitForReceipt：阻塞等待后台流水线完成（受 timeout 约束）后返回当前快照；
 *   同一 id 允许任意多个调用方同时等待（完成信号为广播语义）
 * <p>
 * timeout 只限制调用方的等待，不会取消后台流水线；超时后应通过 getReceipt 轮询最终结果。
 */
public class ReceiptEngine {

    private static final Logger log = LoggerFactory.getLogger(ReceiptEngine.class);

    private final PolicyEngine policyEngine;
    private final ReceiptAssembler assembler;
    private final ReceiptPipeline pipeline;
    private final ExecutorService executor;
    private final ReceiptMetrics metrics;

    private final ReceiptStore store = new ReceiptStore();
    private final Map<String, CompletableFuture<ZkReceipt>> inFlight = new ConcurrentHashMap<>();

    public ReceiptEngine(VenueAdapterRegistry adapters,
                         PolicyEngine policyEngine,
                         ProverBackend prover,
                         ReceiptVerifier verifier,
                         IntegrityCalculator integrity,
                         ExecutorService executor,
                         ReceiptMetrics metrics) {
        requireNonNull(adapters, "adapters");
        this.policyEngine = requireNonNull(policyEngine, "policyEngine");
        requireNonNull(prover, "prover");
        requireNonNull(verifier, "verifier");
        this.assembler = new ReceiptAssembler(requireNonNull(integrity, "integrity"));
        this.executor = requireNonNull(executor, "executor");
        this.metrics = requireNonNull(metrics, "metrics");
        this.pipeline = new ReceiptPipeline(adapters, policyEngine, prover, verifier, assembler, metrics);
    }

    /**
     * 提交一次证明请求。
     *
     * @return 新分配的 receiptId（全局唯一，不复用）
     * @throws ReceiptSubmissionRejectedException 后台队列已满
     */
    public String submit(ProofRequest request) {
        requireNonNull(request, "request");
        String receiptId = UUID.randomUUID().toString();
        ZkReceipt pending = assembler.pending(receiptId, request, policyEngine.policyContext(), Timestamps.now());
        store.insertPending(pending);

        CompletableFuture<ZkReceipt> done = new CompletableFuture<>();
        inFlight.put(receiptId, done);
        try {
            executor.execute(() -> runPipeline(pending, request, done));
        } catch (RejectedExecutionException e) {
            inFlight.remove(receiptId, done);
            store.removePending(receiptId);
            metrics.rejected(request.getVenue().getSlug());
            throw new ReceiptSubmissionRejectedException("receipt executor rejected submission for venue="
                    + request.getVenue().getSlug(), e);
        }
        metrics.submitted(request.getVenue().getSlug());
        log.debug("receipt submitted receiptId={} request={}", receiptId, request);
        return receiptId;
    }

    public Optional<ZkReceipt> getReceipt(String receiptId) {
        return store.get(receiptId);
    }

    /**
     * 等待后台流水线完成后返回当前快照。
     *
     * @throws ReceiptWaitTimeoutException 超时（流水线继续运行）
     * @throws ReceiptTaskFailedException  后台流水线发生非业务性故障
     * @throws UnknownReceiptException     id 不存在
     */
    public ZkReceipt waitForReceipt(String receiptId, Duration timeout) {
        requireNonEmpty(receiptId, "receiptId");
        requirePositive(timeout, "timeout");
        CompletableFuture<ZkReceipt> done = inFlight.get(receiptId);
        if (done != null) {
            try {
                done.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                metrics.waitTimeout();
                throw new ReceiptWaitTimeoutException(receiptId, timeout, e);
            } catch (ExecutionException e) {
                throw new ReceiptTaskFailedException(receiptId, e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ReceiptException("interrupted while waiting for receipt " + receiptId, e);
            }
        }
        return store.get(receiptId).orElseThrow(() -> new UnknownReceiptException(receiptId));
    }

    /**
     * 异步观察完成：返回的 future 在流水线结束时以终态快照完成。
     * 已经结束（或 id 不在途）时立即以当前快照完成。
     */
    public CompletableFuture<ZkReceipt> whenComplete(String receiptId) {
        requireNonEmpty(receiptId, "receiptId");
        CompletableFuture<ZkReceipt> done = inFlight.get(receiptId);
        if (done != null) {
            return done.copy();
        }
        Optional<ZkReceipt> current = store.get(receiptId);
        if (!current.isPresent()) {
            CompletableFuture<ZkReceipt> failed = new CompletableFuture<>();
            failed.completeExceptionally(new UnknownReceiptException(receiptId));
            return failed;
        }
        return CompletableFuture.completedFuture(current.get());
    }

    /**
     * 当前在途（尚未结束）的流水线数量。
     */
    public int pendingCount() {
        return inFlight.size();
    }

    public int receiptCount() {
        return store.size();
    }

    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("receipt executor did not terminate in time, inFlight={}", inFlight.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void runPipeline(ZkReceipt pending, ProofRequest request, CompletableFuture<ZkReceipt> done) {
        String receiptId = pending.getReceiptId();
        try {
            ZkReceipt result = pipeline.run(pending, request);
            if (!store.completeIfPending(result)) {
                log.warn("receipt terminal write skipped receiptId={} status={}", receiptId, result.getStatus());
            }
            ZkReceipt stored = store.get(receiptId).orElse(result);
            metrics.terminal(stored.getStatus().name(),
                    stored.getNonProvable() == null ? null : stored.getNonProvable().getReasonCode().name());
            log.info("receipt completed receiptId={} status={}{}", receiptId, stored.getStatus(),
                    stored.getNonProvable() == null ? "" : " reason=" + stored.getNonProvable().getReasonCode());
            done.complete(stored);
        } catch (Throwable t) {
            metrics.taskFault();
            log.error("receipt task fault receiptId={}", receiptId, t);
            done.completeExceptionally(t);
            if (t instanceof Error) {
                throw (Error) t;
            }
        } finally {
            inFlight.remove(receiptId, done);
        }
    }
}
