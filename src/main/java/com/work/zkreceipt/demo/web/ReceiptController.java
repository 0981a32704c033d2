package com.work.zkreceipt.demo.web;

import com.work.zkreceipt.core.engine.ReceiptEngine;
import com.work.zkreceipt.core.exception.ReceiptSubmissionRejectedException;
import com.work.zkreceipt.core.exception.ReceiptTaskFailedException;
import com.work.zkreceipt.core.exception.ReceiptWaitTimeoutException;
import com.work.zkreceipt.core.exception.UnknownReceiptException;
import com.work.zkreceipt.core.model.ClaimType;
import com.work.zkreceipt.core.model.ProofRequest;
import com.work.zkreceipt.core.model.Venue;
import com.work.zkreceipt.core.model.ZkReceipt;
import com.work.zkreceipt.core.verifier.ReceiptVerifier;
import com.work.zkreceipt.demo.config.ReceiptEngineProperties;
import com.work.zkreceipt.demo.web.dto.ReceiptVerificationView;
import com.work.zkreceipt.demo.web.dto.VerifyClaimRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * receipt 对外契约：
 * - POST 提交，可选等待；终态返回 200，仍在处理中返回 202（随后用 GET 轮询）
 * - GET 按 id 查询快照
 */
@RestController
@RequestMapping("/api/v1/receipts")
public class ReceiptController {

    private static final Logger log = LoggerFactory.getLogger(ReceiptController.class);

    private final ReceiptEngine engine;
    private final ReceiptVerifier verifier;
    private final ReceiptEngineProperties properties;

    public ReceiptController(ReceiptEngine engine, ReceiptVerifier verifier, ReceiptEngineProperties properties) {
        this.engine = engine;
        this.verifier = verifier;
        this.properties = properties;
    }

    @PostMapping
    public ResponseEntity<ZkReceipt> submit(@Validated @RequestBody VerifyClaimRequest req) {
        ProofRequest request = new ProofRequest(
                Venue.fromSlug(req.getVenue()),
                parseClaimType(req.getClaimType()),
                req.getAccountRef(),
                req.getOrderRef(),
                req.getExecutionRef(),
                req.getPayload());
        String receiptId = engine.submit(request);

        ZkReceipt receipt = req.isWaitForResult()
                ? engine.waitForReceipt(receiptId, waitTimeout(req.getWaitTimeoutMs()))
                : engine.getReceipt(receiptId).orElseThrow(() -> new UnknownReceiptException(receiptId));
        return toResponse(receipt);
    }

    @GetMapping("/{receiptId}")
    public ResponseEntity<ZkReceipt> get(@PathVariable String receiptId) {
        Optional<ZkReceipt> receipt = engine.getReceipt(receiptId);
        if (!receipt.isPresent()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(receipt.get());
    }

    @GetMapping("/{receiptId}/verification")
    public ResponseEntity<ReceiptVerificationView> verification(@PathVariable String receiptId) {
        Optional<ZkReceipt> receipt = engine.getReceipt(receiptId);
        if (!receipt.isPresent()) {
            return ResponseEntity.notFound().build();
        }
        ReceiptVerificationView v = new ReceiptVerificationView();
        v.setReceiptId(receiptId);
        v.setStatus(receipt.get().getStatus());
        v.setVerified(verifier.verify(receipt.get()));
        return ResponseEntity.ok(v);
    }

    @ExceptionHandler(UnknownReceiptException.class)
    public ResponseEntity<String> handleUnknown(UnknownReceiptException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
    }

    /**
     * 等待超时不是错误：返回当前（PENDING）快照，调用方改为轮询。
     */
    @ExceptionHandler(ReceiptWaitTimeoutException.class)
    public ResponseEntity<ZkReceipt> handleWaitTimeout(ReceiptWaitTimeoutException e) {
        Optional<ZkReceipt> receipt = engine.getReceipt(e.getReceiptId());
        if (!receipt.isPresent()) {
            return ResponseEntity.notFound().build();
        }
        return toResponse(receipt.get());
    }

    @ExceptionHandler(ReceiptSubmissionRejectedException.class)
    public ResponseEntity<String> handleRejected(ReceiptSubmissionRejectedException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(e.getMessage());
    }

    @ExceptionHandler(ReceiptTaskFailedException.class)
    public ResponseEntity<String> handleTaskFailed(ReceiptTaskFailedException e) {
        log.error("receipt task failed receiptId={}", e.getReceiptId(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(e.getMessage());
    }

    private Duration waitTimeout(Long requestedMs) {
        Duration timeout = requestedMs == null ? properties.getDefaultWaitTimeout() : Duration.ofMillis(requestedMs);
        Duration max = properties.getMaxWaitTimeout();
        return timeout.compareTo(max) > 0 ? max : timeout;
    }

    private static ClaimType parseClaimType(String raw) {
        try {
            return ClaimType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unsupported claim_type: " + raw, e);
        }
    }

    private static ResponseEntity<ZkReceipt> toResponse(ZkReceipt receipt) {
        HttpStatus status = receipt.getStatus().isTerminal() ? HttpStatus.OK : HttpStatus.ACCEPTED;
        return ResponseEntity.status(status).body(receipt);
    }
}
