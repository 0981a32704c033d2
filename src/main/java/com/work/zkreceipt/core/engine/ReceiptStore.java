package com.work.zkreceipt.core.engine;

import com.work.zkreceipt.core.model.ReceiptStatus;
import com.work.zkreceipt.core.model.ZkReceipt;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static com.work.zkreceipt.core.support.ValidationUtils.requireNonEmpty;
import static com.work.zkreceipt.core.support.ValidationUtils.requireNonNull;

/**
 * 进程内 receipt 存储，引擎独占。
 * <p>
 * 以 receiptId 为粒度加锁（ConcurrentHashMap 的 per-bin 原子 compute），没有整表锁。
 * 写入规则：
 * - submit 时插入 PENDING（id 不允许重复）
 * - 流水线写终态，且只在当前仍为 PENDING 时生效；终态一旦写入不再被覆盖
 */
class ReceiptStore {

    private final Map<String, ZkReceipt> receipts = new ConcurrentHashMap<>();

    void insertPending(ZkReceipt receipt) {
        requireNonNull(receipt, "receipt");
        if (receipt.getStatus() != ReceiptStatus.PENDING) {
            throw new IllegalArgumentException("只允许插入 PENDING receipt");
        }
        ZkReceipt prev = receipts.putIfAbsent(receipt.getReceiptId(), receipt);
        if (prev != null) {
            throw new IllegalStateException("duplicate receipt id " + receipt.getReceiptId());
        }
    }

    Optional<ZkReceipt> get(String receiptId) {
        requireNonEmpty(receiptId, "receiptId");
        return Optional.ofNullable(receipts.get(receiptId));
    }

    /**
     * 写入终态。
     *
     * @return true 表示写入生效；false 表示 id 不存在或已是终态
     */
    boolean completeIfPending(ZkReceipt terminal) {
        requireNonNull(terminal, "terminal");
        if (!terminal.getStatus().isTerminal()) {
            throw new IllegalArgumentException("completeIfPending 需要终态 receipt");
        }
        boolean[] applied = new boolean[1];
        receipts.computeIfPresent(terminal.getReceiptId(), (id, current) -> {
            if (current.getStatus() == ReceiptStatus.PENDING) {
                applied[0] = true;
                return terminal;
            }
            return current;
        });
        return applied[0];
    }

    /**
     * 仅用于提交被拒绝时回滚刚插入的 PENDING 记录。
     */
    void removePending(String receiptId) {
        receipts.computeIfPresent(receiptId, (id, current) ->
                current.getStatus() == ReceiptStatus.PENDING ? null : current);
    }

    int size() {
        return receipts.size();
    }
}
