package com.work.zkreceipt.core.exception;

/**
 * 组件内部的统⼀异常类型，便于业务侧捕获或转换为 RPC/HTTP 错误码。
 * <p>
 * 注意：业务性的“不可证明”不是异常，而是 NON_PROVABLE 终态 receipt；
 * 只有调用层面的失败（未知 id、等待超时、后台任务崩溃等）才会以异常形式抛出。
 */
public class ReceiptException extends RuntimeException {

    public ReceiptException(String message) {
        super(message);
    }

    public ReceiptException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 标识该异常是否可通过重试（或稍后轮询）解决。
     * 默认不可重试。
     */
    public boolean isRetryable() {
        return false;
    }
}
