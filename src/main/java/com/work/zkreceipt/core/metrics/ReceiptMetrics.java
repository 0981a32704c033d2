package com.work.zkreceipt.core.metrics;

/**
 * receipt 计数端口。引擎在以下时点回调：
 * - submitted / rejected：提交成功或因队列满被拒（按 venue slug）
 * - stageFailure：流水线某阶段失败（adapter_lookup、acknowledge、collect_evidence、policy、build_statement、prove、verify）
 * - terminal：写入终态（status，NON_PROVABLE 时附 reason code）
 * - waitTimeout / taskFault：等待超时、后台任务崩溃
 * <p>
 * 全部为空默认实现，接入 Micrometer 等时按需覆盖。
 */
public interface ReceiptMetrics {

    default void submitted(String venue) {
    }

    default void rejected(String venue) {
    }

    default void stageFailure(String stage) {
    }

    default void terminal(String status, String reason) {
    }

    default void waitTimeout() {
    }

    default void taskFault() {
    }
}
