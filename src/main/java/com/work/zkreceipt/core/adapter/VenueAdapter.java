package com.work.zkreceipt.core.adapter;

import com.work.zkreceipt.core.model.ClaimType;
import com.work.zkreceipt.core.model.EvidenceBundle;
import com.work.zkreceipt.core.model.ExecutionAck;
import com.work.zkreceipt.core.model.ProofRequest;
import com.work.zkreceipt.core.model.Venue;
import com.work.zkreceipt.core.support.Timestamps;

/**
 * 场所适配端口：受理确认 + 证据采集 + 陈述生成。每个 venue 注册一个实现。
 * <p>
 * 约束：
 * - 失败通过抛出 {@link com.work.zkreceipt.core.exception.VenueAdapterException}（或任意 RuntimeException）表达，
 *   引擎负责转换为 NON_PROVABLE 终态。
 * - adapter 拿不到 receipt 本身，只能看到请求与自己产出的中间结果。
 * - 陈述必须非空，且相同输入得到相同文本。
 */
public interface VenueAdapter {

    Venue venue();

    ExecutionAck acknowledge(ProofRequest request);

    EvidenceBundle collectEvidence(ProofRequest request, ExecutionAck ack);

    /**
     * 默认陈述：ORDER_PLACED 描述受理时间；其余 claim 描述成交引用（缺失时为 UNKNOWN）。
     */
    default String buildStatement(ProofRequest request, ExecutionAck ack, EvidenceBundle bundle) {
        if (request.getClaimType() == ClaimType.ORDER_PLACED) {
            return "Order " + request.getOrderRef()
                    + " for account " + request.getAccountRef()
                    + " was accepted on venue " + request.getVenue().getSlug()
                    + " at " + Timestamps.format(ack.getAcceptedAt()) + ".";
        }
        String executionRef = request.getExecutionRef() == null ? "UNKNOWN" : request.getExecutionRef();
        return "Order " + request.getOrderRef()
                + " for account " + request.getAccountRef()
                + " was executed on venue " + request.getVenue().getSlug()
                + " with execution ref " + executionRef + ".";
    }
}
