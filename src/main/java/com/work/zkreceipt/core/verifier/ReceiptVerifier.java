package com.work.zkreceipt.core.verifier;

import com.work.zkreceipt.core.model.ZkReceipt;

/**
 * receipt 校验端口：纯函数、无副作用、无失败通道（没有证明即“未通过”）。
 */
@FunctionalInterface
public interface ReceiptVerifier {

    boolean verify(ZkReceipt receipt);
}
