package com.work.zkreceipt.core.model;

public enum VerificationMode {
    OFFCHAIN,
    ONCHAIN_ANCHORED,
    OFFCHAIN_AND_ANCHORED
}
