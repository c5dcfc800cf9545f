package com.bit.poa.engine;

/**
 * 区块验证失败原因，按验证步骤顺序排列
 */
public enum RejectReason {
    GENESIS_MISMATCH,
    HASH_MISMATCH,
    SLOT_NOT_ADVANCING,
    PARENT_MISMATCH,
    NO_SNAPSHOT,
    NOT_SCHEDULED_LEADER,
    INACTIVE_AUTHORITY,
    SLOT_TIMESTAMP_MISMATCH,
    MISSING_SIGNATURE,
    SIGNATURE_MISMATCH
}
