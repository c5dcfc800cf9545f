package com.bit.poa.engine;

public enum ErrorType {
    CONFIG_INVALID("PoA 配置无效（槽位时长/标识/密钥/权重非法）"),
    DUPLICATE_AUTHORITY("权威节点重复注册"),
    UNKNOWN_AUTHORITY("权威节点未注册"),
    INACTIVE_AUTHORITY("权威节点未激活"),
    OUT_OF_RANGE("时间戳早于创世时间"),
    INVALID_SLOT("槽位非法（创世槽位或无可用快照）"),
    GENESIS_SLOT_RESERVED("创世槽位保留，不允许出块"),
    NO_ACTIVE_AUTHORITIES("当前槽位无激活的权威节点"),
    SLOT_NOT_ADVANCING("槽位未超过链头槽位"),
    NOT_SCHEDULED_LEADER("非该槽位的调度出块者"),
    BLOCK_REJECTED("区块验证失败被拒绝"),
    HASH_COMPUTE_FAILED("哈希计算失败（序列化或摘要算法异常）");

    private final String desc;

    ErrorType(String desc) {
        this.desc = desc;
    }

    public String getDesc() {
        return desc;
    }
}
