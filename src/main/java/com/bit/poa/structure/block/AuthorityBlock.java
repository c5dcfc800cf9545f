package com.bit.poa.structure.block;

import com.bit.poa.common.BlockHash;
import com.bit.poa.common.Payloads;
import com.bit.poa.util.CanonicalJson;
import com.bit.poa.util.Sha;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * 权威节点在某个槽位产出的区块
 * 不可变：toBuilder() 得到的副本保留原内容哈希，任何字段被改动后 hash 与 computeHash() 不再一致
 */
@Getter
@EqualsAndHashCode
@ToString(exclude = "signature")
public final class AuthorityBlock {

    public static final String GENESIS_PROPOSER = "__genesis__";

    /**
     * 插槽号：创世区块为 0，其余区块必须严格大于父区块
     */
    private final long slot;

    /**
     * 出块者标识（创世区块为 {@link #GENESIS_PROPOSER}）
     */
    private final String proposer;

    /**
     * 出块时间（UTC），必须落在 slot 对应的时间窗口内
     */
    private final Instant timestamp;

    private final Map<String, Object> payload;

    /**
     * 父区块内容哈希（64位十六进制），创世区块为全 0
     */
    private final String parentHash;

    /**
     * 存储的内容哈希，验证时与 computeHash() 比对
     */
    private final BlockHash hash;

    /**
     * HMAC-SHA256(出块者密钥, hash 十六进制)，创世区块为 null
     */
    private final byte[] signature;

    private final Map<String, Object> metadata;

    @Builder(toBuilder = true)
    private AuthorityBlock(long slot, String proposer, Instant timestamp, Map<String, Object> payload,
                           String parentHash, BlockHash hash, byte[] signature, Map<String, Object> metadata) {
        if (slot < 0) {
            throw new IllegalArgumentException("槽位号不能为负: " + slot);
        }
        if (proposer == null || proposer.isBlank()) {
            throw new IllegalArgumentException("出块者标识不能为空");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("出块时间不能为空");
        }
        if (parentHash == null || parentHash.length() != BlockHash.HEX_LENGTH) {
            throw new IllegalArgumentException("父哈希必须为64位十六进制: " + parentHash);
        }
        this.slot = slot;
        this.proposer = proposer.strip();
        this.timestamp = timestamp;
        this.payload = Payloads.copyOf(payload);
        this.parentHash = parentHash;
        this.metadata = Payloads.copyOfNullable(metadata);
        this.signature = signature == null ? null : signature.clone();
        this.hash = hash != null ? hash : computeHash();
    }

    /**
     * 新建区块并计算内容哈希（未签名）
     */
    public static AuthorityBlock create(long slot, String proposer, Instant timestamp, Map<String, Object> payload,
                                        String parentHash, Map<String, Object> metadata) {
        return AuthorityBlock.builder()
                .slot(slot)
                .proposer(proposer)
                .timestamp(timestamp)
                .payload(payload)
                .parentHash(parentHash)
                .metadata(metadata)
                .build();
    }

    public static AuthorityBlock genesis(Instant timestamp, Map<String, Object> payload, Map<String, Object> metadata) {
        return create(0, GENESIS_PROPOSER, timestamp, payload, BlockHash.ZERO.toHex(), metadata);
    }

    public boolean isGenesis() {
        return slot == 0;
    }

    /**
     * 参与哈希的字段：slot、proposer、timestamp、payload、parent_hash、metadata
     */
    public Map<String, Object> basePayload() {
        Map<String, Object> base = new TreeMap<>();
        base.put("slot", slot);
        base.put("proposer", proposer);
        base.put("timestamp", formatTimestamp(timestamp));
        base.put("payload", payload);
        base.put("parent_hash", parentHash);
        base.put("metadata", metadata);
        return base;
    }

    public BlockHash computeHash() {
        return BlockHash.fromHex(CanonicalJson.sha256Hex(basePayload()));
    }

    /**
     * 签名消息即内容哈希的十六进制
     */
    public String signingMessage() {
        return hash.toHex();
    }

    public AuthorityBlock withSignature(byte[] signature) {
        return toBuilder().signature(signature).build();
    }

    public byte[] getSignature() {
        return signature == null ? null : signature.clone();
    }

    public boolean hasSignature() {
        return signature != null && signature.length > 0;
    }

    /**
     * 可序列化的区块记录，交给外部传播/持久化层
     */
    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("slot", slot);
        record.put("proposer", proposer);
        record.put("timestamp", formatTimestamp(timestamp));
        record.put("payload", payload);
        record.put("parent_hash", parentHash);
        record.put("hash", hash.toHex());
        record.put("signature", signature == null ? null : Sha.toHex(signature));
        record.put("metadata", metadata);
        return record;
    }

    public static String formatTimestamp(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant);
    }
}
