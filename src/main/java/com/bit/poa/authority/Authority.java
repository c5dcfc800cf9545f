package com.bit.poa.authority;

import com.bit.poa.common.Payloads;
import com.bit.poa.engine.ErrorType;
import com.bit.poa.engine.PoaException;
import com.bit.poa.util.Sha;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.With;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 权威节点：允许按调度出块的验证者
 * 不可变值对象，更新即生成新实例，快照中的副本永远不会被后续修改影响
 */
@Getter
@EqualsAndHashCode
@ToString(exclude = "secret")
public final class Authority {

    /**
     * 唯一标识（区分大小写，去除首尾空白后非空）
     */
    private final String identifier;

    /**
     * 共享密钥：出块者与验证者用同一密钥计算 HMAC
     */
    @With
    private final String secret;

    /**
     * 权重：每个轮转周期内分配到的槽位数，至少为 1
     */
    @With
    private final int weight;

    @With
    private final boolean active;

    /**
     * 不透明元数据，可为 null
     */
    @With
    private final Map<String, Object> metadata;

    public Authority(String identifier, String secret, int weight, boolean active, Map<String, Object> metadata) {
        this.identifier = normaliseIdentifier(identifier);
        this.secret = normaliseSecret(secret);
        if (weight < 1) {
            throw new PoaException(ErrorType.CONFIG_INVALID, "权重必须至少为1: " + weight);
        }
        this.weight = weight;
        this.active = active;
        try {
            this.metadata = Payloads.copyOfNullable(metadata);
        } catch (IllegalArgumentException e) {
            throw new PoaException(ErrorType.CONFIG_INVALID, "权威节点元数据非法: " + e.getMessage(), e);
        }
    }

    public static Authority of(String identifier, String secret, int weight) {
        return new Authority(identifier, secret, weight, true, null);
    }

    /**
     * 用本节点密钥对消息签名（HMAC-SHA256）
     */
    public byte[] sign(String message) {
        return Sha.hmacSHA256(secret, message);
    }

    /**
     * 对外公开视图（不含密钥）
     */
    public Map<String, Object> describe() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("identifier", identifier);
        view.put("weight", weight);
        view.put("active", active);
        view.put("metadata", metadata);
        return view;
    }

    public static String normaliseIdentifier(String value) {
        String cleaned = value == null ? "" : value.strip();
        if (cleaned.isEmpty()) {
            throw new PoaException(ErrorType.CONFIG_INVALID, "标识不能为空");
        }
        return cleaned;
    }

    private static String normaliseSecret(String value) {
        String cleaned = value == null ? "" : value.strip();
        if (cleaned.isEmpty()) {
            throw new PoaException(ErrorType.CONFIG_INVALID, "密钥不能为空");
        }
        return cleaned;
    }
}
