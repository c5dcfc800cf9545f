package com.bit.poa.util;

import com.bit.poa.engine.ErrorType;
import com.bit.poa.engine.PoaException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;

/**
 * 规范化JSON：键按字典序排序、无空白，作为区块哈希的输入
 * 同一逻辑内容在任何节点上序列化结果必须逐字节一致
 */
public final class CanonicalJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.INDENT_OUTPUT, false);

    private CanonicalJson() {
    }

    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PoaException(ErrorType.HASH_COMPUTE_FAILED, "规范化序列化失败: " + e.getOriginalMessage(), e);
        }
    }

    public static byte[] writeBytes(Object value) {
        return write(value).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * 规范化JSON的SHA-256，返回64位十六进制
     */
    public static String sha256Hex(Object value) {
        return Sha.toHex(Sha.applySHA256(writeBytes(value)));
    }
}
