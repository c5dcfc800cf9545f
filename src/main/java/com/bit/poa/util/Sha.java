package com.bit.poa.util;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.util.Arrays;
import org.bouncycastle.util.encoders.Hex;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.Security;

public class Sha {

    // ThreadLocal存储每个线程独立的SHA-256实例
    private static final ThreadLocal<MessageDigest> SHA256_THREAD_LOCAL = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance("SHA-256", BouncyCastleProvider.PROVIDER_NAME);
        } catch (Exception e) {
            throw new RuntimeException("创建线程本地SHA-256实例失败", e);
        }
    });

    // 静态代码块：确保BouncyCastle先注册
    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
        try {
            SHA256_THREAD_LOCAL.get();
        } catch (Exception e) {
            throw new RuntimeException("哈希算法初始化验证失败：" + e.getMessage()
                    + "，请确保BouncyCastle依赖正确", e);
        }
    }

    private Sha() {
    }

    /**
     * 线程安全的SHA-256计算（每个线程复用自己的实例）
     */
    public static byte[] applySHA256(byte[] data) {
        // 允许空数组（哈希计算空数组是合法的）
        data = data == null ? new byte[0] : data;
        MessageDigest digest = SHA256_THREAD_LOCAL.get();
        digest.reset();
        return digest.digest(data);
    }

    /**
     * HMAC-SHA256：权威节点用共享密钥对区块哈希签名
     * @param key 密钥原始字节（不可为空）
     * @param message 待签名消息
     * @return 32字节 MAC
     */
    public static byte[] hmacSHA256(byte[] key, byte[] message) {
        if (key == null || key.length == 0) {
            throw new IllegalArgumentException("HMAC密钥不能为空");
        }
        HMac hmac = new HMac(new SHA256Digest());
        hmac.init(new KeyParameter(key));
        byte[] input = message == null ? new byte[0] : message;
        hmac.update(input, 0, input.length);
        byte[] out = new byte[hmac.getMacSize()];
        hmac.doFinal(out, 0);
        return out;
    }

    public static byte[] hmacSHA256(String key, String message) {
        return hmacSHA256(key.getBytes(StandardCharsets.UTF_8), message.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 常量时间比较，避免签名校验的时序侧信道
     */
    public static boolean constantTimeEquals(byte[] a, byte[] b) {
        if (a == null || b == null) {
            return false;
        }
        return Arrays.constantTimeAreEqual(a, b);
    }

    public static String toHex(byte[] bytes) {
        return Hex.toHexString(bytes);
    }
}
