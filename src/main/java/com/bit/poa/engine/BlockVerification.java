package com.bit.poa.engine;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 区块验证结果封装类
 * 包含验证状态、失败原因和错误信息（验证失败时）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BlockVerification {
    private boolean valid;          // 验证是否通过
    private RejectReason reason;    // 失败原因（验证通过时为 null）
    private String message;         // 错误信息

    public static BlockVerification ok() {
        return new BlockVerification(true, null, "");
    }

    public static BlockVerification reject(RejectReason reason, String message) {
        return new BlockVerification(false, reason, message);
    }
}
