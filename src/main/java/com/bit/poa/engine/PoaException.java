package com.bit.poa.engine;

/**
 * PoA 层自定义异常：统一封装异常类型与错误信息，调用方按 {@link ErrorType} 分类处理
 */
public class PoaException extends RuntimeException {

    private final ErrorType errorType;

    // 区块被拒绝时的具体原因，其余类型为 null
    private final RejectReason rejectReason;

    public PoaException(ErrorType errorType, String message) {
        this(errorType, null, message);
    }

    public PoaException(ErrorType errorType, RejectReason rejectReason, String message) {
        super("[" + errorType.getDesc() + "]：" + message);
        this.errorType = errorType;
        this.rejectReason = rejectReason;
    }

    public PoaException(ErrorType errorType, String message, Throwable cause) {
        super("[" + errorType.getDesc() + "]：" + message, cause);
        this.errorType = errorType;
        this.rejectReason = null;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public RejectReason getRejectReason() {
        return rejectReason;
    }
}
