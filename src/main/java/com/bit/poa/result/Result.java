package com.bit.poa.result;

import lombok.Data;

import java.io.Serializable;

/**
 *   接口返回数据格式
 */
@Data
public class Result<T> implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final Integer SC_OK_200 = 200;
    public static final Integer SC_BAD_REQUEST_400 = 400;
    public static final Integer SC_INTERNAL_SERVER_ERROR_500 = 500;

    /**
     * 成功标志 true=成功，false=失败
     */
    private boolean success = true;

    /**
     * 返回处理消息
     */
    private String message = "";

    /**
     * 返回代码
     */
    private Integer code = 0;

    /**
     * 返回数据对象 data
     */
    private T data;

    /**
     * 时间戳
     */
    private long timestamp = System.currentTimeMillis();

    public static<T> Result<T> OK(T data) {
        Result<T> r = new Result<T>();
        r.setSuccess(true);
        r.setCode(SC_OK_200);
        r.setData(data);
        return r;
    }

    public static<T> Result<T> error(String msg, T data) {
        Result<T> r = new Result<T>();
        r.setSuccess(false);
        r.setCode(SC_INTERNAL_SERVER_ERROR_500);
        r.setMessage(msg);
        r.setData(data);
        return r;
    }

    public static<T> Result<T> error(int code, String msg, T data) {
        Result<T> r = error(msg, data);
        r.setCode(code);
        return r;
    }
}
