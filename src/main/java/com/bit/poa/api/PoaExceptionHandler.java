package com.bit.poa.api;

import com.bit.poa.engine.PoaException;
import com.bit.poa.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * PoA 异常统一转换为 Result 返回，data 为错误类型
 */
@Slf4j
@RestControllerAdvice
public class PoaExceptionHandler {

    @ExceptionHandler(PoaException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Result<String> handle(PoaException e) {
        log.warn("请求处理失败: {}", e.getMessage());
        return Result.error(Result.SC_BAD_REQUEST_400, e.getMessage(), e.getErrorType().name());
    }
}
