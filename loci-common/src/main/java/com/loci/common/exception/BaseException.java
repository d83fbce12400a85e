package com.loci.common.exception;

import com.loci.common.result.ErrorCode;

/**
 * 统一的业务异常类型，由全局异常处理器转换为 Result 响应。
 */
public class BaseException extends RuntimeException {

    private final Integer code;

    public BaseException(String message) {
        super(message);
        this.code = ErrorCode.COMMON_ERROR.getCode();
    }

    public BaseException(ErrorCode errorCode) {
        super(errorCode.getMsg());
        this.code = errorCode.getCode();
    }

    public BaseException(ErrorCode errorCode, String message) {
        super(message);
        this.code = errorCode.getCode();
    }

    public BaseException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.code = errorCode.getCode();
    }

    public Integer getCode() {
        return code;
    }
}
