package com.loci.common.exception;

import com.loci.common.result.ErrorCode;

/**
 * AI 生成阶段的异常：配置缺失、HTTP 失败、空内容、JSON 解析失败等。
 */
public class GenerationException extends BaseException {

    public GenerationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public GenerationException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
