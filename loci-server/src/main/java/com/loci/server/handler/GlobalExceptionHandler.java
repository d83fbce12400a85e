package com.loci.server.handler;

import com.loci.common.exception.BaseException;
import com.loci.common.exception.GenerationException;
import com.loci.common.exception.PersistenceException;
import com.loci.common.result.ErrorCode;
import com.loci.common.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(GenerationException.class)
    public Result<Void> handleGenerationException(GenerationException ex) {
        log.error("生成异常: code={}, msg={}", ex.getCode(), ex.getMessage());
        return Result.error(ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(PersistenceException.class)
    public Result<Void> handlePersistenceException(PersistenceException ex) {
        log.error("持久化异常: step={}, msg={}", ex.getStep(), ex.getMessage(), ex);
        return Result.error(ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(BaseException.class)
    public Result<Void> handleBaseException(BaseException ex) {
        log.error("业务异常: code={}, msg={}", ex.getCode(), ex.getMessage());
        return Result.error(ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public Result<Void> handleBadRequest(Exception ex) {
        log.warn("请求参数错误: {}", ex.getMessage());
        return Result.error(ErrorCode.INVALID_PARAM);
    }

    @ExceptionHandler(DuplicateKeyException.class)
    public Result<Void> handleDuplicateKey(DuplicateKeyException ex) {
        log.error("唯一键冲突: {}", ex.getMessage());
        return Result.error(ErrorCode.PERSISTENCE_FAILED.getCode(), "数据已存在");
    }

    @ExceptionHandler(DataAccessException.class)
    public Result<Void> handleDataAccess(DataAccessException ex) {
        log.error("数据库异常", ex);
        return Result.error(ErrorCode.PERSISTENCE_FAILED.getCode(), "数据库操作异常");
    }

    @ExceptionHandler(Exception.class)
    public Result<Void> handleOtherException(Exception ex) {
        log.error("系统异常", ex);
        return Result.error("系统异常，请稍后重试");
    }
}
