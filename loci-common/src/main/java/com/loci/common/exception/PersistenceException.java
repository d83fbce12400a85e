package com.loci.common.exception;

import com.loci.common.result.ErrorCode;

/**
 * 持久化异常，携带失败的步骤名，方便定位。
 */
public class PersistenceException extends BaseException {

    private final String step;

    public PersistenceException(String step, String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_FAILED, "[" + step + "] " + message, cause);
        this.step = step;
    }

    public PersistenceException(ErrorCode errorCode, String step, String message) {
        super(errorCode, "[" + step + "] " + message);
        this.step = step;
    }

    public String getStep() {
        return step;
    }
}
