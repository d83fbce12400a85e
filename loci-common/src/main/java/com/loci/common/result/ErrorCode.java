package com.loci.common.result;

/**
 * 错误码枚举。
 * <p>1xxx 请求类错误，2xxx AI 生成错误，3xxx 持久化错误。</p>
 */
public enum ErrorCode {

    SUCCESS(0, "ok"),

    /** 通用业务错误（未细分场景时的兜底） */
    COMMON_ERROR(1, "error"),

    /** 请求参数不合法（为空等） */
    INVALID_PARAM(1001, "请求参数不合法"),

    /** 未携带用户标识 */
    USER_MISSING(1002, "缺少用户标识"),

    /** 请求过于频繁 */
    TOO_FREQUENT(1003, "请求过于频繁，请稍后再试"),

    /** 会话不存在或已过期 */
    SESSION_NOT_FOUND(1004, "会话不存在或已过期"),

    /** 坐标越界 */
    INVALID_COORDINATES(1005, "坐标不合法"),

    /** AI 配置缺失 */
    AI_CONFIG_MISSING(2001, "AI 配置不完整"),

    /** AI 调用失败（网络/HTTP/解析） */
    AI_CALL_FAILED(2002, "AI 调用失败"),

    /** AI 返回空内容 */
    AI_EMPTY_CONTENT(2003, "AI 返回内容为空"),

    /** 所有生成任务均失败 */
    AI_ALL_TASKS_FAILED(2004, "AI 生成全部失败，请稍后重试"),

    /** 持久化失败 */
    PERSISTENCE_FAILED(3001, "数据保存失败"),

    /** 引用的 LLM 交互记录不存在 */
    INTERACTION_NOT_FOUND(3002, "LLM 交互记录不存在");

    private final int code;
    private final String msg;

    ErrorCode(int code, String msg) {
        this.code = code;
        this.msg = msg;
    }

    public int getCode() {
        return code;
    }

    public String getMsg() {
        return msg;
    }
}
