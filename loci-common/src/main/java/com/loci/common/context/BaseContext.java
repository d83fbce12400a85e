package com.loci.common.context;

/**
 * 保存当前请求的用户 ID（基于 ThreadLocal），由网关透传的 X-User-Id 写入。
 */
public class BaseContext {

    private static final ThreadLocal<Long> CURRENT_ID = new ThreadLocal<>();

    public static void setCurrentId(Long id) {
        CURRENT_ID.set(id);
    }

    public static Long getCurrentId() {
        return CURRENT_ID.get();
    }

    public static void clear() {
        CURRENT_ID.remove();
    }
}
