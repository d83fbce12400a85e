package com.loci.common.constant;

public class RedisConstants {

    private RedisConstants() {
    }

    /** 生成结果缓存前缀 cache:gen:{md5} */
    public static final String CACHE_GENERATION_KEY = "cache:gen:";

    /** 限流 bizKey：按用户限制 AI 生成请求 */
    public static final String RATE_LIMIT_CHAT_USER = "chat:generate:user";
}
