package com.loci.common.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 对话生成流程相关配置：工作线程、流式投递、会话与缓存 TTL、限流。
 */
@Data
@ConfigurationProperties(prefix = "loci.chat")
public class ChatProperties {

    /** 生成任务线程池大小 */
    private int workerPoolSize = 12;

    /** 单次编排等待所有任务的最长时间（秒） */
    private long workerTimeoutSeconds = 120;

    /** 流式事件单次投递超时（毫秒） */
    private long streamSendTimeoutMs = 2000;

    /** 流式事件投递重试次数 */
    private int streamSendRetries = 3;

    /** 流式事件缓冲队列容量 */
    private int streamQueueCapacity = 100;

    /** SSE 连接超时（毫秒） */
    private long sseTimeoutMs = 300_000;

    /** 会话有效期（小时） */
    private long sessionTtlHours = 24;

    /** 过期会话清理间隔（毫秒） */
    private long sessionExpiryIntervalMs = 300_000;

    /** 生成结果缓存 TTL（小时） */
    private long cacheTtlHours = 48;

    /** 生成接口限流窗口（秒） */
    private long rateLimitWindowSeconds = 60;

    /** 窗口内最大请求数 */
    private long rateLimitMaxRequests = 20;
}
