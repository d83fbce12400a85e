package com.loci.server.ai.client;

/**
 * 生成式模型调用接口。
 *
 * 实现必须响应线程中断：调用线程被中断时应尽快放弃进行中的请求并抛出 InterruptedException。
 * 其它失败（配置缺失、HTTP 错误、解析失败）抛出 GenerationException。
 */
public interface GenerationClient {

    GenerateContentResponse generateResponse(String prompt, GenerationConfig config) throws InterruptedException;
}
