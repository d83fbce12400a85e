package com.loci.server.filter;

import com.loci.common.context.BaseContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;

/**
 * 请求级日志过滤器：
 * - 生成或透传 X-Trace-Id，写入 MDC 与响应头；
 * - 请求开始 / 结束各打一条日志，结束日志带 userId、状态码与耗时。
 *
 * SSE 请求在 doFilter 返回时流尚未结束，这里记录的是握手耗时。
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class TraceLoggingFilter extends OncePerRequestFilter {

    public static final String TRACE_ID_HEADER = "X-Trace-Id";
    public static final String TRACE_ID_KEY = "traceId";
    private static final String USER_ID_KEY = "userId";

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        long start = System.currentTimeMillis();

        String incomingTraceId = request.getHeader(TRACE_ID_HEADER);
        String traceId = StringUtils.hasText(incomingTraceId) ? incomingTraceId : generateTraceId();
        MDC.put(TRACE_ID_KEY, traceId);
        response.setHeader(TRACE_ID_HEADER, traceId);

        try {
            log.info("HTTP 请求开始: traceId={}, method={}, uri={}, remoteIp={}",
                    traceId, request.getMethod(), request.getRequestURI(), request.getRemoteAddr());
            filterChain.doFilter(request, response);
        } finally {
            long duration = System.currentTimeMillis() - start;
            String mdcUserId = MDC.get(USER_ID_KEY);
            Long userId = BaseContext.getCurrentId();
            String finalUserId = StringUtils.hasText(mdcUserId)
                    ? mdcUserId
                    : (userId == null ? "null" : String.valueOf(userId));

            log.info("HTTP 请求结束: traceId={}, userId={}, method={}, uri={}, status={}, durationMs={}",
                    traceId, finalUserId, request.getMethod(), request.getRequestURI(),
                    response.getStatus(), duration);

            // 线程复用，避免串线
            MDC.remove(TRACE_ID_KEY);
            MDC.remove(USER_ID_KEY);
        }
    }

    private String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
