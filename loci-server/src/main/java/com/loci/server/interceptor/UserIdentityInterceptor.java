package com.loci.server.interceptor;

import com.loci.common.context.BaseContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.AsyncHandlerInterceptor;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

/**
 * 读取网关透传的 X-User-Id（认证由网关完成），写入 BaseContext 与 MDC。
 */
@Component
@Slf4j
public class UserIdentityInterceptor implements AsyncHandlerInterceptor {

    static final String USER_ID_HEADER = "X-User-Id";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod)) {
            return true;
        }
        String raw = request.getHeader(USER_ID_HEADER);
        if (raw == null || raw.isBlank()) {
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            return false;
        }
        try {
            Long userId = Long.valueOf(raw.trim());
            BaseContext.setCurrentId(userId);
            MDC.put("userId", String.valueOf(userId));
            return true;
        } catch (NumberFormatException e) {
            log.warn("非法的 X-User-Id: {}", raw);
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            return false;
        }
    }

    @Override
    public void afterConcurrentHandlingStarted(HttpServletRequest request, HttpServletResponse response, Object handler) {
        // SSE 请求在此返回容器线程，后续不会再走 afterCompletion
        BaseContext.clear();
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        BaseContext.clear();
    }
}
