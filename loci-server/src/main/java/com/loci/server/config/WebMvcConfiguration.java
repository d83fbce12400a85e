package com.loci.server.config;

import com.loci.server.interceptor.UserIdentityInterceptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class WebMvcConfiguration implements WebMvcConfigurer {

    private final UserIdentityInterceptor userIdentityInterceptor;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        log.info("注册用户标识拦截器...");
        registry.addInterceptor(userIdentityInterceptor)
                .addPathPatterns("/chat/**");
    }
}
