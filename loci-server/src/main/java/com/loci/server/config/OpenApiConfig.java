package com.loci.server.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Collections;

/**
 * SpringDoc OpenAPI 文档配置，页面地址 /swagger-ui.html。
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI lociOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Loci 后端接口文档")
                        .description("Loci 旅行助手：AI 城市信息 / POI 生成、行程落库与距离排序")
                        .version("v1"))
                .servers(Collections.singletonList(
                        new Server().url("/").description("默认服务端")
                ));
    }
}
