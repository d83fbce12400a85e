package com.loci.server;

import com.loci.common.properties.AiProperties;
import com.loci.common.properties.ChatProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@MapperScan("com.loci.server.mapper")
@EnableConfigurationProperties({AiProperties.class, ChatProperties.class})
@EnableScheduling
public class LociServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LociServerApplication.class, args);
    }
}
