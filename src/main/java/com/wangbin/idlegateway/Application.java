package com.wangbin.idlegateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
@Slf4j
public class Application {

    public static void main(String[] args) {
        log.info("=== 开始执行网关空闲分析 ===");
        SpringApplication.run(Application.class, args);
    }
}
