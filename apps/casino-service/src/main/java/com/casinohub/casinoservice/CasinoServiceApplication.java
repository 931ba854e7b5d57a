package com.casinohub.casinoservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * casino-service 启动入口。
 * 会话管理与 Kafka 通知器经各自模块的自动配置装配。
 */
@SpringBootApplication
public class CasinoServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CasinoServiceApplication.class, args);
    }
}
