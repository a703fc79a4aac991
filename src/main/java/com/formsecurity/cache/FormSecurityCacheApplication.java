package com.formsecurity.cache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 表单安全三级缓存服务启动类
 * REQUEST → MEMORY → DATABASE
 */
@SpringBootApplication
@EnableScheduling
public class FormSecurityCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(FormSecurityCacheApplication.class, args);
    }
}
