package com.work.validator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot 启动入口，通过 REST 接口驱动验证者集合管理。
 */
@SpringBootApplication
@EnableScheduling
public class ValidatorManagerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ValidatorManagerApplication.class, args);
    }
}
