package com.golizard.termgraph;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 术语图清理服务 - SpringBoot启动类
 */
@Slf4j
@SpringBootApplication
public class TermGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(TermGraphApplication.class, args);
        log.info("========================================");
        log.info("术语图清理服务启动成功！");
        log.info("========================================");
    }
}
