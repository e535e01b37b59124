package com.hao.comments;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 页面评论服务启动入口
 *
 * 类职责：
 * 负责引导 Spring Boot 应用启动与组件扫描。
 *
 * 核心实现思路：
 * - 组合 @SpringBootApplication 完成自动配置与组件扫描。
 * - 监听地址与端口由 server.address / server.port 配置（默认 127.0.0.1:2668）。
 */
@SpringBootApplication
public class CommentsApplication {

    /**
     * 应用主入口
     *
     * @param args 命令行参数
     */
    public static void main(String[] args) {
        // 核心启动入口：触发 Spring Boot 应用启动
        SpringApplication.run(CommentsApplication.class, args);
    }
}
