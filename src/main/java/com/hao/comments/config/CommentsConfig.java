package com.hao.comments.config;

import com.hao.comments.common.enums.RedisKeysEnum;
import com.hao.comments.integration.redis.RedisClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;

import java.time.Clock;

/**
 * 评论业务配置类
 *
 * 类职责：
 * 启用 CommentsProperties 绑定，提供时钟 Bean，并在启动时初始化自动启用白名单。
 *
 * 核心实现思路：
 * - 时钟以 Bean 形式注入 ID 分配器，测试中可替换。
 * - 白名单仅在配置非空时写入，写入失败只记录错误，不阻断启动。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(CommentsProperties.class)
public class CommentsConfig {

    /**
     * 系统时钟
     *
     * @return UTC 系统时钟
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 启动时写入自动启用白名单
     *
     * 实现逻辑：
     * 1. 读取 comments.auto-enable-hosts 配置。
     * 2. 非空时 SADD 到白名单集合。
     *
     * @param redisClient Redis 客户端
     * @param properties 评论配置
     * @return 启动任务
     */
    @Bean
    public CommandLineRunner seedAutoEnableHosts(RedisClient<String> redisClient, CommentsProperties properties) {
        return args -> {
            if (properties.getAutoEnableHosts().isEmpty()) {
                return;
            }
            String[] hosts = properties.getAutoEnableHosts().toArray(new String[0]);
            try {
                Long added = redisClient.sadd(RedisKeysEnum.AUTO_ENABLE.getKey(), hosts);
                log.info("自动启用白名单初始化完成|Auto_enable_hosts_seeded,hosts={},added={}",
                        properties.getAutoEnableHosts(), added);
            } catch (DataAccessException e) {
                log.error("自动启用白名单初始化失败|Auto_enable_hosts_seed_fail,error={}", e.getMessage(), e);
            }
        };
    }
}
