package com.hao.comments.config;

import com.hao.comments.integration.redis.RedisClient;
import com.hao.comments.integration.redis.RedisClientImpl;
import io.lettuce.core.api.StatefulConnection;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisClusterConfiguration;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Redis 连接配置类
 * <p>
 * 类职责：
 * 构建 Lettuce 连接工厂、模板与自定义客户端封装。
 *
 * 设计目的：
 * 1. 统一 Redis 连接与序列化配置，评论服务的唯一存储就是 Redis。
 * 2. 同时支持单机与集群部署，评论相关键都带 Hash Tag，集群下同一页面的键落在同一槽位。
 *
 * 核心实现思路：
 * - 读取 RedisProperties，配置了 cluster.nodes 时走集群，否则走单机。
 * - 使用 commons-pool2 连接池并设置命令超时。
 * - 启动时 PING 一次，便于健康校验。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RedisProperties.class)
public class RedisConfig {

    private final RedisProperties redisProperties;

    public RedisConfig(RedisProperties redisProperties) {
        this.redisProperties = redisProperties;
    }

    /**
     * 创建并配置 Lettuce 连接工厂
     *
     * 实现逻辑：
     * 1. 组装连接池参数与命令超时。
     * 2. 根据是否配置集群节点选择集群或单机配置。
     * 3. 实例化连接工厂。
     *
     * @return LettuceConnectionFactory 配置好的连接工厂
     */
    @Bean
    public LettuceConnectionFactory redisConnectionFactory() {
        // --- 1. 配置连接池参数 (GenericObjectPool) ---
        GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig = new GenericObjectPoolConfig<>();
        RedisProperties.Pool pool = redisProperties.getLettuce().getPool();
        if (pool != null) {
            poolConfig.setMaxTotal(pool.getMaxActive());
            poolConfig.setMaxIdle(pool.getMaxIdle());
            poolConfig.setMinIdle(pool.getMinIdle());
            // 获取连接最大等待时间，超时则抛出异常
            poolConfig.setMaxWait(pool.getMaxWait());
        }

        // 设置默认命令超时时间 (默认5秒)
        Duration timeout = redisProperties.getTimeout() != null ? redisProperties.getTimeout() : Duration.ofSeconds(5);

        LettuceClientConfiguration clientConfiguration = LettucePoolingClientConfiguration.builder()
                .commandTimeout(timeout)
                .poolConfig(poolConfig)
                .build();

        // --- 2. 集群或单机 ---
        LettuceConnectionFactory connectionFactory;
        RedisProperties.Cluster cluster = redisProperties.getCluster();
        if (cluster != null && !CollectionUtils.isEmpty(cluster.getNodes())) {
            RedisClusterConfiguration config = new RedisClusterConfiguration(cluster.getNodes());
            // 设置最大重定向次数 (防止集群拓扑变更时的死循环)
            if (cluster.getMaxRedirects() != null) {
                config.setMaxRedirects(cluster.getMaxRedirects());
            }
            if (StringUtils.hasText(redisProperties.getPassword())) {
                config.setPassword(redisProperties.getPassword());
            }
            connectionFactory = new LettuceConnectionFactory(config, clientConfiguration);
            log.info("Redis集群连接工厂创建完成|Redis_cluster_factory_created,nodes={},poolMax={}",
                    cluster.getNodes(), poolConfig.getMaxTotal());
        } else {
            RedisStandaloneConfiguration config =
                    new RedisStandaloneConfiguration(redisProperties.getHost(), redisProperties.getPort());
            config.setDatabase(redisProperties.getDatabase());
            if (StringUtils.hasText(redisProperties.getPassword())) {
                config.setPassword(redisProperties.getPassword());
            }
            connectionFactory = new LettuceConnectionFactory(config, clientConfiguration);
            log.info("Redis单机连接工厂创建完成|Redis_standalone_factory_created,host={},port={},poolMax={}",
                    redisProperties.getHost(), redisProperties.getPort(), poolConfig.getMaxTotal());
        }

        // 开启连接校验，确保获取到的连接是可用的
        connectionFactory.setValidateConnection(true);
        return connectionFactory;
    }

    /**
     * 配置 StringRedisTemplate
     * <p>
     * 键和值都是 String 序列化，评论数据全部以字符串存储。
     */
    @Bean
    public StringRedisTemplate stringRedisTemplate(LettuceConnectionFactory connectionFactory) {
        StringRedisTemplate template = new StringRedisTemplate();
        template.setConnectionFactory(connectionFactory);
        log.info("StringRedisTemplate初始化完成|StringRedisTemplate_init_done");
        return template;
    }

    /**
     * 配置自定义的 RedisClient 封装类
     *
     * @param stringRedisTemplate Redis 模板
     * @return RedisClient 客户端封装
     */
    @Bean
    public RedisClient<String> redisClient(StringRedisTemplate stringRedisTemplate) {
        return new RedisClientImpl(stringRedisTemplate);
    }

    /**
     * 启动时健康检查
     * <p>
     * 容器启动完成后 PING 一次 Redis，失败只记录日志，不阻断启动。
     */
    @Bean
    public CommandLineRunner pingRedis(LettuceConnectionFactory factory) {
        return args -> {
            try (RedisConnection connection = factory.getConnection()) {
                String pong = connection.ping();
                log.info("Redis连接成功|Redis_connect_success,reply={}", pong);
            } catch (Exception e) {
                log.error("Redis连接失败|Redis_connect_fail,error={}", e.getMessage(), e);
            }
        };
    }
}
