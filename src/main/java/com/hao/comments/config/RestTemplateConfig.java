package com.hao.comments.config;

import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.core5.util.TimeValue;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * RestTemplate 客户端配置
 *
 * 类职责：
 * 构建带连接池的 RestTemplate，供 Akismet 反垃圾接口调用。
 *
 * 核心实现思路：
 * - 通过 HttpClient 连接池管理连接。
 * - 连接超时与读取超时取自 comments.akismet 配置，审核调用卡住时不会无限占用请求线程。
 */
@Configuration
public class RestTemplateConfig {

    /**
     * 构建带连接池的 RestTemplate
     *
     * 实现逻辑：
     * 1. 初始化连接池，Akismet 只有一个目标主机，单路由上限与总上限一致。
     * 2. 构建 HttpClient 并注入请求工厂。
     * 3. 连接超时与读取超时配置在连接池的默认连接配置上。
     *
     * @param properties 评论配置
     * @return RestTemplate 客户端
     */
    @Bean
    public RestTemplate restTemplate(CommentsProperties properties) {
        PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
        connectionManager.setMaxTotal(50);
        connectionManager.setDefaultMaxPerRoute(50);
        connectionManager.setDefaultConnectionConfig(akismetConnectionConfig(properties.getAkismet()));

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .evictIdleConnections(TimeValue.ofMinutes(1)) // 回收空闲超过1分钟的连接
                .evictExpiredConnections()
                .build();

        return new RestTemplate(new HttpComponentsClientHttpRequestFactory(httpClient));
    }

    /**
     * Akismet 连接配置
     *
     * @param akismet Akismet 配置
     * @return 连接超时与 Socket 读取超时
     */
    static ConnectionConfig akismetConnectionConfig(CommentsProperties.Akismet akismet) {
        return ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(akismet.getConnectTimeout().toMillis()))
                .setSocketTimeout(Timeout.ofMilliseconds(akismet.getReadTimeout().toMillis()))
                .build();
    }
}
