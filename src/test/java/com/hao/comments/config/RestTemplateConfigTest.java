package com.hao.comments.config;

import com.google.common.base.Stopwatch;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.InetAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Akismet RestTemplate 超时配置测试
 *
 * 测试目的：
 * 1. comments.akismet 的连接超时与读取超时写入连接池的默认连接配置。
 * 2. 对端建立连接后不响应时，调用在读取超时后失败，不会无限占用请求线程。
 *
 * 设计思路：
 * - 本地 ServerSocket 只监听不应答，连接由操作系统完成握手，请求永远等不到响应。
 */
@Slf4j
class RestTemplateConfigTest {

    @Test
    @DisplayName("超时配置写入连接配置")
    void connectionConfigCarriesTimeouts() {
        CommentsProperties.Akismet akismet = new CommentsProperties.Akismet();

        ConnectionConfig config = RestTemplateConfig.akismetConnectionConfig(akismet);

        assertEquals(3000L, config.getConnectTimeout().toMilliseconds());
        assertEquals(5000L, config.getSocketTimeout().toMilliseconds());
    }

    @Test
    @DisplayName("对端不响应: 读取超时后抛出异常")
    void readTimeoutApplied() throws Exception {
        CommentsProperties properties = new CommentsProperties();
        properties.getAkismet().setReadTimeout(Duration.ofMillis(300));
        RestTemplate restTemplate = new RestTemplateConfig().restTemplate(properties);

        try (ServerSocket silent = new ServerSocket(0, 10, InetAddress.getLoopbackAddress())) {
            String url = "http://127.0.0.1:" + silent.getLocalPort() + "/1.1/comment-check";
            Stopwatch stopwatch = Stopwatch.createStarted();

            assertThrows(ResourceAccessException.class, () -> restTemplate.postForObject(url, "x", String.class));

            long costMs = stopwatch.elapsed(TimeUnit.MILLISECONDS);
            log.info("读取超时耗时|Read_timeout_cost,costMs={}", costMs);
            assertTrue(costMs < 5000, "读取超时未生效，耗时 " + costMs + "ms");
        }
    }
}
