package com.hao.comments.integration.redis;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * RedisClient 实现测试
 *
 * 测试目的：
 * 1. 命令映射到正确的 RedisTemplate 操作（ZADD NX、ZRANGEBYSCORE LIMIT）。
 * 2. 驱动返回 null 时集合类结果不为 null。
 * 3. 非法参数在访问 Redis 前被拒绝。
 */
class RedisClientImplTest {

    private StringRedisTemplate redisTemplate;

    private ZSetOperations<String, String> zSetOps;

    private HashOperations<String, Object, Object> hashOps;

    private RedisClientImpl redisClient;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        zSetOps = mock(ZSetOperations.class);
        hashOps = mock(HashOperations.class);
        when(redisTemplate.opsForZSet()).thenReturn(zSetOps);
        when(redisTemplate.<Object, Object>opsForHash()).thenReturn(hashOps);
        redisClient = new RedisClientImpl(redisTemplate);
    }

    @Test
    @DisplayName("ZADD NX 映射到 addIfAbsent")
    void zaddIfAbsent() {
        when(zSetOps.addIfAbsent("k", "1700000000", 1700000000.0)).thenReturn(true);
        assertTrue(redisClient.zaddIfAbsent("k", 1700000000.0, "1700000000"));
    }

    @Test
    @DisplayName("ZRANGEBYSCORE LIMIT: 驱动返回 null 时返回空集合")
    void zrangeByScoreNeverNull() {
        when(zSetOps.rangeByScore("k", Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, 0, 10)).thenReturn(null);
        assertTrue(redisClient.zrangeByScore("k", Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, 0, 10).isEmpty());
        verify(zSetOps).rangeByScore("k", Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, 0, 10);
    }

    @Test
    @DisplayName("HGETALL: 键不存在返回空 Map，存在时按字符串返回")
    void hgetAll() {
        when(hashOps.entries("missing")).thenReturn(Map.of());
        assertTrue(redisClient.hgetAll("missing").isEmpty());

        Map<Object, Object> entries = new LinkedHashMap<>();
        entries.put("comment_author", "a");
        entries.put("comment_author_url", "");
        when(hashOps.entries("present")).thenReturn(entries);
        Map<String, String> result = redisClient.hgetAll("present");
        assertEquals("a", result.get("comment_author"));
        assertEquals("", result.get("comment_author_url"));
    }

    @Test
    @DisplayName("ZREM: 驱动返回 null 时视为未删除")
    void zremNullIsZero() {
        when(zSetOps.remove("k", "1")).thenReturn(null);
        assertEquals(0L, redisClient.zrem("k", "1"));
    }

    @Test
    @DisplayName("非法参数在访问 Redis 前被拒绝")
    void invalidArguments() {
        StringRedisTemplate untouched = mock(StringRedisTemplate.class);
        RedisClientImpl client = new RedisClientImpl(untouched);

        assertThrows(IllegalArgumentException.class, () -> client.get(""));
        assertThrows(IllegalArgumentException.class, () -> client.hmset("k", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> client.zrangeByScore("k", 0, 1, -1, 10));
        assertThrows(IllegalArgumentException.class, () -> client.sadd("k"));
        verifyNoInteractions(untouched);
    }
}
