package com.hao.comments.integration.redis;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * RedisClient 接口实现
 *
 * 类职责：
 * 基于 StringRedisTemplate 封装评论服务所需的 Redis 命令，并统一参数校验。
 *
 * 核心实现思路：
 * - 各方法按数据结构映射 Redis 原生命令。
 * - 统一进行参数校验与空值处理，集合类结果不返回 null。
 */
public class RedisClientImpl implements RedisClient<String> {

    private final StringRedisTemplate redisTemplate;

    public RedisClientImpl(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /* ------------------ 辅助校验 ------------------ */

    private void validateKey(String key, String name) {
        if (!StringUtils.hasText(key)) {
            throw new IllegalArgumentException(name + " 不能为空");
        }
    }

    private void validateParams(Object[] params, String name) {
        if (params == null || params.length == 0) {
            throw new IllegalArgumentException(name + " 不能为空");
        }
    }

    private void validateNotNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " 不能为空");
        }
    }

    // 区域：字符串

    /** 字符串 -> GET：读取值。 */
    @Override
    public String get(String key) {
        validateKey(key, "key");
        return redisTemplate.opsForValue().get(key);
    }

    /** 字符串 -> SET：覆盖写入，无过期。 */
    @Override
    public void set(String key, String value) {
        validateKey(key, "key");
        validateKey(value, "value");
        redisTemplate.opsForValue().set(key, value);
    }

    // 区域结束

    // 区域：哈希

    /** 哈希 -> HMSET：批量写字段。空串字段同样写入。 */
    @Override
    public void hmset(String key, Map<String, String> paramMap) {
        validateKey(key, "key");
        if (paramMap == null || paramMap.isEmpty()) {
            throw new IllegalArgumentException("paramMap 不能为空");
        }
        redisTemplate.opsForHash().putAll(key, paramMap);
    }

    /** 哈希 -> HGETALL：获取全部字段。 */
    @Override
    public Map<String, String> hgetAll(String key) {
        validateKey(key, "key");
        Map<Object, Object> entries = redisTemplate.opsForHash().entries(key);
        if (entries.isEmpty()) {
            return Collections.emptyMap();
        }
        return entries.entrySet().stream()
                .collect(Collectors.toMap(
                        e -> e.getKey().toString(),
                        e -> e.getValue().toString(),
                        (e1, e2) -> e1,
                        LinkedHashMap::new
                ));
    }

    // 区域结束

    // 区域：无序集合

    /** 无序集合 -> SADD：添加成员。 */
    @Override
    public Long sadd(String key, String... members) {
        validateKey(key, "key");
        validateParams(members, "members");
        return redisTemplate.opsForSet().add(key, members);
    }

    /** 无序集合 -> SISMEMBER：判断成员存在。 */
    @Override
    public Boolean sismember(String key, String member) {
        validateKey(key, "key");
        validateKey(member, "member");
        return redisTemplate.opsForSet().isMember(key, member);
    }

    // 区域结束

    // 区域：有序集合

    /** 有序集合 -> ZADD NX：成员不存在才新增。 */
    @Override
    public Boolean zaddIfAbsent(String key, double score, String member) {
        validateKey(key, "key");
        validateKey(member, "member");
        return redisTemplate.opsForZSet().addIfAbsent(key, member, score);
    }

    /** 有序集合 -> ZRANGEBYSCORE：按分数升序区间。 */
    @Override
    public Set<String> zrangeByScore(String key, double minScore, double maxScore) {
        validateKey(key, "key");
        Set<String> result = redisTemplate.opsForZSet().rangeByScore(key, minScore, maxScore);
        return result != null ? result : new LinkedHashSet<>();
    }

    /** 有序集合 -> ZRANGEBYSCORE LIMIT：按分数升序分页。 */
    @Override
    public Set<String> zrangeByScore(String key, double minScore, double maxScore, long offset, long count) {
        validateKey(key, "key");
        if (offset < 0 || count <= 0) {
            throw new IllegalArgumentException("offset 不能为负且 count 必须大于 0");
        }
        Set<String> result = redisTemplate.opsForZSet().rangeByScore(key, minScore, maxScore, offset, count);
        return result != null ? result : new LinkedHashSet<>();
    }

    /** 有序集合 -> ZREM：删除指定成员。 */
    @Override
    public Long zrem(String key, String... members) {
        validateKey(key, "key");
        validateParams(members, "members");
        Long removed = redisTemplate.opsForZSet().remove(key, (Object[]) members);
        return removed != null ? removed : 0L;
    }

    /** 有序集合 -> ZSCORE：查询成员分数。 */
    @Override
    public Double zscore(String key, String member) {
        validateKey(key, "key");
        validateNotNull(member, "member");
        return redisTemplate.opsForZSet().score(key, member);
    }

    // 区域结束
}
