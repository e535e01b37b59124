package com.hao.comments.integration.redis;

import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 内存版 RedisClient，仅用于测试
 *
 * 类职责：
 * 在不依赖真实 Redis 的情况下模拟评论服务用到的命令语义。
 *
 * 核心实现思路：
 * - 所有方法 synchronized，模拟 Redis 单命令的原子性。
 * - 有序集合按 (score, member) 排序返回。
 */
public class InMemoryRedisClient implements RedisClient<String> {

    private final Map<String, String> strings = new HashMap<>();
    private final Map<String, Map<String, String>> hashes = new HashMap<>();
    private final Map<String, Set<String>> sets = new HashMap<>();
    private final Map<String, Map<String, Double>> zsets = new HashMap<>();

    @Override
    public synchronized String get(String key) {
        return strings.get(key);
    }

    @Override
    public synchronized void set(String key, String value) {
        strings.put(key, value);
    }

    @Override
    public synchronized void hmset(String key, Map<String, String> paramMap) {
        hashes.computeIfAbsent(key, k -> new LinkedHashMap<>()).putAll(paramMap);
    }

    @Override
    public synchronized Map<String, String> hgetAll(String key) {
        Map<String, String> hash = hashes.get(key);
        return hash == null ? Collections.emptyMap() : new LinkedHashMap<>(hash);
    }

    @Override
    public synchronized Long sadd(String key, String... members) {
        Set<String> set = sets.computeIfAbsent(key, k -> new HashSet<>());
        long added = 0;
        for (String member : members) {
            if (set.add(member)) {
                added++;
            }
        }
        return added;
    }

    @Override
    public synchronized Boolean sismember(String key, String member) {
        return sets.getOrDefault(key, Collections.emptySet()).contains(member);
    }

    @Override
    public synchronized Boolean zaddIfAbsent(String key, double score, String member) {
        Map<String, Double> zset = zsets.computeIfAbsent(key, k -> new HashMap<>());
        if (zset.containsKey(member)) {
            return false;
        }
        zset.put(member, score);
        return true;
    }

    @Override
    public synchronized Set<String> zrangeByScore(String key, double minScore, double maxScore) {
        return zrangeByScore(key, minScore, maxScore, 0, Long.MAX_VALUE);
    }

    @Override
    public synchronized Set<String> zrangeByScore(String key, double minScore, double maxScore, long offset, long count) {
        return zsets.getOrDefault(key, Collections.emptyMap()).entrySet().stream()
                .filter(e -> e.getValue() >= minScore && e.getValue() <= maxScore)
                .sorted(Map.Entry.<String, Double>comparingByValue().thenComparing(Map.Entry.comparingByKey()))
                .skip(offset)
                .limit(count)
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public synchronized Long zrem(String key, String... members) {
        Map<String, Double> zset = zsets.getOrDefault(key, new HashMap<>());
        long removed = 0;
        for (String member : members) {
            if (zset.remove(member) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public synchronized Double zscore(String key, String member) {
        return zsets.getOrDefault(key, Collections.emptyMap()).get(member);
    }

    /**
     * 测试辅助：读取有序集合全部成员（按分数升序）
     */
    public synchronized Set<String> zmembers(String key) {
        return zsets.getOrDefault(key, Collections.emptyMap()).entrySet().stream()
                .sorted(Map.Entry.comparingByValue(Comparator.naturalOrder()))
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
