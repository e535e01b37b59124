package com.hao.comments.integration.redis;

import java.util.Map;
import java.util.Set;

/**
 * 统一 Redis 客户端接口
 *
 * 类职责：
 * 定义评论服务用到的字符串、哈希、集合、有序集合命令的统一访问入口。
 *
 * 核心实现思路：
 * - 按 Redis 数据类型分组定义方法。
 * - 所有需要原子性的读改写步骤都对应单条 Redis 命令（如 ZADD NX），业务层不做先读后写。
 * - 实现层负责参数校验与模板调用，Redis 故障以 Spring DataAccessException 抛出。
 *
 * @param <T> 值类型
 */
@SuppressWarnings("unchecked")
public interface RedisClient<T> {

    // 区域：字符串

    /**
     * 字符串 -> GET，读取值。示例：GET {comments://example.com/post}:enabled。
     *
     * @return 值，不存在返回 null
     */
    T get(String key);

    /**
     * 字符串 -> SET，覆盖写入，无过期。示例：SET {comments://example.com/post}:enabled true。
     */
    void set(String key, T value);

    // 区域结束

    // 区域：哈希

    /**
     * 哈希 -> HMSET，批量写字段。示例：HMSET key comment_author a comment_content hello。
     */
    void hmset(String key, Map<String, T> paramMap);

    /**
     * 哈希 -> HGETALL，获取全部字段。
     *
     * @return 字段映射，键不存在返回空映射
     */
    Map<String, T> hgetAll(String key);

    // 区域结束

    // 区域：无序集合

    /**
     * 无序集合 -> SADD，添加成员。示例：SADD {comments}:auto_enable example.com。
     *
     * @return 新增的成员数
     */
    Long sadd(String key, T... members);

    /**
     * 无序集合 -> SISMEMBER，判断成员存在。示例：SISMEMBER {comments}:auto_enable example.com。
     */
    Boolean sismember(String key, T member);

    // 区域结束

    // 区域：有序集合

    /**
     * 有序集合 -> ZADD NX，成员不存在才新增。示例：ZADD key NX 1700000000 1700000000。
     *
     * @return true 表示新增，false 表示成员已存在
     */
    Boolean zaddIfAbsent(String key, double score, T member);

    /**
     * 有序集合 -> ZRANGEBYSCORE，按分数升序区间。示例：ZRANGEBYSCORE key -inf +inf。
     */
    Set<T> zrangeByScore(String key, double minScore, double maxScore);

    /**
     * 有序集合 -> ZRANGEBYSCORE LIMIT，按分数升序分页。示例：ZRANGEBYSCORE key -inf +inf LIMIT 0 10。
     */
    Set<T> zrangeByScore(String key, double minScore, double maxScore, long offset, long count);

    /**
     * 有序集合 -> ZREM，删除指定成员。
     *
     * @return 删除的成员数
     */
    Long zrem(String key, T... members);

    /**
     * 有序集合 -> ZSCORE，查询成员分数。
     *
     * @return 分数，成员不存在返回 null
     */
    Double zscore(String key, T member);

    // 区域结束
}
