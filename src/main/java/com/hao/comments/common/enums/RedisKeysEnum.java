package com.hao.comments.common.enums;

import com.hao.comments.common.model.CommentThread;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Redis键枚举定义
 *
 * 类职责：
 * 统一管理评论服务的 Redis 键模板与说明，避免硬编码散落在各处。
 *
 * 核心实现思路：
 * - 页面级键以 {comments://host+path} 作为 Hash Tag，集群下同一页面的所有键落在同一槽位。
 * - 枚举承载键模板，提供按页面、按评论拼接的方法。
 */
@Getter
@AllArgsConstructor
public enum RedisKeysEnum {

    // ============================
    // 1. 全局配置（集合）
    // ============================
    /**
     * 自动启用白名单
     * 类型：无序集合
     * 用法：SISMEMBER {comments}:auto_enable example.com
     */
    AUTO_ENABLE("{comments}:auto_enable", "自动启用评论的主机白名单"),


    // ============================
    // 2. 页面级数据
    // ============================
    /**
     * 页面评论开关
     * 类型：字符串 "true"/"false"，键不存在表示未显式设置
     * 用法：GET {comments://example.com/post}:enabled
     */
    THREAD_ENABLED("{comments://%s%s}:enabled", "页面评论开关"),

    /**
     * 页面全部评论索引
     * 类型：有序集合，成员与分数都是评论ID（秒级时间戳）
     * 用法：ZADD {comments://example.com/post}:all NX 1700000000 1700000000
     */
    THREAD_ALL("{comments://%s%s}:all", "页面全部评论索引"),

    /**
     * 页面已审核评论索引
     * 类型：有序集合，是全部评论索引的子集
     * 用法：ZRANGEBYSCORE {comments://example.com/post}:approved -inf +inf LIMIT 0 10
     */
    THREAD_APPROVED("{comments://%s%s}:approved", "页面已审核评论索引"),

    /**
     * 评论详情
     * 类型：哈希
     * 用法：HGETALL {comments://example.com/post}:comment:1700000000
     */
    THREAD_COMMENT("{comments://%s%s}:comment:%d", "评论详情");


    private final String key;
    private final String desc;

    /**
     * 拼接页面级键
     *
     * @param thread 评论页面
     * @return 完整键
     */
    public String forThread(CommentThread thread) {
        return String.format(this.key, thread.getHost(), thread.getPath());
    }

    /**
     * 拼接评论级键
     *
     * @param thread 评论页面
     * @param commentId 评论ID
     * @return 完整键
     */
    public String forComment(CommentThread thread, long commentId) {
        return String.format(this.key, thread.getHost(), thread.getPath(), commentId);
    }
}
