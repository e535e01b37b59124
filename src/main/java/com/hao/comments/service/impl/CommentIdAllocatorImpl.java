package com.hao.comments.service.impl;

import com.hao.comments.common.enums.RedisKeysEnum;
import com.hao.comments.common.exception.AllocationContentionException;
import com.hao.comments.common.exception.BackendUnavailableException;
import com.hao.comments.common.model.CommentThread;
import com.hao.comments.config.CommentsProperties;
import com.hao.comments.integration.redis.RedisClient;
import com.hao.comments.service.CommentIdAllocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * 评论ID分配器实现
 *
 * 类职责：
 * 以秒级时间戳作为评论ID，借助 ZADD NX 保证同一页面内ID唯一。
 *
 * 设计目的：
 * 1. ID 同时作为主键与排序分数，不需要单独的发号器。
 * 2. 不加锁，唯一性完全由 Redis 单命令的原子性保证。
 *
 * 核心实现思路：
 * - 候选ID = 当前秒数，ZADD NX 到全部评论索引，新增成功即分配成功。
 * - 同一秒内已有评论时等待重试间隔（默认 1 秒）后重新取时间。
 * - 默认不限重试次数；配置 comments.allocation.max-attempts 后超过次数抛出竞争异常。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommentIdAllocatorImpl implements CommentIdAllocator {

    private final RedisClient<String> redisClient;

    private final CommentsProperties properties;

    private final Clock clock;

    @Override
    public long allocate(CommentThread thread) {
        String allKey = RedisKeysEnum.THREAD_ALL.forThread(thread);
        int maxAttempts = properties.getAllocation().getMaxAttempts();
        long retryMillis = properties.getAllocation().getRetryInterval().toMillis();

        for (int attempt = 1; ; attempt++) {
            long candidate = clock.instant().getEpochSecond();
            Boolean added;
            try {
                // 核心代码：原子登记候选ID
                added = redisClient.zaddIfAbsent(allKey, candidate, String.valueOf(candidate));
            } catch (DataAccessException e) {
                throw new BackendUnavailableException("failed to allocate comment id for " + thread, e);
            }
            if (Boolean.TRUE.equals(added)) {
                log.debug("评论ID分配成功|Comment_id_allocated,thread={},id={},attempt={}", thread, candidate, attempt);
                return candidate;
            }

            if (maxAttempts > 0 && attempt >= maxAttempts) {
                throw new AllocationContentionException(
                        "comment id allocation for " + thread + " gave up after " + attempt + " attempts");
            }
            log.info("评论ID冲突_等待重试|Comment_id_collision_retry,thread={},candidate={},attempt={}",
                    thread, candidate, attempt);
            try {
                TimeUnit.MILLISECONDS.sleep(retryMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AllocationContentionException("comment id allocation for " + thread + " interrupted", e);
            }
        }
    }
}
