package com.hao.comments.service.impl;

import com.google.common.base.Stopwatch;
import com.google.common.collect.Sets;
import com.hao.comments.common.enums.RedisKeysEnum;
import com.hao.comments.common.exception.BackendUnavailableException;
import com.hao.comments.common.exception.ClassifierProtocolException;
import com.hao.comments.common.exception.ClassifierUnavailableException;
import com.hao.comments.common.exception.CommentNotFoundException;
import com.hao.comments.common.exception.CorruptIndexException;
import com.hao.comments.common.model.CommentThread;
import com.hao.comments.integration.akismet.SpamClassifier;
import com.hao.comments.integration.redis.RedisClient;
import com.hao.comments.service.ModerationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * 评论审核服务实现
 *
 * 类职责：
 * 驱动评论从"待审核"到"公开可见"的流转，以及人工撤回。
 *
 * 设计目的：
 * 1. 未配置反垃圾凭证时一律保持待审核，不会静默公开。
 * 2. 审核结果只通过单条 ZADD NX / ZREM 写入，不做先读后写。
 *
 * 核心实现思路：
 * - 自动审核：读取评论哈希 -> 提交分类器 -> 非垃圾则加入已审核索引。
 * - 人工通过：校验评论在全部评论索引中 -> 加入已审核索引 -> 尽力回报 ham。
 * - 人工撤回：从已审核索引移除 -> 尽力回报 spam。
 * - 待审核列表：全部评论索引与已审核索引求差集。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModerationServiceImpl implements ModerationService {

    private final RedisClient<String> redisClient;

    private final SpamClassifier spamClassifier;

    @Override
    public boolean classify(CommentThread thread, long commentId) {
        if (!spamClassifier.isEnabled()) {
            log.debug("未配置反垃圾凭证_保持待审核|Classifier_disabled_keep_pending,thread={},id={}", thread, commentId);
            return false;
        }
        Map<String, String> fields = loadComment(thread, commentId);

        Stopwatch stopwatch = Stopwatch.createStarted();
        boolean spam = spamClassifier.isSpam(fields);
        log.info("反垃圾判定完成|Classifier_verdict,thread={},id={},spam={},costMs={}",
                thread, commentId, spam, stopwatch.elapsed(TimeUnit.MILLISECONDS));
        if (spam) {
            return false;
        }
        return addApproved(thread, commentId);
    }

    @Override
    public boolean approve(CommentThread thread, long commentId) {
        String member = String.valueOf(commentId);
        try {
            if (redisClient.zscore(RedisKeysEnum.THREAD_ALL.forThread(thread), member) == null) {
                throw new CommentNotFoundException("comment " + commentId + " not found at " + thread);
            }
        } catch (DataAccessException e) {
            throw new BackendUnavailableException("failed to look up comment " + commentId + " at " + thread, e);
        }
        boolean added = addApproved(thread, commentId);
        log.info("人工审核通过|Comment_approved_manually,thread={},id={},added={}", thread, commentId, added);
        if (added && spamClassifier.isEnabled()) {
            reportQuietly(thread, commentId, true);
        }
        return added;
    }

    @Override
    public boolean retract(CommentThread thread, long commentId) {
        Long removed;
        try {
            // 核心代码：只从已审核索引移除，全部评论索引保持不变
            removed = redisClient.zrem(RedisKeysEnum.THREAD_APPROVED.forThread(thread), String.valueOf(commentId));
        } catch (DataAccessException e) {
            throw new BackendUnavailableException("failed to retract comment " + commentId + " at " + thread, e);
        }
        boolean retracted = removed != null && removed > 0;
        log.info("人工撤回评论|Comment_retracted,thread={},id={},removed={}", thread, commentId, retracted);
        if (retracted && spamClassifier.isEnabled()) {
            reportQuietly(thread, commentId, false);
        }
        return retracted;
    }

    @Override
    public List<Long> listPending(CommentThread thread) {
        Set<String> all;
        Set<String> approved;
        try {
            all = redisClient.zrangeByScore(RedisKeysEnum.THREAD_ALL.forThread(thread),
                    Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
            approved = redisClient.zrangeByScore(RedisKeysEnum.THREAD_APPROVED.forThread(thread),
                    Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
        } catch (DataAccessException e) {
            throw new BackendUnavailableException("failed to list pending comments at " + thread, e);
        }
        // 差集保持全部评论索引的升序
        return Sets.difference(all, approved).stream()
                .map(Long::valueOf)
                .toList();
    }

    /**
     * ZADD NX 到已审核索引
     *
     * @return 是否新增
     */
    private boolean addApproved(CommentThread thread, long commentId) {
        try {
            Boolean added = redisClient.zaddIfAbsent(RedisKeysEnum.THREAD_APPROVED.forThread(thread),
                    commentId, String.valueOf(commentId));
            return Boolean.TRUE.equals(added);
        } catch (DataAccessException e) {
            throw new BackendUnavailableException("failed to approve comment " + commentId + " at " + thread, e);
        }
    }

    /**
     * 读取评论哈希
     *
     * @throws CorruptIndexException 评论详情不存在
     */
    private Map<String, String> loadComment(CommentThread thread, long commentId) {
        Map<String, String> fields;
        try {
            fields = redisClient.hgetAll(RedisKeysEnum.THREAD_COMMENT.forComment(thread, commentId));
        } catch (DataAccessException e) {
            throw new BackendUnavailableException("failed to load comment " + commentId + " at " + thread, e);
        }
        if (fields.isEmpty()) {
            throw new CorruptIndexException("comment " + commentId + " at " + thread + " has no stored record");
        }
        return fields;
    }

    /**
     * 向分类器回报人工审核结果，失败只记录告警
     *
     * @param ham true 回报误判（ham），false 回报漏判（spam）
     */
    private void reportQuietly(CommentThread thread, long commentId, boolean ham) {
        try {
            Map<String, String> fields = loadComment(thread, commentId);
            if (ham) {
                spamClassifier.submitHam(fields);
            } else {
                spamClassifier.submitSpam(fields);
            }
        } catch (ClassifierProtocolException | ClassifierUnavailableException | BackendUnavailableException e) {
            log.warn("反垃圾回报失败|Classifier_report_fail,thread={},id={},ham={},error={}",
                    thread, commentId, ham, e.getMessage(), e);
        }
    }
}
