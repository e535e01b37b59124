package com.hao.comments.service.impl;

import com.hao.comments.common.enums.RedisKeysEnum;
import com.hao.comments.common.exception.BackendUnavailableException;
import com.hao.comments.common.exception.ClassifierProtocolException;
import com.hao.comments.common.exception.ClassifierUnavailableException;
import com.hao.comments.common.exception.CommentsDisabledException;
import com.hao.comments.common.exception.CorruptIndexException;
import com.hao.comments.common.exception.InvalidCommentRequestException;
import com.hao.comments.common.model.CommentThread;
import com.hao.comments.config.CommentsProperties;
import com.hao.comments.dal.model.Comment;
import com.hao.comments.dal.model.CommentSubmission;
import com.hao.comments.dal.model.CommentSubmitRequest;
import com.hao.comments.dal.model.CommentView;
import com.hao.comments.integration.redis.RedisClient;
import com.hao.comments.service.CommentIdAllocator;
import com.hao.comments.service.CommentService;
import com.hao.comments.service.EnablementService;
import com.hao.comments.service.ModerationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.util.HtmlUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 评论业务服务实现
 *
 * 类职责：
 * 编排评论提交流程，并提供已审核评论列表。
 *
 * 设计目的：
 * 1. 提交流程中评论详情一旦写入就保持持久，审核失败只影响可见性。
 * 2. 列表输出已做 HTML 转义，可直接嵌入页面。
 *
 * 核心实现思路：
 * - 提交：校验 -> 开关判断 -> 分配ID -> HMSET 评论详情 -> 自动审核（失败记录日志）。
 * - 列表：ZRANGEBYSCORE 已审核索引取一页ID -> 逐条 HGETALL -> 转义作者与内容。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommentServiceImpl implements CommentService {

    private final RedisClient<String> redisClient;

    private final EnablementService enablementService;

    private final CommentIdAllocator commentIdAllocator;

    private final ModerationService moderationService;

    private final CommentsProperties properties;

    @Override
    public CommentSubmission submit(CommentSubmitRequest request) {
        // 1. 校验（不访问 Redis）
        CommentThread thread = CommentThread.parse(request.getUrl());
        if (!StringUtils.hasText(request.getAuthor())) {
            throw new InvalidCommentRequestException("bad comment_author value");
        }
        if (!StringUtils.hasText(request.getContent())) {
            throw new InvalidCommentRequestException("bad comment_content value");
        }

        // 2. 开关判断
        if (!enablementService.isEnabled(thread)) {
            throw new CommentsDisabledException(thread);
        }

        // 3. 分配ID并写入评论详情
        long commentId = commentIdAllocator.allocate(thread);
        Comment comment = Comment.builder()
                .permalink(request.getUrl())
                .userIp(request.getUserIp())
                .userAgent(request.getUserAgent())
                .referrer(request.getReferrer())
                .author(request.getAuthor())
                .authorEmail(request.getAuthorEmail())
                .authorUrl(request.getAuthorUrl())
                .content(request.getContent())
                .build();
        try {
            redisClient.hmset(RedisKeysEnum.THREAD_COMMENT.forComment(thread, commentId), comment.toHash());
        } catch (DataAccessException e) {
            throw new BackendUnavailableException("failed to store comment " + commentId + " at " + thread, e);
        }

        // 4. 自动审核，失败不影响提交
        boolean approved = false;
        try {
            approved = moderationService.classify(thread, commentId);
        } catch (ClassifierProtocolException | ClassifierUnavailableException | BackendUnavailableException e) {
            log.warn("自动审核失败_评论保持待审核|Auto_moderation_fail_keep_pending,thread={},id={},error={}",
                    thread, commentId, e.getMessage(), e);
        }

        if (approved) {
            log.info("新评论已审核通过|New_approved_comment,thread={},id={}", thread, commentId);
        } else {
            log.info("新评论待审核|New_unapproved_comment,thread={},id={}", thread, commentId);
        }
        return new CommentSubmission(thread, commentId, approved, request.getUrl());
    }

    @Override
    public List<CommentView> listApproved(CommentThread thread) {
        List<CommentView> comments = new ArrayList<>();
        try {
            Set<String> ids = redisClient.zrangeByScore(RedisKeysEnum.THREAD_APPROVED.forThread(thread),
                    Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, 0, properties.getPageSize());
            for (String id : ids) {
                Map<String, String> fields = redisClient.hgetAll(RedisKeysEnum.THREAD_COMMENT.forComment(thread, parseId(thread, id)));
                if (fields.isEmpty()) {
                    throw new CorruptIndexException("approved comment " + id + " at " + thread + " has no stored record");
                }
                Comment comment = Comment.fromHash(fields);
                comments.add(new CommentView(id,
                        escapeHtml(comment.getAuthor()),
                        escapeHtml(comment.getContent())));
            }
        } catch (DataAccessException e) {
            throw new BackendUnavailableException("failed to list comments at " + thread, e);
        }
        return comments;
    }

    private long parseId(CommentThread thread, String id) {
        try {
            return Long.parseLong(id);
        } catch (NumberFormatException e) {
            throw new CorruptIndexException("non-numeric comment id " + id + " in approved index of " + thread);
        }
    }

    /**
     * HTML 转义
     *
     * 按 UTF-8 转义，只替换 <>&'" 五个特殊字符，非 ASCII 文本原样输出。
     */
    private static String escapeHtml(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value, StandardCharsets.UTF_8.name());
    }
}
