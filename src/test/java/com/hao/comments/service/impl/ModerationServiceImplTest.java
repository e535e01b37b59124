package com.hao.comments.service.impl;

import com.hao.comments.common.enums.RedisKeysEnum;
import com.hao.comments.common.exception.ClassifierUnavailableException;
import com.hao.comments.common.exception.CommentNotFoundException;
import com.hao.comments.common.exception.CorruptIndexException;
import com.hao.comments.common.model.CommentThread;
import com.hao.comments.dal.model.Comment;
import com.hao.comments.integration.akismet.SpamClassifier;
import com.hao.comments.integration.redis.InMemoryRedisClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 评论审核测试
 *
 * 测试目的：
 * 1. 未配置凭证时评论保持待审核，不调用分类器。
 * 2. 非垃圾评论进入已审核索引，垃圾评论保持待审核。
 * 3. 人工通过与撤回只改动已审核索引，并尽力回报分类器。
 */
class ModerationServiceImplTest {

    private final CommentThread thread = CommentThread.of("example.com", "/post");

    private final String allKey = RedisKeysEnum.THREAD_ALL.forThread(thread);

    private final String approvedKey = RedisKeysEnum.THREAD_APPROVED.forThread(thread);

    private InMemoryRedisClient redisClient;

    private SpamClassifier spamClassifier;

    private ModerationServiceImpl moderationService;

    @BeforeEach
    void setUp() {
        redisClient = new InMemoryRedisClient();
        spamClassifier = mock(SpamClassifier.class);
        moderationService = new ModerationServiceImpl(redisClient, spamClassifier);
    }

    private void storeComment(long id) {
        redisClient.zaddIfAbsent(allKey, id, String.valueOf(id));
        Comment comment = Comment.builder()
                .permalink("https://example.com/post")
                .author("Ann")
                .content("Hello")
                .build();
        redisClient.hmset(RedisKeysEnum.THREAD_COMMENT.forComment(thread, id), comment.toHash());
    }

    @Test
    @DisplayName("未配置凭证: 保持待审核且不调用分类器")
    void disabledClassifierKeepsPending() {
        storeComment(100L);
        when(spamClassifier.isEnabled()).thenReturn(false);

        assertFalse(moderationService.classify(thread, 100L));
        assertTrue(redisClient.zmembers(approvedKey).isEmpty());
        verify(spamClassifier, never()).isSpam(anyMap());
    }

    @Test
    @DisplayName("非垃圾评论: 进入已审核索引，提交的字段与存储一致")
    void hamIsApproved() {
        storeComment(100L);
        when(spamClassifier.isEnabled()).thenReturn(true);
        when(spamClassifier.isSpam(anyMap())).thenReturn(false);

        assertTrue(moderationService.classify(thread, 100L));
        assertEquals(100.0, redisClient.zscore(approvedKey, "100"));

        Map<String, String> expected = redisClient.hgetAll(RedisKeysEnum.THREAD_COMMENT.forComment(thread, 100L));
        verify(spamClassifier).isSpam(expected);
    }

    @Test
    @DisplayName("垃圾评论: 保持待审核")
    void spamStaysPending() {
        storeComment(100L);
        when(spamClassifier.isEnabled()).thenReturn(true);
        when(spamClassifier.isSpam(anyMap())).thenReturn(true);

        assertFalse(moderationService.classify(thread, 100L));
        assertTrue(redisClient.zmembers(approvedKey).isEmpty());
    }

    @Test
    @DisplayName("重复审核: 已审核评论不会重复新增")
    void classifyTwice() {
        storeComment(100L);
        when(spamClassifier.isEnabled()).thenReturn(true);
        when(spamClassifier.isSpam(anyMap())).thenReturn(false);

        assertTrue(moderationService.classify(thread, 100L));
        assertFalse(moderationService.classify(thread, 100L));
        assertEquals(Set.of("100"), redisClient.zmembers(approvedKey));
    }

    @Test
    @DisplayName("评论详情缺失: 抛出索引损坏异常")
    void missingRecord() {
        redisClient.zaddIfAbsent(allKey, 100L, "100");
        when(spamClassifier.isEnabled()).thenReturn(true);

        assertThrows(CorruptIndexException.class, () -> moderationService.classify(thread, 100L));
    }

    @Test
    @DisplayName("分类器故障: 向上抛出，已审核索引不变")
    void classifierFailurePropagates() {
        storeComment(100L);
        when(spamClassifier.isEnabled()).thenReturn(true);
        when(spamClassifier.isSpam(anyMap()))
                .thenThrow(new ClassifierUnavailableException("akismet comment-check failed", new RuntimeException()));

        assertThrows(ClassifierUnavailableException.class, () -> moderationService.classify(thread, 100L));
        assertTrue(redisClient.zmembers(approvedKey).isEmpty());
    }

    @Test
    @DisplayName("人工通过: 加入已审核索引并回报 ham")
    void approveReportsHam() {
        storeComment(100L);
        when(spamClassifier.isEnabled()).thenReturn(true);

        assertTrue(moderationService.approve(thread, 100L));
        assertEquals(Set.of("100"), redisClient.zmembers(approvedKey));
        verify(spamClassifier).submitHam(anyMap());

        // 已审核的评论再次通过不重复回报
        assertFalse(moderationService.approve(thread, 100L));
        verify(spamClassifier).submitHam(anyMap());
    }

    @Test
    @DisplayName("人工通过不存在的评论: 抛出评论不存在")
    void approveUnknownComment() {
        assertThrows(CommentNotFoundException.class, () -> moderationService.approve(thread, 42L));
        assertTrue(redisClient.zmembers(approvedKey).isEmpty());
    }

    @Test
    @DisplayName("回报失败不影响人工通过")
    void approveReportFailureIgnored() {
        storeComment(100L);
        when(spamClassifier.isEnabled()).thenReturn(true);
        doThrow(new ClassifierUnavailableException("akismet submit-ham failed", new RuntimeException()))
                .when(spamClassifier).submitHam(anyMap());

        assertTrue(moderationService.approve(thread, 100L));
        assertEquals(Set.of("100"), redisClient.zmembers(approvedKey));
    }

    @Test
    @DisplayName("人工撤回: 只移出已审核索引并回报 spam")
    void retractReportsSpam() {
        storeComment(100L);
        when(spamClassifier.isEnabled()).thenReturn(false);
        moderationService.approve(thread, 100L);
        when(spamClassifier.isEnabled()).thenReturn(true);

        assertTrue(moderationService.retract(thread, 100L));
        assertTrue(redisClient.zmembers(approvedKey).isEmpty());
        assertEquals(Set.of("100"), redisClient.zmembers(allKey));
        verify(spamClassifier).submitSpam(anyMap());

        assertFalse(moderationService.retract(thread, 100L));
    }

    @Test
    @DisplayName("待审核列表: 全部评论减去已审核评论，按ID升序")
    void listPending() {
        storeComment(300L);
        storeComment(100L);
        storeComment(200L);
        when(spamClassifier.isEnabled()).thenReturn(false);
        moderationService.approve(thread, 200L);

        assertEquals(List.of(100L, 300L), moderationService.listPending(thread));
    }
}
