package com.hao.comments.service;

import com.hao.comments.common.model.CommentThread;

/**
 * 评论ID分配器接口
 */
public interface CommentIdAllocator {

    /**
     * 为新评论分配页面内唯一、按时间有序的ID，并登记到页面全部评论索引
     *
     * @param thread 评论页面
     * @return 评论ID（分配成功时刻的秒级时间戳）
     * @throws com.hao.comments.common.exception.BackendUnavailableException Redis 访问失败
     * @throws com.hao.comments.common.exception.AllocationContentionException 超过最大尝试次数或等待被中断
     */
    long allocate(CommentThread thread);
}
