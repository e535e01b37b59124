package com.hao.comments.common.exception;

/**
 * 评论ID分配竞争异常
 *
 * 类职责：
 * 配置了最大尝试次数且全部冲突，或等待重试时线程被中断时抛出。
 */
public class AllocationContentionException extends RuntimeException {

    public AllocationContentionException(String message) {
        super(message);
    }

    public AllocationContentionException(String message, Throwable cause) {
        super(message, cause);
    }
}
