package com.hao.comments.common.exception;

/**
 * 评论不存在异常
 *
 * 类职责：
 * 审核管理操作指定的评论ID不在页面全部评论索引中时抛出。
 */
public class CommentNotFoundException extends RuntimeException {

    public CommentNotFoundException(String message) {
        super(message);
    }
}
