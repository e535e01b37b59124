package com.hao.comments.common.exception;

import com.hao.comments.common.model.CommentThread;
import lombok.Getter;

/**
 * 页面未开启评论异常
 */
@Getter
public class CommentsDisabledException extends RuntimeException {

    private final CommentThread thread;

    public CommentsDisabledException(CommentThread thread) {
        super("comments not enabled for " + thread);
        this.thread = thread;
    }
}
