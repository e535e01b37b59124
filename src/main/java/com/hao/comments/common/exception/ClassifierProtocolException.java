package com.hao.comments.common.exception;

/**
 * 反垃圾接口协议异常
 *
 * 类职责：
 * Akismet 返回的内容不是布尔字面量时抛出。提交流程只记录日志，评论保持待审核。
 */
public class ClassifierProtocolException extends RuntimeException {

    public ClassifierProtocolException(String message) {
        super(message);
    }
}
