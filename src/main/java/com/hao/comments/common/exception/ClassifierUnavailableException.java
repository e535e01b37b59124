package com.hao.comments.common.exception;

/**
 * 反垃圾接口不可用异常
 *
 * 类职责：
 * 调用 Akismet 出现网络错误或非 2xx 响应时抛出。提交流程只记录日志，评论保持待审核。
 */
public class ClassifierUnavailableException extends RuntimeException {

    public ClassifierUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
