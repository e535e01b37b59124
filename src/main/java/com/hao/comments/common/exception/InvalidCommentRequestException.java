package com.hao.comments.common.exception;

/**
 * 非法评论请求异常
 *
 * 类职责：
 * URL 无法解析、缺少主机、作者或内容为空时抛出，在访问 Redis 之前中断请求。
 *
 * 实现思路：
 * - 继承 RuntimeException，由 GlobalExceptionHandler 统一转换为 HTTP 400。
 */
public class InvalidCommentRequestException extends RuntimeException {

    public InvalidCommentRequestException(String message) {
        super(message);
    }

    public InvalidCommentRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
