package com.hao.comments.common.exception;

/**
 * 存储后端不可用异常
 *
 * 类职责：
 * 包装 Redis 访问失败（Spring DataAccessException）或存储数据异常，中断当前操作。
 *
 * 实现思路：
 * - 写操作中已提交的步骤不回滚，评论记录一旦写入就保持持久。
 * - 由 GlobalExceptionHandler 统一转换为 HTTP 500。
 */
public class BackendUnavailableException extends RuntimeException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
