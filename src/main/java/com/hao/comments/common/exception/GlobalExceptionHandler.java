package com.hao.comments.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;

/**
 * 全局异常处理器
 *
 * 类职责：
 * 统一捕获并处理Controller层抛出的异常，将异常转换为标准化的API响应格式。
 *
 * 设计目的：
 * 1. 屏蔽底层异常细节，Redis 故障对外只返回 "backend error"。
 * 2. 统一错误码与错误提示。
 * 3. 集中记录异常日志，便于线上故障排查。
 *
 * 实现思路：
 * - 客户端错误（非法输入、未开启评论、评论不存在）记录 WARN，返回 4xx。
 * - 存储与反垃圾接口故障记录 ERROR 并带堆栈，返回 5xx。
 * - 使用 Exception 作为兜底策略，捕获未预期的运行时异常。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理非法输入
     *
     * @param e 非法请求异常
     * @param request 请求上下文
     * @return 标准化错误响应
     */
    @ExceptionHandler(InvalidCommentRequestException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidRequest(InvalidCommentRequestException e, WebRequest request) {
        log.warn("非法评论请求|Invalid_comment_request,path={},message={}", getRequestPath(request), e.getMessage());
        return body(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    /**
     * 处理缺少参数或参数类型错误（如管理接口的 id 不是整数）
     */
    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadParameter(Exception e, WebRequest request) {
        log.warn("请求参数错误|Bad_request_parameter,path={},message={}", getRequestPath(request), e.getMessage());
        return body(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    /**
     * 处理页面未开启评论
     */
    @ExceptionHandler(CommentsDisabledException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleCommentsDisabled(CommentsDisabledException e, WebRequest request) {
        log.warn("页面未开启评论|Comments_not_enabled,path={},thread={}", getRequestPath(request), e.getThread());
        return body(HttpStatus.BAD_REQUEST, "comments not enabled");
    }

    /**
     * 处理评论不存在
     */
    @ExceptionHandler(CommentNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleCommentNotFound(CommentNotFoundException e, WebRequest request) {
        log.warn("评论不存在|Comment_not_found,path={},message={}", getRequestPath(request), e.getMessage());
        return body(HttpStatus.NOT_FOUND, e.getMessage());
    }

    /**
     * 处理 ID 分配竞争
     */
    @ExceptionHandler(AllocationContentionException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleAllocationContention(AllocationContentionException e, WebRequest request) {
        log.error("评论ID分配失败|Comment_id_allocation_fail,path={},message={}", getRequestPath(request), e.getMessage(), e);
        return body(HttpStatus.SERVICE_UNAVAILABLE, "too many concurrent comments, try again later");
    }

    /**
     * 处理存储后端故障
     *
     * 实现逻辑：
     * 1. 记录 ERROR 日志并带堆栈。
     * 2. 返回 HTTP 500，不暴露 Redis 细节。
     */
    @ExceptionHandler(BackendUnavailableException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleBackendUnavailable(BackendUnavailableException e, WebRequest request) {
        log.error("存储后端异常|Backend_unavailable,path={},message={}", getRequestPath(request), e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "backend error");
    }

    /**
     * 处理反垃圾接口故障（仅管理接口手动触发审核时会走到这里）
     */
    @ExceptionHandler({ClassifierProtocolException.class, ClassifierUnavailableException.class})
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Map<String, Object> handleClassifierFailure(RuntimeException e, WebRequest request) {
        log.error("反垃圾接口异常|Classifier_failure,path={},message={}", getRequestPath(request), e.getMessage(), e);
        return body(HttpStatus.BAD_GATEWAY, "spam classifier error");
    }

    /**
     * 处理系统兜底异常
     */
    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleException(Exception e, WebRequest request) {
        log.error("系统未知异常|System_unknown_error,path={},message={}", getRequestPath(request), e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "系统繁忙，请联系管理员");
    }

    private Map<String, Object> body(HttpStatus status, String message) {
        Map<String, Object> result = new HashMap<>();
        result.put("code", status.value());
        result.put("message", message);
        return result;
    }

    /**
     * 提取纯净的请求路径
     *
     * @param request 请求上下文
     * @return 请求URI，去除冗余前缀
     */
    private String getRequestPath(WebRequest request) {
        // WebRequest.getDescription(false) 返回格式通常为 "uri=/path;client=..."
        return request.getDescription(false).replace("uri=", "");
    }
}
