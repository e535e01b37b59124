package com.hao.comments.controller;

import com.hao.comments.common.model.CommentThread;
import com.hao.comments.common.util.ClientIpUtil;
import com.hao.comments.dal.model.CommentSubmission;
import com.hao.comments.dal.model.CommentSubmitRequest;
import com.hao.comments.dal.model.CommentView;
import com.hao.comments.service.CommentService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 评论控制器
 *
 * 类职责：
 * 提供评论列表与评论提交两个 HTTP 入口，负责参数接收与请求转发。
 *
 * 核心实现思路：
 * - GET /comments/?url= 返回已审核评论 JSON 数组。
 * - POST /comments/ 接收表单，成功后 302 重定向回评论所在页面。
 * - 业务逻辑与校验委托给 CommentService，异常由 GlobalExceptionHandler 统一转换。
 */
@RestController
@RequestMapping("/comments")
@RequiredArgsConstructor
public class CommentController {

    private final CommentService commentService;

    /**
     * 获取页面已审核评论
     *
     * @param url 页面 URL
     * @return 评论列表
     */
    @GetMapping("/")
    public List<CommentView> listComments(@RequestParam(name = "url", required = false) String url) {
        return commentService.listApproved(CommentThread.parse(url));
    }

    /**
     * 提交评论
     *
     * 实现逻辑：
     * 1. 组装表单字段与请求头信息（IP、User-Agent、Referer）。
     * 2. 调用服务层完成提交。
     * 3. 302 重定向到页面地址。
     */
    @PostMapping("/")
    public ResponseEntity<Void> submitComment(@RequestParam(name = "url", required = false) String url,
                                              @RequestParam(name = "comment_author", required = false) String author,
                                              @RequestParam(name = "comment_author_email", required = false) String authorEmail,
                                              @RequestParam(name = "comment_author_url", required = false) String authorUrl,
                                              @RequestParam(name = "comment_content", required = false) String content,
                                              HttpServletRequest servletRequest) {
        CommentSubmitRequest request = CommentSubmitRequest.builder()
                .url(url)
                .author(author)
                .authorEmail(authorEmail)
                .authorUrl(authorUrl)
                .content(content)
                .userIp(ClientIpUtil.resolve(servletRequest))
                .userAgent(servletRequest.getHeader(HttpHeaders.USER_AGENT))
                .referrer(servletRequest.getHeader(HttpHeaders.REFERER))
                .build();
        CommentSubmission submission = commentService.submit(request);
        return ResponseEntity.status(HttpStatus.FOUND)
                .header(HttpHeaders.LOCATION, submission.getPermalink())
                .build();
    }
}
