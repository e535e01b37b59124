package com.hao.comments.dal.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 评论提交请求
 *
 * 类职责：
 * 承载 HTTP 层收集的表单字段与请求头信息。
 *
 * 核心实现思路：
 * - url、author、content 必填，由服务层校验。
 * - 其余字段原样透传存储。
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CommentSubmitRequest {

    private String url;

    private String author;

    private String authorEmail;

    private String authorUrl;

    private String content;

    private String userIp;

    private String userAgent;

    private String referrer;
}
