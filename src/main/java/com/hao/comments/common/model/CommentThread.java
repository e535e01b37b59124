package com.hao.comments.common.model;

import com.hao.comments.common.exception.InvalidCommentRequestException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;

/**
 * 评论页面标识
 *
 * 类职责：
 * 用 (host, path) 标识一个评论串，是页面级 Redis 键的分区键。
 *
 * 核心实现思路：
 * - host 取 URL 的主机部分，带端口时保留 ":port"。
 * - path 取解码后的路径，不做大小写、末尾斜杠或默认端口的归一化，调用方需保证 URL 一致。
 * - 查询串与锚点不参与标识。
 */
@Getter
@EqualsAndHashCode
public final class CommentThread {

    private final String host;
    private final String path;

    private CommentThread(String host, String path) {
        this.host = host;
        this.path = path;
    }

    /**
     * 直接按 host/path 构造
     *
     * @param host 主机，不能为空
     * @param path 路径，可为空串
     * @return 评论页面
     */
    public static CommentThread of(String host, String path) {
        if (!StringUtils.hasLength(host)) {
            throw new InvalidCommentRequestException("bad url value: missing host");
        }
        return new CommentThread(host, path == null ? "" : path);
    }

    /**
     * 从 URL 解析评论页面
     *
     * 实现逻辑：
     * 1. 空 URL、解析失败或路径中有非法百分号编码视为非法 URL。
     * 2. 主机为空视为缺少主机，避免所有无主机路径混入同一个评论串。
     *
     * @param url 页面 URL
     * @return 评论页面
     */
    public static CommentThread parse(String url) {
        if (!StringUtils.hasText(url)) {
            throw new InvalidCommentRequestException("bad url value: empty");
        }
        String host;
        String path;
        try {
            UriComponents components = UriComponentsBuilder.fromUriString(url).build();
            host = components.getHost();
            // 路径按 UTF-8 解码，编码与未编码的同一路径属于同一评论串
            path = components.getPath() == null ? null : UriUtils.decode(components.getPath(), StandardCharsets.UTF_8);
            if (StringUtils.hasLength(host) && components.getPort() != -1) {
                host = host + ":" + components.getPort();
            }
        } catch (IllegalArgumentException | IllegalStateException e) {
            // 非法端口等情况在 getPort 时才暴露
            throw new InvalidCommentRequestException("bad url value: " + e.getMessage(), e);
        }
        return of(host, path);
    }

    @Override
    public String toString() {
        return host + path;
    }
}
