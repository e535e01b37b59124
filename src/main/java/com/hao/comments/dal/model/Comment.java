package com.hao.comments.dal.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 评论存储实体
 *
 * 类职责：
 * 描述一条评论在 Redis 哈希中的全部字段，提交后不再修改。
 *
 * 核心实现思路：
 * - 哈希字段名与 Akismet 接口字段一致，审核时可直接原样提交。
 * - 可选字段缺失时以空串存储。
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class Comment {

    public static final String FIELD_PERMALINK = "permalink";
    public static final String FIELD_USER_IP = "user_ip";
    public static final String FIELD_USER_AGENT = "user_agent";
    public static final String FIELD_REFERRER = "referrer";
    public static final String FIELD_AUTHOR = "comment_author";
    public static final String FIELD_AUTHOR_EMAIL = "comment_author_email";
    public static final String FIELD_AUTHOR_URL = "comment_author_url";
    public static final String FIELD_CONTENT = "comment_content";

    /** 评论所在页面的原始 URL */
    private String permalink;

    private String userIp;

    private String userAgent;

    private String referrer;

    private String author;

    private String authorEmail;

    private String authorUrl;

    private String content;

    /**
     * 转换为 Redis 哈希字段
     *
     * @return 字段映射（保持固定顺序）
     */
    public Map<String, String> toHash() {
        Map<String, String> hash = new LinkedHashMap<>();
        hash.put(FIELD_PERMALINK, nullToEmpty(permalink));
        hash.put(FIELD_USER_IP, nullToEmpty(userIp));
        hash.put(FIELD_USER_AGENT, nullToEmpty(userAgent));
        hash.put(FIELD_REFERRER, nullToEmpty(referrer));
        hash.put(FIELD_AUTHOR, nullToEmpty(author));
        hash.put(FIELD_AUTHOR_EMAIL, nullToEmpty(authorEmail));
        hash.put(FIELD_AUTHOR_URL, nullToEmpty(authorUrl));
        hash.put(FIELD_CONTENT, nullToEmpty(content));
        return hash;
    }

    /**
     * 从 Redis 哈希字段还原
     *
     * @param hash HGETALL 结果
     * @return 评论实体
     */
    public static Comment fromHash(Map<String, String> hash) {
        return Comment.builder()
                .permalink(hash.get(FIELD_PERMALINK))
                .userIp(hash.get(FIELD_USER_IP))
                .userAgent(hash.get(FIELD_USER_AGENT))
                .referrer(hash.get(FIELD_REFERRER))
                .author(hash.get(FIELD_AUTHOR))
                .authorEmail(hash.get(FIELD_AUTHOR_EMAIL))
                .authorUrl(hash.get(FIELD_AUTHOR_URL))
                .content(hash.get(FIELD_CONTENT))
                .build();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
