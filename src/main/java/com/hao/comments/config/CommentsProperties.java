package com.hao.comments.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 评论服务配置属性
 *
 * 类职责：
 * 承载 comments.* 前缀下的全部业务配置，由 Spring 绑定后注入各组件。
 *
 * 核心实现思路：
 * - 站点地址、分页大小、自动启用白名单等放在顶层。
 * - Akismet、ID 分配、管理接口各自一个嵌套配置组。
 */
@Data
@ConfigurationProperties(prefix = "comments")
public class CommentsProperties {

    /** 提交给 Akismet 的站点标识（blog 字段） */
    private String siteUrl = "https://luit.eu/";

    /** 评论列表单页条数 */
    private int pageSize = 10;

    /** 启动时写入自动启用白名单的主机列表 */
    private List<String> autoEnableHosts = new ArrayList<>();

    private Akismet akismet = new Akismet();

    private Allocation allocation = new Allocation();

    private Admin admin = new Admin();

    /**
     * Akismet 反垃圾配置
     */
    @Data
    public static class Akismet {

        /** API Key，为空时关闭自动审核，所有评论保持待审核 */
        private String apiKey = "";

        /** 接口地址模板，依次填入 API Key 与接口名 */
        private String endpointTemplate = "https://%s.rest.akismet.com/1.1/%s";

        private Duration connectTimeout = Duration.ofSeconds(3);

        private Duration readTimeout = Duration.ofSeconds(5);
    }

    /**
     * 评论ID分配配置
     */
    @Data
    public static class Allocation {

        /** 最大尝试次数，0 表示不限次数 */
        private int maxAttempts = 0;

        /** ID 冲突后的重试间隔 */
        private Duration retryInterval = Duration.ofSeconds(1);
    }

    /**
     * 审核管理接口配置
     */
    @Data
    public static class Admin {

        /** 是否开放 /comments/admin 接口（接口本身不做鉴权） */
        private boolean enabled = false;
    }
}
