package com.hao.comments.common.util;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.util.StringUtils;

/**
 * 客户端 IP 解析工具类
 *
 * 类职责：
 * 为提交给 Akismet 的 user_ip 字段解析评论者 IP。
 *
 * 核心实现思路：
 * - 优先读取 X-Forwarded-For，多级代理时取第一个地址。
 * - 兜底读取远程地址。
 */
public class ClientIpUtil {

    private static final String FORWARDED_FOR = "X-Forwarded-For";

    private ClientIpUtil() {
        // 工具类禁止实例化
    }

    /**
     * 解析客户端 IP 地址
     *
     * @param request 请求对象
     * @return 客户端 IP
     */
    public static String resolve(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR);
        if (StringUtils.hasText(forwarded) && !"unknown".equalsIgnoreCase(forwarded.trim())) {
            int comma = forwarded.indexOf(',');
            return (comma == -1 ? forwarded : forwarded.substring(0, comma)).trim();
        }
        return request.getRemoteAddr();
    }
}
