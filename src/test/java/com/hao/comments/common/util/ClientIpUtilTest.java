package com.hao.comments.common.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * 客户端 IP 解析测试
 */
class ClientIpUtilTest {

    @Test
    @DisplayName("多级代理时取 X-Forwarded-For 第一个地址")
    void firstForwardedAddress() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1, 10.0.0.2");
        request.setRemoteAddr("10.0.0.2");
        assertEquals("203.0.113.7", ClientIpUtil.resolve(request));
    }

    @Test
    @DisplayName("无转发头或值为 unknown 时使用远程地址")
    void fallbackToRemoteAddr() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("198.51.100.4");
        assertEquals("198.51.100.4", ClientIpUtil.resolve(request));

        request.addHeader("X-Forwarded-For", "unknown");
        assertEquals("198.51.100.4", ClientIpUtil.resolve(request));
    }
}
