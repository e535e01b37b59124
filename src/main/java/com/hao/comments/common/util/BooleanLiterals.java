package com.hao.comments.common.util;

import java.util.Optional;

/**
 * 布尔字面量解析工具类
 *
 * 类职责：
 * 解析 Redis 中的开关值与 Akismet 返回的判定结果。
 *
 * 核心实现思路：
 * - 只接受 1/t/T/true/True/TRUE 与 0/f/F/false/False/FALSE，不去除空白，不接受混合大小写。
 * - 其他内容返回空，由调用方决定按何种异常处理。
 */
public class BooleanLiterals {

    private BooleanLiterals() {
        // 工具类禁止实例化
    }

    /**
     * 解析布尔字面量
     *
     * @param raw 原始字符串
     * @return 解析结果，无法识别时为空
     */
    public static Optional<Boolean> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        switch (raw) {
            case "1":
            case "t":
            case "T":
            case "true":
            case "True":
            case "TRUE":
                return Optional.of(Boolean.TRUE);
            case "0":
            case "f":
            case "F":
            case "false":
            case "False":
            case "FALSE":
                return Optional.of(Boolean.FALSE);
            default:
                return Optional.empty();
        }
    }
}
