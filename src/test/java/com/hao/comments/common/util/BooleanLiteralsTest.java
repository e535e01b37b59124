package com.hao.comments.common.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 布尔字面量解析测试
 */
class BooleanLiteralsTest {

    @ParameterizedTest
    @ValueSource(strings = {"1", "t", "T", "true", "True", "TRUE"})
    @DisplayName("真值字面量")
    void trueLiterals(String raw) {
        assertEquals(Optional.of(Boolean.TRUE), BooleanLiterals.parse(raw));
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "f", "F", "false", "False", "FALSE"})
    @DisplayName("假值字面量")
    void falseLiterals(String raw) {
        assertEquals(Optional.of(Boolean.FALSE), BooleanLiterals.parse(raw));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "yes", "invalid", "2", "tRuE", "fALSE", " true", "false\n", "true "})
    @DisplayName("无法识别的内容返回空: 混合大小写与首尾空白同样不接受")
    void unknownLiterals(String raw) {
        assertTrue(BooleanLiterals.parse(raw).isEmpty());
        assertTrue(BooleanLiterals.parse(null).isEmpty());
    }
}
