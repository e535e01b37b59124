package com.hao.comments.common.util;

import io.lettuce.core.codec.CRC16;

import java.nio.charset.StandardCharsets;

/**
 * Redis 集群槽位计算工具类
 *
 * 类职责：
 * 计算评论键所属的哈希槽，供写操作监控日志使用。
 *
 * 核心算法：
 * Slot = CRC16(hashTag(key)) % 16384
 */
public class RedisSlotUtil {

    /**
     * Redis 集群总槽位数
     */
    public static final int CLUSTER_SLOTS = 16384;

    private RedisSlotUtil() {
        // 工具类禁止实例化
    }

    /**
     * 提取参与槽位计算的部分
     *
     * 实现逻辑：
     * 1. 键中第一个 '{' 之后存在非空的 {...} 时，只取花括号内的部分。
     * 2. 否则取整个键。
     *
     * @param key Redis Key
     * @return 参与计算的字符串
     */
    public static String hashTag(String key) {
        int start = key.indexOf('{');
        if (start != -1) {
            int end = key.indexOf('}', start + 1);
            if (end > start + 1) {
                return key.substring(start + 1, end);
            }
        }
        return key;
    }

    /**
     * 计算 Key 对应的 Slot
     *
     * @param key Redis Key
     * @return Slot ID (0 - 16383)
     */
    public static int getSlot(String key) {
        if (key == null) {
            return 0;
        }
        // Lettuce 自带标准 CRC16 实现
        return CRC16.crc16(hashTag(key).getBytes(StandardCharsets.UTF_8)) % CLUSTER_SLOTS;
    }
}
