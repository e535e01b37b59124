package com.hao.comments.service.impl;

import com.hao.comments.common.enums.RedisKeysEnum;
import com.hao.comments.common.exception.BackendUnavailableException;
import com.hao.comments.common.model.CommentThread;
import com.hao.comments.common.util.BooleanLiterals;
import com.hao.comments.integration.redis.RedisClient;
import com.hao.comments.service.EnablementService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * 页面评论开关服务实现
 *
 * 类职责：
 * 结合页面显式开关与主机白名单判断页面是否接受评论。
 *
 * 核心实现思路：
 * - 开关键不存在表示"未设置"而非"关闭"，此时回落到白名单。
 * - 白名单命中后写入 true 开关作为缓存，写入失败只记录告警，不影响判定结果。
 * - 白名单未命中时不写入 false，白名单后续新增的主机仍能生效。
 * - 读取失败直接抛出，不做本地兜底放行。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnablementServiceImpl implements EnablementService {

    private static final String TRUE_LITERAL = "true";
    private static final String FALSE_LITERAL = "false";

    private final RedisClient<String> redisClient;

    @Override
    public boolean isEnabled(CommentThread thread) {
        String flagKey = RedisKeysEnum.THREAD_ENABLED.forThread(thread);
        Boolean member;
        try {
            // 核心代码：读取页面显式开关
            String flag = redisClient.get(flagKey);
            if (flag != null) {
                return BooleanLiterals.parse(flag)
                        .orElseThrow(() -> new BackendUnavailableException(
                                "invalid enabled flag at " + flagKey + ": " + flag));
            }
            // 核心代码：回落到主机白名单
            member = redisClient.sismember(RedisKeysEnum.AUTO_ENABLE.getKey(), thread.getHost());
        } catch (DataAccessException e) {
            throw new BackendUnavailableException("failed to resolve enablement for " + thread, e);
        }

        if (!Boolean.TRUE.equals(member)) {
            return false;
        }
        cacheEnabled(flagKey, thread);
        return true;
    }

    @Override
    public void setEnabled(CommentThread thread, boolean enabled) {
        try {
            redisClient.set(RedisKeysEnum.THREAD_ENABLED.forThread(thread), enabled ? TRUE_LITERAL : FALSE_LITERAL);
        } catch (DataAccessException e) {
            throw new BackendUnavailableException("failed to set enablement for " + thread, e);
        }
        log.info("页面评论开关已设置|Thread_enablement_set,thread={},enabled={}", thread, enabled);
    }

    /**
     * 缓存白名单判定结果
     *
     * 实现逻辑：
     * 1. 写入 true 开关，多个进程并发写入同一值是幂等的。
     * 2. 失败只记录告警，下次请求会再走一次白名单判断。
     */
    private void cacheEnabled(String flagKey, CommentThread thread) {
        try {
            redisClient.set(flagKey, TRUE_LITERAL);
            log.info("白名单自动启用页面评论|Auto_enable_thread,thread={}", thread);
        } catch (DataAccessException e) {
            log.warn("页面开关缓存写入失败|Enabled_flag_cache_fail,thread={},error={}", thread, e.getMessage(), e);
        }
    }
}
