package com.hao.comments.common.aspect;

import com.hao.comments.common.util.RedisSlotUtil;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.JoinPoint;
import org.aspectj.lang.annotation.After;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.springframework.stereotype.Component;

/**
 * Redis 槽位监控切面
 *
 * 类职责：
 * 监控 RedisClient 写操作，在 DEBUG 级别打印 Key 的 Hash Tag 与槽位。
 *
 * 核心实现思路：
 * - 使用 AOP 拦截 RedisClient 的写方法。
 * - 取第一个参数作为 Key，调用 RedisSlotUtil 计算 Slot。
 * - 同一页面的键共享 {comments://host+path} 标签，日志中槽位应一致，便于排查跨槽问题。
 */
@Slf4j
@Aspect
@Component
public class RedisSlotMonitorAspect {

    /**
     * 定义切点：拦截 RedisClient 中的写操作
     */
    @Pointcut("execution(public * com.hao.comments.integration.redis.RedisClient.set*(..)) || " +
              "execution(public * com.hao.comments.integration.redis.RedisClient.hmset*(..)) || " +
              "execution(public * com.hao.comments.integration.redis.RedisClient.sadd*(..)) || " +
              "execution(public * com.hao.comments.integration.redis.RedisClient.zadd*(..)) || " +
              "execution(public * com.hao.comments.integration.redis.RedisClient.zrem*(..))")
    public void redisWriteMethods() {
    }

    /**
     * 后置通知：在写操作方法执行后打印槽位信息
     */
    @After("redisWriteMethods()")
    public void logSlot(JoinPoint joinPoint) {
        if (!log.isDebugEnabled()) {
            return;
        }
        Object[] args = joinPoint.getArgs();
        if (args == null || args.length == 0 || !(args[0] instanceof String)) {
            return; // 无法获取 Key，不处理
        }
        String key = (String) args[0];
        log.debug("Redis槽位监控|Redis_slot_monitor,method={},key={},tag={},slot={}",
                joinPoint.getSignature().getName(), key, RedisSlotUtil.hashTag(key), RedisSlotUtil.getSlot(key));
    }
}
