package com.hao.comments.service;

import com.hao.comments.common.model.CommentThread;

/**
 * 页面评论开关服务接口
 *
 * 类职责：
 * 判断某个页面是否接受评论，并支持显式设置页面开关。
 *
 * 核心实现思路：
 * - 页面显式开关优先。
 * - 未设置时回落到主机白名单，命中后缓存为显式开关。
 */
public interface EnablementService {

    /**
     * 判断页面是否接受评论
     *
     * 实现逻辑：
     * 1. 读取页面开关，存在则直接返回。
     * 2. 不存在时判断主机是否在白名单中。
     * 3. 命中白名单时尽力写入 true 开关并返回 true，否则返回 false 且不写入。
     *
     * @param thread 评论页面
     * @return 是否接受评论
     * @throws com.hao.comments.common.exception.BackendUnavailableException Redis 访问失败
     */
    boolean isEnabled(CommentThread thread);

    /**
     * 显式设置页面开关
     *
     * @param thread 评论页面
     * @param enabled 是否接受评论
     */
    void setEnabled(CommentThread thread, boolean enabled);
}
