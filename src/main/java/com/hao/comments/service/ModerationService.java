package com.hao.comments.service;

import com.hao.comments.common.model.CommentThread;

import java.util.List;

/**
 * 评论审核服务接口
 *
 * 类职责：
 * 自动审核（调用反垃圾分类器）、人工通过、人工撤回与待审核列表。
 *
 * 核心实现思路：
 * - 已审核索引始终是全部评论索引的子集。
 * - 撤回只从已审核索引移除，评论与全部评论索引保持不变。
 */
public interface ModerationService {

    /**
     * 自动审核
     *
     * 实现逻辑：
     * 1. 未配置反垃圾凭证时直接返回 false，评论保持待审核。
     * 2. 读取评论详情并提交分类器。
     * 3. 判定为非垃圾时 ZADD NX 到已审核索引，返回是否新增。
     *
     * @param thread 评论页面
     * @param commentId 评论ID，调用前评论详情必须已写入
     * @return 是否审核通过
     */
    boolean classify(CommentThread thread, long commentId);

    /**
     * 人工审核通过，并尽力向分类器回报误判
     *
     * @return 是否新加入已审核索引
     */
    boolean approve(CommentThread thread, long commentId);

    /**
     * 人工撤回（标记为垃圾），并尽力向分类器回报漏判
     *
     * @return 是否从已审核索引中移除
     */
    boolean retract(CommentThread thread, long commentId);

    /**
     * 列出待审核评论ID（全部评论索引减去已审核索引），按ID升序
     */
    List<Long> listPending(CommentThread thread);
}
