package com.hao.comments.service;

import com.hao.comments.common.model.CommentThread;
import com.hao.comments.dal.model.CommentSubmission;
import com.hao.comments.dal.model.CommentSubmitRequest;
import com.hao.comments.dal.model.CommentView;

import java.util.List;

/**
 * 评论业务服务接口
 *
 * 类职责：
 * 提供评论提交与已审核评论列表两个对外能力。
 */
public interface CommentService {

    /**
     * 提交评论
     *
     * 实现逻辑：
     * 1. 校验 URL、作者与内容，非法时在访问 Redis 前拒绝。
     * 2. 判断页面是否接受评论。
     * 3. 分配ID并写入评论详情。
     * 4. 自动审核，审核失败不影响提交结果。
     *
     * @param request 提交请求
     * @return 提交结果
     */
    CommentSubmission submit(CommentSubmitRequest request);

    /**
     * 按ID升序列出页面已审核评论，最多一页，作者与内容已做 HTML 转义
     *
     * @param thread 评论页面
     * @return 评论列表，无评论时为空列表
     */
    List<CommentView> listApproved(CommentThread thread);
}
