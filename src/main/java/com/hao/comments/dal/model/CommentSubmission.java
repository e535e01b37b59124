package com.hao.comments.dal.model;

import com.hao.comments.common.model.CommentThread;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 评论提交结果
 */
@Data
@AllArgsConstructor
public class CommentSubmission {

    private CommentThread thread;

    private long id;

    /** 是否已自动审核通过 */
    private boolean approved;

    /** 提交成功后重定向的地址 */
    private String permalink;
}
