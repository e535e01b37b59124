package com.hao.comments.dal.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 评论列表展示对象
 *
 * 类职责：
 * 对外输出的评论结构，author 与 content 已做 HTML 转义，可直接嵌入页面。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class CommentView {

    /** 评论ID（秒级时间戳字符串） */
    private String id;

    private String author;

    private String content;
}
