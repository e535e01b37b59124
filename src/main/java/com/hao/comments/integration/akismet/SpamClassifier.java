package com.hao.comments.integration.akismet;

import java.util.Map;

/**
 * 反垃圾分类器接口
 *
 * 类职责：
 * 对一条评论给出 spam/ham 判定，并在人工审核后回报结果。
 *
 * 核心实现思路：
 * - 入参是评论哈希字段，字段名与 Akismet 接口一致。
 * - 未配置凭证时 isEnabled 返回 false，调用方不应再发起判定。
 */
public interface SpamClassifier {

    /**
     * 是否已配置凭证
     */
    boolean isEnabled();

    /**
     * 判定评论是否为垃圾评论
     *
     * @param commentFields 评论哈希字段
     * @return true 表示垃圾评论
     * @throws com.hao.comments.common.exception.ClassifierProtocolException 返回内容不是布尔字面量
     * @throws com.hao.comments.common.exception.ClassifierUnavailableException 网络错误或非 2xx 响应
     */
    boolean isSpam(Map<String, String> commentFields);

    /**
     * 回报人工审核通过的评论（误判为垃圾）
     */
    void submitHam(Map<String, String> commentFields);

    /**
     * 回报人工标记的垃圾评论（漏判）
     */
    void submitSpam(Map<String, String> commentFields);
}
