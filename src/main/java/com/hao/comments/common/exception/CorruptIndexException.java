package com.hao.comments.common.exception;

/**
 * 索引损坏异常
 *
 * 类职责：
 * 索引中引用的评论详情读取不到时抛出，读取操作整体失败，不静默跳过该条目。
 */
public class CorruptIndexException extends BackendUnavailableException {

    public CorruptIndexException(String message) {
        super(message);
    }
}
