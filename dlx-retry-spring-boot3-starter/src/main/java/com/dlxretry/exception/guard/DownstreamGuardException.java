package com.dlxretry.exception.guard;

import com.dlxretry.model.enums.FailureCategory;

/**
 * 守护层拒绝执行任务（熔断/隔离/限流）
 * 任务体未被调用, 但对死信历史判定而言等同于一次任务失败
 */
public abstract class DownstreamGuardException extends RuntimeException {

    private final FailureCategory category;

    protected DownstreamGuardException(String message, FailureCategory category, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public FailureCategory getCategory() {
        return category;
    }
}
