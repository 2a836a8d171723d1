package com.dlxretry.exception;

import com.dlxretry.model.enums.FailureCategory;

/**
 * 任务执行失败, 消费端本地恢复（reject 或 终态ack）, 不会终止消费者
 */
public class TaskExecutionException extends RuntimeException {

    private final FailureCategory category;

    public TaskExecutionException(FailureCategory category, String message) {
        super(message);
        this.category = category;
    }

    public TaskExecutionException(FailureCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public FailureCategory getCategory() {
        return category;
    }
}
