package com.dlxretry.model.enums;

/**
 * 任务失败分类, 用于日志与指标维度
 */
public enum FailureCategory {
    OPEN_CIRCUIT,
    RATE_LIMITED,
    BULKHEAD_FULL,
    DESERIALIZE,
    HANDLER_FALSE,
    UNKNOWN
}
