package com.dlxretry.model.enums;

/**
 * 死信历史判定结果
 */
public enum Verdict {

    /** 允许再次重试（含首次投递） */
    RETRY_ELIGIBLE,

    /** 重试耗尽, 或死信历史无法解析 */
    RETRIES_EXHAUSTED
}
