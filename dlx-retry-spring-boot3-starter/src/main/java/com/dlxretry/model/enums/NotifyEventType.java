package com.dlxretry.model.enums;

/**
 * 通知事件
 */
public enum NotifyEventType {
    /** 达到最大重试, 终态ack */
    RETRIES_EXHAUSTED,

    /** 死信历史无法解析, 按耗尽处理 */
    MALFORMED_DEATH_HISTORY,

    /** 隔离队列收到消息 */
    QUARANTINED,

    /** 与broker连接中断 */
    CONNECTIVITY_LOST,

    /** 投递历史落库失败 */
    PERSIST_FAILED,

    /** 消费者级异常（回调失败、调度异常等） */
    ENGINE_ERROR
}
