package com.dlxretry.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 单次投递状态
 */
@AllArgsConstructor
@Getter
public enum DeliveryState {
    RECEIVED(0, "已接收, 处理中", false),
    ACKED(1, "任务成功并ack, 消息移除, 终态", true),
    REJECTED(2, "reject(requeue=false), 交由 TTL/DLX 回流, 本次投递结束", false),
    TERMINALLY_ACKED(3, "重试耗尽后ack, 消息移除, 终态", true),
    QUARANTINED(4, "隔离队列观察后ack, 终态", true)
    ;

    public final int code;
    public final String desc;
    /** 是否为逻辑任务的终态 */
    public final boolean terminal;
}
