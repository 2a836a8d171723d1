package com.dlxretry.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

/**
 * 一条死信记录（x-death 的一个元素）
 */
@Getter
@Builder
@ToString
public class DeathRecord {

    /** rejected / expired / maxlen / delivery_limit */
    private final String reason;

    /** 发生死信的队列 */
    private final String queue;

    /** 消息进入该队列时的交换机 */
    private final String exchange;

    /** 可能为空 */
    private final Instant time;

    /** broker 折叠进本条记录的死信次数 */
    private final long count;

    @Singular
    private final List<String> routingKeys;
}
