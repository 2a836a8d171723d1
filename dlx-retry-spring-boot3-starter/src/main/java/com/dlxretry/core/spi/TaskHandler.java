package com.dlxretry.core.spi;

import com.dlxretry.model.ctx.DeliveryContext;
import com.fasterxml.jackson.core.type.TypeReference;

/**
 * 任务执行器
 */
public interface TaskHandler<T> {

    boolean supports(String queue);

    /** 返回 true=成功；抛异常或返回 false=失败（按死信历史决定 reject 或终态ack）*/
    boolean execute(DeliveryContext ctx, T payload) throws Exception;

    /** 负载类型 */
    TypeReference<T> payloadType();

    /** ack 之后回调 */
    default void onSuccess(DeliveryContext ctx) {
    }

    /** reject 进入等待队列之后回调 */
    default void onRejected(DeliveryContext ctx) {
    }

    /** 重试耗尽终态ack之后回调 */
    default void onExhausted(DeliveryContext ctx) {
    }
}
