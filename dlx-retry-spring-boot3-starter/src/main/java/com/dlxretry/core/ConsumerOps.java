package com.dlxretry.core;

import com.dlxretry.config.DlxRetryProperties;
import com.dlxretry.core.metric.DlxRetryMetrics;
import com.dlxretry.core.notify.NotifyingFacade;
import com.dlxretry.core.spi.BrokerGateway;
import com.dlxretry.model.ctx.DeliveryContext;
import com.dlxretry.model.enums.DeliveryState;

/**
 * 只暴露结算策略需要的能力
 * 不暴露实现细节
 */
public interface ConsumerOps {

    String consumerId();

    DlxRetryProperties props();

    /** 当前会话 */
    BrokerGateway gateway();

    NotifyingFacade notifier();

    DlxRetryMetrics meter();

    /** 记录结算结果, 记录失败只告警不抛出 */
    void record(DeliveryContext ctx, DeliveryState state);
}
