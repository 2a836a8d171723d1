package com.dlxretry.core.spi.outcome;

import com.dlxretry.core.ConsumerOps;
import com.dlxretry.model.Delivery;
import com.dlxretry.model.ctx.DeliveryContext;
import com.dlxretry.model.enums.DeliveryState;

/**
 * 根据决策完成结算（ack / reject）
 * broker 不可用时抛出的 BrokerConnectivityException 必须向上传播
 */
public interface OutcomeHandler {

    DeliveryState support();

    void handle(Delivery delivery, DeliveryContext ctx, OutcomeDecider.Decision d, ConsumerOps ops);
}
