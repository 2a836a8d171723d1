package com.dlxretry.core.outcome;

import com.dlxretry.core.ConsumerOps;
import com.dlxretry.core.spi.outcome.OutcomeDecider;
import com.dlxretry.core.spi.outcome.OutcomeHandler;
import com.dlxretry.model.Delivery;
import com.dlxretry.model.ctx.DeliveryContext;
import com.dlxretry.model.enums.DeliveryState;
import lombok.extern.slf4j.Slf4j;

/**
 * 成功结算
 */
@Slf4j
public class AckOutcomeHandler implements OutcomeHandler {

    @Override
    public DeliveryState support() {
        return DeliveryState.ACKED;
    }

    @Override
    public void handle(Delivery delivery, DeliveryContext ctx, OutcomeDecider.Decision d, ConsumerOps ops) {
        ops.gateway().ack(delivery.getHandle());
        ops.meter().incAcked();
        log.info("[Task-Consumer] acked queue={}, msg={}, retries={}, deaths={}",
                ctx.getQueue(), ctx.getMessageId(), ctx.getRetryCount(), ctx.getDeathHistory());
    }
}
