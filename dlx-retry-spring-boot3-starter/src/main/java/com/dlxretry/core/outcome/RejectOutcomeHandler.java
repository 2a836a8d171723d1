package com.dlxretry.core.outcome;

import com.dlxretry.core.ConsumerOps;
import com.dlxretry.core.spi.outcome.OutcomeDecider;
import com.dlxretry.core.spi.outcome.OutcomeHandler;
import com.dlxretry.model.Delivery;
import com.dlxretry.model.ctx.DeliveryContext;
import com.dlxretry.model.enums.DeliveryState;
import lombok.extern.slf4j.Slf4j;

/**
 * 拒绝且不重新入队, 由主队列的死信配置送入等待队列, TTL 到期后回流
 */
@Slf4j
public class RejectOutcomeHandler implements OutcomeHandler {

    @Override
    public DeliveryState support() {
        return DeliveryState.REJECTED;
    }

    @Override
    public void handle(Delivery delivery, DeliveryContext ctx, OutcomeDecider.Decision d, ConsumerOps ops) {
        ops.gateway().reject(delivery.getHandle(), false);
        ops.meter().incRejected();
        log.warn("[Task-Consumer] rejected for retry queue={}, msg={}, retries={}/{}, category={}, err={}",
                ctx.getQueue(), ctx.getMessageId(), ctx.getRetryCount(), ctx.getMaxRetries(),
                d.getCategory(), d.getMessage());
    }
}
