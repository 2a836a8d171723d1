package com.dlxretry.core.outcome;

import com.dlxretry.config.DlxRetryProperties;
import com.dlxretry.core.ConsumerOps;
import com.dlxretry.core.notify.NotifyContexts;
import com.dlxretry.core.spi.outcome.OutcomeDecider;
import com.dlxretry.core.spi.outcome.OutcomeHandler;
import com.dlxretry.model.Delivery;
import com.dlxretry.model.ctx.DeliveryContext;
import com.dlxretry.model.enums.DeliveryState;
import com.dlxretry.model.enums.Severity;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 重试耗尽：可选转发一份到隔离交换机, 然后 ack 终止回流
 */
@Slf4j
public class TerminalAckOutcomeHandler implements OutcomeHandler {

    /** 转发副本上携带的耗尽原因 */
    public static final String EXHAUSTED_REASON_HEADER = "x-exhausted-reason";

    @Override
    public DeliveryState support() {
        return DeliveryState.TERMINALLY_ACKED;
    }

    @Override
    public void handle(Delivery delivery, DeliveryContext ctx, OutcomeDecider.Decision d, ConsumerOps ops) {
        DlxRetryProperties.Quarantine q = ops.props().getQuarantine();
        if (q.isForwardExhausted()) {
            Map<String, Object> headers = new LinkedHashMap<>(delivery.getMessage().getHeaders());
            headers.put(EXHAUSTED_REASON_HEADER, d.getCode());
            // 先发布后确认, 发布失败时消息保持未确认由 broker 重投
            ops.gateway().publish(q.getExchange(), q.getRoutingKey(), delivery.getMessage(), headers);
            ops.meter().incQuarantined();
        }
        ops.gateway().ack(delivery.getHandle());
        ops.meter().incExhausted();

        if (d.isMalformed()) {
            ops.meter().incMalformed();
            log.error("[Task-Consumer] death history unreadable, terminally acked queue={}, msg={}, code={}, detail={}, err={}",
                    ctx.getQueue(), ctx.getMessageId(), d.getCode(), d.getMessage(), ctx.getErr());
            ops.notifier().fire(NotifyContexts.ctxForMalformed(ctx, d.getCode(), d.getMessage()), Severity.ERROR);
        } else {
            log.error("[Task-Consumer] retries exhausted, terminally acked queue={}, msg={}, retries={}/{}, forwarded={}, deaths={}, err={}",
                    ctx.getQueue(), ctx.getMessageId(), ctx.getRetryCount(), ctx.getMaxRetries(),
                    q.isForwardExhausted(), ctx.getDeathHistory(), ctx.getErr());
            ops.notifier().fire(NotifyContexts.ctxForExhausted(ctx, d.getCode()), Severity.ERROR);
        }
    }
}
