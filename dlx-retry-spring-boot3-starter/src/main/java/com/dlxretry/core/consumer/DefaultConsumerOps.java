package com.dlxretry.core.consumer;

import com.dlxretry.config.DlxRetryProperties;
import com.dlxretry.core.ConsumerOps;
import com.dlxretry.core.metric.DlxRetryMetrics;
import com.dlxretry.core.notify.NotifyContexts;
import com.dlxretry.core.notify.NotifyingFacade;
import com.dlxretry.core.spi.BrokerGateway;
import com.dlxretry.core.spi.DeliveryHistoryRecorder;
import com.dlxretry.model.ctx.DeliveryContext;
import com.dlxretry.model.enums.DeliveryState;
import com.dlxretry.model.enums.Severity;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class DefaultConsumerOps implements ConsumerOps {

    private final String consumerId;
    private final DlxRetryProperties props;
    private final BrokerGateway gateway;
    private final NotifyingFacade notifier;
    private final DlxRetryMetrics meter;
    private final DeliveryHistoryRecorder history;

    public DefaultConsumerOps(String consumerId,
                              DlxRetryProperties props,
                              BrokerGateway gateway,
                              NotifyingFacade notifier,
                              DlxRetryMetrics meter,
                              DeliveryHistoryRecorder history) {
        this.consumerId = consumerId;
        this.props = props;
        this.gateway = gateway;
        this.notifier = notifier;
        this.meter = meter;
        this.history = history;
    }

    @Override
    public String consumerId() {
        return consumerId;
    }

    @Override
    public DlxRetryProperties props() {
        return props;
    }

    @Override
    public BrokerGateway gateway() {
        return gateway;
    }

    @Override
    public NotifyingFacade notifier() {
        return notifier;
    }

    @Override
    public DlxRetryMetrics meter() {
        return meter;
    }

    @Override
    public void record(DeliveryContext ctx, DeliveryState state) {
        try {
            history.record(ctx, state);
        } catch (Exception e) {
            log.error("[History] record failed, queue={}, msg={}, state={}", ctx.getQueue(), ctx.getMessageId(), state, e);
            notifier.fire(NotifyContexts.ctxForPersistFail(ctx, "record:" + state, e), Severity.ERROR);
        }
    }
}
