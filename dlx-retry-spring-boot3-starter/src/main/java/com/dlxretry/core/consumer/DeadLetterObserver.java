package com.dlxretry.core.consumer;

import com.dlxretry.config.DlxRetryProperties;
import com.dlxretry.core.inspect.DeathHistoryReader;
import com.dlxretry.core.metric.DlxRetryMetrics;
import com.dlxretry.core.notify.NotifyContexts;
import com.dlxretry.core.notify.NotifyingFacade;
import com.dlxretry.core.spi.BrokerGateway;
import com.dlxretry.core.spi.DeliveryHistoryRecorder;
import com.dlxretry.exception.MalformedDeathHistoryException;
import com.dlxretry.model.DeathHistory;
import com.dlxretry.model.DeathRecord;
import com.dlxretry.model.Delivery;
import com.dlxretry.model.TaskMessage;
import com.dlxretry.model.ctx.DeliveryContext;
import com.dlxretry.model.enums.DeliveryState;
import com.dlxretry.model.enums.Severity;

/**
 * 隔离队列观察者
 * 只读取并记录死信原因, 然后 ack; 不发布、不拒绝
 */
public class DeadLetterObserver extends AbstractQueueConsumer {

    private final DlxRetryProperties props;

    private final DeathHistoryReader reader;

    private final NotifyingFacade notifier;

    private final DlxRetryMetrics meter;

    private final DeliveryHistoryRecorder history;

    public DeadLetterObserver(String consumerId,
                              DlxRetryProperties props,
                              DeathHistoryReader reader,
                              NotifyingFacade notifier,
                              DlxRetryMetrics meter,
                              DeliveryHistoryRecorder history) {
        super(consumerId, props.getQuarantine().getQueue(), props.getPrefetchCount(), props.getPollTimeout());
        this.props = props;
        this.reader = reader;
        this.notifier = notifier;
        this.meter = meter;
        this.history = history;
    }

    @Override
    protected String tag() {
        return "Dead-Letter";
    }

    @Override
    protected void process(BrokerGateway gateway, Delivery delivery) {
        TaskMessage message = delivery.getMessage();
        DeathHistory deaths;
        try {
            deaths = reader.read(message.getHeaders());
        } catch (MalformedDeathHistoryException e) {
            log.warn("[Dead-Letter] unreadable death history, msg={}, queue={}: {}",
                    message.getMessageId(), queue, e.getMessage());
            deaths = DeathHistory.empty();
        }

        DeathRecord latest = deaths.latest().orElse(null);
        if (latest == null) {
            log.warn("[Dead-Letter] msg={} arrived without death history, headers={}",
                    message.getMessageId(), message.getHeaders().keySet());
        } else {
            log.warn("[Dead-Letter] msg={} reason={}, queue={}, exchange={}, deaths={}, count={}",
                    message.getMessageId(), latest.getReason(), latest.getQueue(), latest.getExchange(),
                    deaths.size(), deaths.countFrom(null));
        }

        gateway.ack(delivery.getHandle());
        meter.incObserved();

        DeliveryContext ctx = DeliveryContext.builder()
                .consumerId(consumerId)
                .queue(delivery.getQueue())
                .messageId(message.getMessageId())
                .deliveryTag(delivery.getHandle().getDeliveryTag())
                .redelivered(delivery.isRedelivered())
                .headers(message.getHeaders())
                .deathHistory(deaths)
                .retryCount(deaths.countFrom(props.getTaskQueue().getName()))
                .maxRetries(props.getMaxRetries())
                .err(latest == null ? null : latest.getReason())
                .state(DeliveryState.QUARANTINED)
                .build();
        notifier.fire(NotifyContexts.ctxForQuarantined(ctx), Severity.WARNING);
        new DefaultConsumerOps(consumerId, props, gateway, notifier, meter, history)
                .record(ctx, DeliveryState.QUARANTINED);
    }
}
