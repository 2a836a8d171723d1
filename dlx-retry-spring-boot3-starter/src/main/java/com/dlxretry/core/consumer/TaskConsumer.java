package com.dlxretry.core.consumer;

import com.dlxretry.config.DlxRetryProperties;
import com.dlxretry.core.handler.GuardedTaskExecutor;
import com.dlxretry.core.inspect.DeathHistoryInspector;
import com.dlxretry.core.inspect.Inspection;
import com.dlxretry.core.metric.DlxRetryMetrics;
import com.dlxretry.core.notify.NotifyingFacade;
import com.dlxretry.core.outcome.OutcomeHandlerFactory;
import com.dlxretry.core.spi.BrokerGateway;
import com.dlxretry.core.spi.DeliveryHistoryRecorder;
import com.dlxretry.core.spi.PayloadSerializer;
import com.dlxretry.core.spi.TaskHandler;
import com.dlxretry.core.spi.outcome.OutcomeDecider;
import com.dlxretry.exception.TaskExecutionException;
import com.dlxretry.model.Delivery;
import com.dlxretry.model.TaskMessage;
import com.dlxretry.model.ctx.DeliveryContext;
import com.dlxretry.model.enums.DeliveryState;
import com.dlxretry.model.enums.FailureCategory;

import java.util.List;

/**
 * 主队列消费者
 * 每条投递：执行任务 → 成功 ack；失败时按死信历史 reject（回流重试）或终态 ack
 * 任务异常不会逃逸, 只有 broker 连接异常会终止本会话
 */
public class TaskConsumer extends AbstractQueueConsumer {

    private final TaskHandler<?> handler;

    private final PayloadSerializer serializer;

    private final GuardedTaskExecutor executor;

    private final DeathHistoryInspector inspector;

    private final OutcomeDecider decider;

    private final OutcomeHandlerFactory outcomes;

    private final DlxRetryProperties props;

    private final NotifyingFacade notifier;

    private final DlxRetryMetrics meter;

    private final DeliveryHistoryRecorder history;

    public TaskConsumer(String consumerId,
                        DlxRetryProperties props,
                        List<TaskHandler<?>> handlers,
                        PayloadSerializer serializer,
                        GuardedTaskExecutor executor,
                        DeathHistoryInspector inspector,
                        OutcomeDecider decider,
                        OutcomeHandlerFactory outcomes,
                        NotifyingFacade notifier,
                        DlxRetryMetrics meter,
                        DeliveryHistoryRecorder history) {
        super(consumerId, props.getTaskQueue().getName(), props.getPrefetchCount(), props.getPollTimeout());
        this.props = props;
        this.handler = handlers.stream()
                .filter(h -> h.supports(queue))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("no TaskHandler supports queue " + queue));
        this.serializer = serializer;
        this.executor = executor;
        this.inspector = inspector;
        this.decider = decider;
        this.outcomes = outcomes;
        this.notifier = notifier;
        this.meter = meter;
        this.history = history;
    }

    @Override
    protected String tag() {
        return "Task-Consumer";
    }

    @Override
    protected void process(BrokerGateway gateway, Delivery delivery) {
        TaskMessage message = delivery.getMessage();
        meter.incReceived();

        Inspection inspection = inspector.inspect(message.getHeaders());
        DeliveryContext ctx = DeliveryContext.builder()
                .consumerId(consumerId)
                .queue(delivery.getQueue())
                .messageId(message.getMessageId())
                .deliveryTag(delivery.getHandle().getDeliveryTag())
                .redelivered(delivery.isRedelivered())
                .headers(message.getHeaders())
                .deathHistory(inspection.getHistory())
                .retryCount(Math.max(0, inspection.getRetryCount()))
                .maxRetries(inspector.getPolicy().getMaxRetries())
                .build();
        meter.recordRetries(ctx.getRetryCount());

        Throwable failure;
        long t0 = System.nanoTime();
        try {
            failure = runTask(handler, ctx, message);
        } catch (InterruptedException ie) {
            // 停机中断：不结算, 由 broker 重新投递
            Thread.currentThread().interrupt();
            log.warn("[Task-Consumer] interrupted, leaving msg={} unsettled on queue={}", ctx.getMessageId(), queue);
            return;
        } finally {
            meter.recordExecNanos(System.nanoTime() - t0);
        }

        if (failure != null) {
            ctx.setErr(failure.toString());
        }
        OutcomeDecider.Decision d = decider.decide(failure, inspection, ctx);
        ctx.setFailureCategory(d.getCategory());

        DefaultConsumerOps ops = new DefaultConsumerOps(consumerId, props, gateway, notifier, meter, history);
        outcomes.get(d).handle(delivery, ctx, d, ops);
        ctx.setState(d.getState());
        ops.record(ctx, d.getState());
        callback(d.getState(), ctx);
    }

    /**
     * @return 失败原因, 成功为 null
     */
    private <T> Throwable runTask(TaskHandler<T> h, DeliveryContext ctx, TaskMessage message) throws InterruptedException {
        T payload;
        try {
            payload = serializer.deserialize(message.getPayload(), h.payloadType());
        } catch (RuntimeException e) {
            return new TaskExecutionException(FailureCategory.DESERIALIZE, "payload not readable: " + e.getMessage(), e);
        }
        try {
            boolean ok = executor.execute(queue, ctx, payload, h);
            return ok ? null : new TaskExecutionException(FailureCategory.HANDLER_FALSE, "handler returned false");
        } catch (InterruptedException ie) {
            throw ie;
        } catch (Exception e) {
            log.debug("[Task-Consumer] task failed, msg={}", ctx.getMessageId(), e);
            return e;
        } catch (Throwable t) {
            // 任务体抛出的 Error 同样按任务失败结算, 不终止消费线程
            log.error("[Task-Consumer] task raised {}, msg={}", t.getClass().getName(), ctx.getMessageId(), t);
            return t;
        }
    }

    private void callback(DeliveryState state, DeliveryContext ctx) {
        try {
            switch (state) {
                case ACKED -> handler.onSuccess(ctx);
                case REJECTED -> handler.onRejected(ctx);
                default -> handler.onExhausted(ctx);
            }
        } catch (Exception e) {
            // 回调失败不影响已完成的结算
            log.error("[Task-Consumer] callback for {} failed, msg={}", state, ctx.getMessageId(), e);
        }
    }

    public TaskHandler<?> getHandler() {
        return handler;
    }
}
