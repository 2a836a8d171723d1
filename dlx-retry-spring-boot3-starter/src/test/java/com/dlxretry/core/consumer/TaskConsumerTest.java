package com.dlxretry.core.consumer;

import com.dlxretry.config.DlxRetryProperties;
import com.dlxretry.core.handler.GuardedTaskExecutor;
import com.dlxretry.core.inspect.DeathHistoryInspector;
import com.dlxretry.core.inspect.DeathHistoryReader;
import com.dlxretry.core.inspect.Inspection;
import com.dlxretry.core.metric.DlxRetryMetrics;
import com.dlxretry.core.notify.AsyncNotifyingService;
import com.dlxretry.core.notify.NotifyingFacade;
import com.dlxretry.core.outcome.DefaultOutcomeDecider;
import com.dlxretry.core.outcome.OutcomeHandlerFactory;
import com.dlxretry.core.outcome.TerminalAckOutcomeHandler;
import com.dlxretry.core.serializer.JacksonPayloadSerializer;
import com.dlxretry.core.spi.BrokerGateway;
import com.dlxretry.core.spi.DeliveryStream;
import com.dlxretry.core.spi.TaskHandler;
import com.dlxretry.exception.BrokerConnectivityException;
import com.dlxretry.model.Delivery;
import com.dlxretry.model.RetryPolicy;
import com.dlxretry.model.TaskMessage;
import com.dlxretry.model.ctx.DeliveryContext;
import com.dlxretry.model.ctx.NotifyContext;
import com.dlxretry.model.enums.DeliveryState;
import com.dlxretry.model.enums.FailureCategory;
import com.dlxretry.model.enums.NotifyEventType;
import com.dlxretry.model.enums.Severity;
import com.dlxretry.support.FakeBrokerGateway;
import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class TaskConsumerTest {

    private static final String TASK = "task_queue";

    private DlxRetryProperties props;

    private FakeBrokerGateway gateway;

    private AsyncNotifyingService notifier;

    private DlxRetryMetrics metrics;

    private final List<DeliveryState> states = Collections.synchronizedList(new ArrayList<>());

    private final List<DeliveryContext> contexts = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    void setUp() {
        props = new DlxRetryProperties();
        props.setPollTimeout(Duration.ofMillis(10));
        gateway = new FakeBrokerGateway("s-1");
        notifier = mock(AsyncNotifyingService.class);
        metrics = DlxRetryMetrics.noop();
    }

    private TaskConsumer consumer(TaskHandler<?> handler) {
        DeathHistoryInspector inspector = new DeathHistoryInspector(RetryPolicy.of(props.getMaxRetries()),
                new DeathHistoryReader(props.getRetryCountHeader()), props.getTaskQueue().getName());
        return new TaskConsumer("c-1", props, List.<TaskHandler<?>>of(handler), new JacksonPayloadSerializer(),
                GuardedTaskExecutor.passThrough(), inspector, new DefaultOutcomeDecider(),
                OutcomeHandlerFactory.defaults(), new NotifyingFacade(() -> notifier), metrics,
                (ctx, state) -> {
                    contexts.add(ctx);
                    states.add(state);
                });
    }

    private void publish(String id) {
        gateway.enqueue(TASK, TaskMessage.of(id, "hello".getBytes(StandardCharsets.UTF_8), Map.of()));
    }

    /** 逐条处理直到主队列为空, 每条处理完必须已结算 */
    private int drain(TaskConsumer c) throws InterruptedException {
        DeliveryStream stream = gateway.consume(c.getQueue(), props.getPrefetchCount());
        int n = 0;
        Delivery d;
        while ((d = stream.poll(Duration.ZERO)) != null) {
            c.process(gateway, d);
            assertThat(d.getHandle().isSettled()).isTrue();
            n++;
        }
        return n;
    }

    private Delivery next(TaskConsumer c) throws InterruptedException {
        return gateway.consume(c.getQueue(), props.getPrefetchCount()).poll(Duration.ZERO);
    }

    @Test
    void alwaysFailingTaskIsTerminallyAckedOnTheFourthDelivery() throws Exception {
        props.setMaxRetries(3);
        ScriptedHandler handler = ScriptedHandler.always(new IllegalStateException("downstream 500"));
        publish("m-1");

        int deliveries = drain(consumer(handler));

        assertThat(deliveries).isEqualTo(4);
        assertThat(handler.seenRetries).containsExactly(0L, 1L, 2L, 3L);
        assertThat(gateway.count("reject:")).isEqualTo(3);
        assertThat(gateway.count("ack:")).isEqualTo(1);
        assertThat(gateway.queued(TASK)).isZero();
        assertThat(states).containsExactly(DeliveryState.REJECTED, DeliveryState.REJECTED,
                DeliveryState.REJECTED, DeliveryState.TERMINALLY_ACKED);
        assertThat(handler.callbacks).containsExactly("rejected", "rejected", "rejected", "exhausted");
        assertThat(metrics.rejected()).isEqualTo(3);
        assertThat(metrics.exhausted()).isEqualTo(1);
        assertThat(metrics.acked()).isZero();
        assertThat(gateway.maxUnsettled()).isEqualTo(1);

        ArgumentCaptor<NotifyContext> captor = ArgumentCaptor.forClass(NotifyContext.class);
        verify(notifier).fire(captor.capture(), eq(Severity.ERROR));
        assertThat(captor.getValue().getType()).isEqualTo(NotifyEventType.RETRIES_EXHAUSTED);
        assertThat(captor.getValue().getRetryCount()).isEqualTo(3L);
        assertThat(captor.getValue().getReasonCode()).isEqualTo(Inspection.MAX_RETRIES_REACHED);
    }

    @Test
    void taskSucceedingOnSecondDeliveryIsAckedAfterOneRoundTrip() throws Exception {
        props.setMaxRetries(5);
        ScriptedHandler handler = ScriptedHandler.of(true, new RuntimeException("timeout"));
        publish("m-2");

        int deliveries = drain(consumer(handler));

        assertThat(deliveries).isEqualTo(2);
        assertThat(handler.seenRetries).containsExactly(0L, 1L);
        assertThat(gateway.events()).containsExactly("reject:1:false", "ack:2");
        assertThat(states).containsExactly(DeliveryState.REJECTED, DeliveryState.ACKED);
        assertThat(handler.callbacks).containsExactly("rejected", "success");
        assertThat(contexts.get(1).getDeathHistory().size()).isEqualTo(2);
        assertThat(metrics.acked()).isEqualTo(1);
        verify(notifier, never()).fire(any(), any());
    }

    @Test
    void firstAttemptSuccessIsAckedWithoutRetry() throws Exception {
        ScriptedHandler handler = ScriptedHandler.of(true);
        publish("m-3");

        assertThat(drain(consumer(handler))).isEqualTo(1);
        assertThat(gateway.events()).containsExactly("ack:1");
        assertThat(handler.payloads).containsExactly("hello");
        assertThat(contexts.get(0).getRetryCount()).isZero();
        assertThat(contexts.get(0).getMessageId()).isEqualTo("m-3");
        assertThat(handler.seenStates).containsExactly(DeliveryState.RECEIVED);
        assertThat(contexts.get(0).getState()).isEqualTo(DeliveryState.ACKED);
    }

    @Test
    void errorThrownByTaskIsSettledAsFailure() throws Exception {
        props.setMaxRetries(1);
        ScriptedHandler handler = ScriptedHandler.always(new AssertionError("task bug"));
        TaskConsumer c = consumer(handler);
        publish("m-18");
        Delivery d = next(c);

        c.process(gateway, d);

        assertThat(d.getHandle().isSettled()).isTrue();
        assertThat(gateway.events()).containsExactly("reject:1:false");
        assertThat(contexts.get(0).getFailureCategory()).isEqualTo(FailureCategory.UNKNOWN);
        assertThat(contexts.get(0).getErr()).contains("AssertionError").contains("task bug");

        assertThat(drain(c)).isEqualTo(1);
        assertThat(states).containsExactly(DeliveryState.REJECTED, DeliveryState.TERMINALLY_ACKED);
    }

    @Test
    void staleExplicitCounterCannotKeepMessageLooping() throws Exception {
        props.setMaxRetries(3);
        ScriptedHandler handler = ScriptedHandler.always(new RuntimeException("fail"));
        gateway.enqueue(TASK, TaskMessage.of("m-19", new byte[0], Map.of("x-retry-count", 0)));
        TaskConsumer c = consumer(handler);
        DeliveryStream stream = gateway.consume(TASK, props.getPrefetchCount());

        int deliveries = 0;
        Delivery d;
        while (deliveries < 50 && (d = stream.poll(Duration.ZERO)) != null) {
            c.process(gateway, d);
            deliveries++;
        }

        assertThat(deliveries).isEqualTo(2);
        assertThat(gateway.queued(TASK)).isZero();
        assertThat(gateway.events()).containsExactly("reject:1:false", "ack:2");
        assertThat(states).containsExactly(DeliveryState.REJECTED, DeliveryState.TERMINALLY_ACKED);
        ArgumentCaptor<NotifyContext> captor = ArgumentCaptor.forClass(NotifyContext.class);
        verify(notifier).fire(captor.capture(), eq(Severity.ERROR));
        assertThat(captor.getValue().getType()).isEqualTo(NotifyEventType.MALFORMED_DEATH_HISTORY);
        assertThat(captor.getValue().getReasonCode()).isEqualTo(Inspection.INCONSISTENT_COUNT);
    }

    @Test
    void malformedHistoryIsTerminallyAckedDespiteLowCount() throws Exception {
        props.setMaxRetries(5);
        ScriptedHandler handler = ScriptedHandler.always(new RuntimeException("fail"));
        gateway.enqueue(TASK, TaskMessage.of("m-4", new byte[0], Map.of("x-death", List.of("not-a-table"))));

        assertThat(drain(consumer(handler))).isEqualTo(1);

        assertThat(gateway.events()).containsExactly("ack:1");
        assertThat(states).containsExactly(DeliveryState.TERMINALLY_ACKED);
        assertThat(handler.callbacks).containsExactly("exhausted");
        ArgumentCaptor<NotifyContext> captor = ArgumentCaptor.forClass(NotifyContext.class);
        verify(notifier).fire(captor.capture(), eq(Severity.ERROR));
        assertThat(captor.getValue().getType()).isEqualTo(NotifyEventType.MALFORMED_DEATH_HISTORY);
        assertThat(captor.getValue().getReasonCode()).isEqualTo(Inspection.MALFORMED_HISTORY);
    }

    @Test
    void malformedHistoryDoesNotBlockASuccessfulTask() throws Exception {
        ScriptedHandler handler = ScriptedHandler.of(true);
        gateway.enqueue(TASK, TaskMessage.of("m-5", new byte[0], Map.of("x-death", "broken")));

        drain(consumer(handler));

        assertThat(states).containsExactly(DeliveryState.ACKED);
    }

    @Test
    void handlerReturningFalseIsAFailure() throws Exception {
        ScriptedHandler handler = ScriptedHandler.of(true, false);
        publish("m-6");

        drain(consumer(handler));

        assertThat(states).containsExactly(DeliveryState.REJECTED, DeliveryState.ACKED);
        assertThat(contexts.get(0).getFailureCategory()).isEqualTo(FailureCategory.HANDLER_FALSE);
        assertThat(contexts.get(0).getErr()).contains("handler returned false");
    }

    @Test
    void unreadablePayloadIsRetriedAsDeserializeFailure() throws Exception {
        props.setMaxRetries(1);
        JsonHandler handler = new JsonHandler();
        gateway.enqueue(TASK, TaskMessage.of("m-7", "{oops".getBytes(StandardCharsets.UTF_8), Map.of()));

        drain(consumer(handler));

        assertThat(handler.calls).isZero();
        assertThat(states).containsExactly(DeliveryState.REJECTED, DeliveryState.TERMINALLY_ACKED);
        assertThat(contexts).extracting(DeliveryContext::getFailureCategory)
                .containsOnly(FailureCategory.DESERIALIZE);
    }

    @Test
    void deliveryCannotBeSettledTwice() throws Exception {
        TaskConsumer c = consumer(ScriptedHandler.of(true));
        publish("m-8");
        Delivery d = next(c);

        c.process(gateway, d);

        assertThatThrownBy(() -> gateway.ack(d.getHandle())).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> gateway.reject(d.getHandle(), false)).isInstanceOf(IllegalStateException.class);
        assertThat(gateway.count("ack:")).isEqualTo(1);
    }

    @Test
    void lostSessionOnAckPropagatesAndLeavesDeliveryUnsettled() throws Exception {
        ScriptedHandler handler = ScriptedHandler.of(true);
        TaskConsumer c = consumer(handler);
        publish("m-9");
        Delivery d = next(c);
        gateway.failSettlement(true);

        assertThatThrownBy(() -> c.process(gateway, d)).isInstanceOf(BrokerConnectivityException.class);

        assertThat(d.getHandle().isSettled()).isFalse();
        assertThat(gateway.unsettled()).isEqualTo(1);
        assertThat(handler.callbacks).isEmpty();
        assertThat(states).isEmpty();
    }

    @Test
    void callbackFailureDoesNotUndoSettlement() throws Exception {
        ScriptedHandler handler = ScriptedHandler.of(true);
        handler.callbackFailure = new IllegalStateException("callback broken");
        publish("m-10");

        drain(consumer(handler));

        assertThat(gateway.events()).containsExactly("ack:1");
        assertThat(states).containsExactly(DeliveryState.ACKED);
    }

    @Test
    void interruptedTaskIsLeftUnsettled() throws Exception {
        ScriptedHandler handler = ScriptedHandler.of(new InterruptedException("shutdown"));
        TaskConsumer c = consumer(handler);
        publish("m-11");
        Delivery d = next(c);

        c.process(gateway, d);

        assertThat(Thread.interrupted()).isTrue();
        assertThat(d.getHandle().isSettled()).isFalse();
        assertThat(gateway.events()).isEmpty();
        assertThat(states).isEmpty();
    }

    @Test
    void exhaustedCopyIsForwardedBeforeAck() throws Exception {
        props.setMaxRetries(1);
        props.getQuarantine().setForwardExhausted(true);
        publish("m-12");

        drain(consumer(ScriptedHandler.always(new RuntimeException("fail"))));

        assertThat(gateway.events()).containsExactly("reject:1:false", "publish:dlx.quarantine:quarantine", "ack:2");
        FakeBrokerGateway.Published copy = gateway.published().get(0);
        assertThat(copy.getHeaders()).containsEntry(TerminalAckOutcomeHandler.EXHAUSTED_REASON_HEADER,
                Inspection.MAX_RETRIES_REACHED);
        assertThat(copy.getHeaders()).containsKey("x-death");
        assertThat(new String(copy.getPayload(), StandardCharsets.UTF_8)).isEqualTo("hello");
    }

    @Test
    void failedForwardKeepsMessageUnacked() throws Exception {
        props.setMaxRetries(0);
        props.getQuarantine().setForwardExhausted(true);
        gateway.enqueue(TASK, TaskMessage.of("m-13", new byte[0], Map.of("x-retry-count", 1,
                "x-death", List.of(Map.of("queue", TASK, "reason", "rejected", "count", 1L)))));
        TaskConsumer c = consumer(ScriptedHandler.always(new RuntimeException("fail")));
        Delivery d = next(c);
        gateway.failPublish(true);

        assertThatThrownBy(() -> c.process(gateway, d)).isInstanceOf(BrokerConnectivityException.class);

        assertThat(d.getHandle().isSettled()).isFalse();
        assertThat(gateway.events()).isEmpty();
    }

    @Test
    void stopFinishesCurrentDeliveryAndStopsPulling() throws Exception {
        ScriptedHandler handler = ScriptedHandler.of(true);
        TaskConsumer c = consumer(handler);
        handler.onSuccess = c::stop;
        publish("m-14");
        publish("m-15");

        c.run(gateway);

        assertThat(gateway.events()).containsExactly("ack:1");
        assertThat(gateway.queued(TASK)).isEqualTo(1);
        assertThat(c.isRunning()).isFalse();
    }

    @Test
    void pausedConsumerDoesNotPullUntilResumed() throws Exception {
        ScriptedHandler handler = ScriptedHandler.of(true);
        TaskConsumer c = consumer(handler);
        publish("m-16");
        c.pause();
        Thread t = new Thread(() -> {
            try {
                c.run(gateway);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        t.start();

        Thread.sleep(100);
        assertThat(gateway.deliveries()).isZero();
        assertThat(c.isPaused()).isTrue();

        c.resume();
        assertThat(c.isPaused()).isFalse();
        long deadline = System.currentTimeMillis() + 5000;
        while (states.isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        c.stop();
        t.join(5000);

        assertThat(t.isAlive()).isFalse();
        assertThat(gateway.events()).containsExactly("ack:1");
    }

    @Test
    void missingHandlerFailsFast() {
        ScriptedHandler other = ScriptedHandler.of(true);
        other.queue = "another";

        assertThatThrownBy(() -> consumer(other))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(TASK);
    }

    @Test
    void consumerThatLeavesDeliveryUnsettledIsStopped() {
        AbstractQueueConsumer lazy = new AbstractQueueConsumer("lazy", TASK, 1, Duration.ofMillis(10)) {
            @Override
            protected void process(BrokerGateway gw, Delivery delivery) {
            }

            @Override
            protected String tag() {
                return "Lazy";
            }
        };
        publish("m-17");

        assertThatThrownBy(() -> lazy.run(gateway))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("unsettled");
    }

    /**
     * 按脚本逐次返回结果, 脚本用完后重复最后一项
     * 脚本项为 Boolean, Exception 或 Error
     */
    static class ScriptedHandler implements TaskHandler<String> {

        private final Deque<Object> script;

        private final Object fallback;

        final List<Long> seenRetries = new ArrayList<>();

        final List<String> payloads = new ArrayList<>();

        final List<String> callbacks = new ArrayList<>();

        final List<DeliveryState> seenStates = new ArrayList<>();

        String queue = TASK;

        RuntimeException callbackFailure;

        Runnable onSuccess;

        private ScriptedHandler(Object fallback, Object... steps) {
            this.fallback = fallback;
            this.script = new ArrayDeque<>(Arrays.asList(steps));
        }

        /** 先按 steps 顺序执行, 之后一直返回 last */
        static ScriptedHandler of(Object last, Object... steps) {
            return new ScriptedHandler(last, steps);
        }

        static ScriptedHandler always(Object result) {
            return new ScriptedHandler(result);
        }

        @Override
        public boolean supports(String queue) {
            return this.queue.equals(queue);
        }

        @Override
        public boolean execute(DeliveryContext ctx, String payload) throws Exception {
            seenRetries.add(ctx.getRetryCount());
            seenStates.add(ctx.getState());
            payloads.add(payload);
            Object step = script.isEmpty() ? fallback : script.pollFirst();
            if (step instanceof Exception) {
                throw (Exception) step;
            }
            if (step instanceof Error) {
                throw (Error) step;
            }
            return (Boolean) step;
        }

        @Override
        public TypeReference<String> payloadType() {
            return new TypeReference<String>() {};
        }

        @Override
        public void onSuccess(DeliveryContext ctx) {
            callbacks.add("success");
            if (onSuccess != null) {
                onSuccess.run();
            }
            if (callbackFailure != null) {
                throw callbackFailure;
            }
        }

        @Override
        public void onRejected(DeliveryContext ctx) {
            callbacks.add("rejected");
        }

        @Override
        public void onExhausted(DeliveryContext ctx) {
            callbacks.add("exhausted");
        }
    }

    static class JsonHandler implements TaskHandler<Map<String, Object>> {

        int calls;

        @Override
        public boolean supports(String queue) {
            return true;
        }

        @Override
        public boolean execute(DeliveryContext ctx, Map<String, Object> payload) {
            calls++;
            return true;
        }

        @Override
        public TypeReference<Map<String, Object>> payloadType() {
            return new TypeReference<Map<String, Object>>() {};
        }
    }
}
