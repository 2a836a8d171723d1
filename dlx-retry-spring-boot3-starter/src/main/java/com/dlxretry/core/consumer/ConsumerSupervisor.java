package com.dlxretry.core.consumer;

import com.dlxretry.core.backoff.BackoffRegistry;
import com.dlxretry.core.metric.DlxRetryMetrics;
import com.dlxretry.core.notify.NotifyContexts;
import com.dlxretry.core.notify.NotifyingFacade;
import com.dlxretry.core.spi.BrokerConnector;
import com.dlxretry.core.spi.BrokerGateway;
import com.dlxretry.core.topology.TopologyInitializer;
import com.dlxretry.exception.BrokerConnectivityException;
import com.dlxretry.model.enums.Severity;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 消费者托管
 * 每个消费者独占一个线程与一个会话; 会话异常后关闭会话, 按退避策略在时间轮上安排重连
 */
public class ConsumerSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ConsumerSupervisor.class);

    private final BrokerConnector connector;

    private final List<AbstractQueueConsumer> consumers;

    /** 为空则不声明拓扑 */
    private final TopologyInitializer topology;

    private final BackoffRegistry backoff;

    /** 重连调度 */
    private final HashedWheelTimer timer;

    private final ExecutorService pool;

    private final NotifyingFacade notifier;

    private final DlxRetryMetrics meter;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private final Map<String, Slot> slots = new ConcurrentHashMap<>();

    public ConsumerSupervisor(BrokerConnector connector,
                              List<? extends AbstractQueueConsumer> consumers,
                              @Nullable TopologyInitializer topology,
                              BackoffRegistry backoff,
                              HashedWheelTimer timer,
                              NotifyingFacade notifier,
                              DlxRetryMetrics meter) {
        if (consumers == null || consumers.isEmpty()) {
            throw new IllegalArgumentException("at least one consumer is required");
        }
        this.connector = connector;
        this.consumers = new ArrayList<>(consumers);
        this.topology = topology;
        this.backoff = backoff;
        this.timer = timer;
        this.notifier = notifier;
        this.meter = meter;
        this.pool = Executors.newFixedThreadPool(consumers.size(), new NamedThreadFactory("dlx-consumer"));
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        for (AbstractQueueConsumer c : consumers) {
            Slot slot = new Slot(c);
            slots.put(c.getConsumerId(), slot);
            submit(slot);
        }
        log.info("[Supervisor] started {} consumer(s)", consumers.size());
    }

    /**
     * 停止消费者、时间轮, 等待在途投递处理完
     * 超时仍在运行的线程被中断, 其投递保持未确认由 broker 重新投递
     */
    public void stop(long awaitMillis) {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        consumers.forEach(AbstractQueueConsumer::stop);
        Set<Timeout> pending = timer.stop();
        for (Timeout t : pending) {
            if (t.task() instanceof ReconnectTask) {
                ReconnectTask r = (ReconnectTask) t.task();
                log.info("[Supervisor] consumer={} pending reconnect #{} dropped", r.getConsumerId(), r.getAttempt());
            }
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(Math.max(1, awaitMillis), TimeUnit.MILLISECONDS)) {
                pool.shutdownNow();
                log.warn("[Supervisor] consumer threads forced shutdown after {} ms", awaitMillis);
            }
        } catch (InterruptedException ie) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Supervisor] stopped");
    }

    /** 暂停主队列消费, 会话保留 */
    public void pause() {
        consumers.stream().filter(c -> c instanceof TaskConsumer).forEach(AbstractQueueConsumer::pause);
        log.info("[Supervisor] task consumers paused");
    }

    public void resume() {
        consumers.stream().filter(c -> c instanceof TaskConsumer).forEach(AbstractQueueConsumer::resume);
        log.info("[Supervisor] task consumers resumed");
    }

    public boolean isRunning() {
        return running.get();
    }

    /** 当前持有会话的消费者数 */
    public int connectedCount() {
        return (int) slots.values().stream().filter(s -> s.gateway != null).count();
    }

    /** 连续重连次数, 会话建立成功后清零 */
    public int reconnectAttempts(String consumerId) {
        Slot s = slots.get(consumerId);
        return s == null ? 0 : s.attempts.get();
    }

    private void submit(Slot slot) {
        if (!running.get()) {
            return;
        }
        try {
            pool.execute(() -> runSession(slot));
        } catch (RejectedExecutionException e) {
            log.debug("[Supervisor] consumer={} not resubmitted, pool closed", slot.consumer.getConsumerId());
        }
    }

    private void runSession(Slot slot) {
        AbstractQueueConsumer c = slot.consumer;
        BrokerGateway gateway = null;
        Throwable failure = null;
        try {
            gateway = connector.open();
            slot.gateway = gateway;
            if (topology != null) {
                topology.declare(gateway);
            }
            int prev = slot.attempts.getAndSet(0);
            if (prev > 0) {
                log.info("[Supervisor] consumer={} reconnected after {} attempt(s), session={}",
                        c.getConsumerId(), prev, gateway.sessionId());
            }
            c.run(gateway);
            log.info("[Supervisor] consumer={} finished", c.getConsumerId());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("[Supervisor] consumer={} interrupted", c.getConsumerId());
        } catch (BrokerConnectivityException e) {
            log.warn("[Supervisor] consumer={} lost broker session: {}", c.getConsumerId(), e.getMessage());
            notifier.fire(NotifyContexts.ctxForConnectivity(c.getConsumerId(), c.getQueue(),
                    gateway == null ? null : gateway.sessionId(), e), Severity.WARNING);
            failure = e;
        } catch (RuntimeException | Error e) {
            log.error("[Supervisor] consumer={} failed", c.getConsumerId(), e);
            notifier.fire(NotifyContexts.ctxForEngineError(c.getConsumerId(), c.getQueue(), e), Severity.ERROR);
            failure = e;
        } finally {
            slot.gateway = null;
            closeQuietly(gateway);
        }
        if (failure != null) {
            scheduleReconnect(slot);
        }
    }

    private void scheduleReconnect(Slot slot) {
        if (!running.get() || !slot.consumer.isRunning()) {
            return;
        }
        int attempt = slot.attempts.incrementAndGet();
        long delay = backoff.delayMillis(attempt);
        meter.incReconnect();
        try {
            timer.newTimeout(new ReconnectTask(slot.consumer.getConsumerId(), attempt, () -> submit(slot)),
                    delay, TimeUnit.MILLISECONDS);
            log.info("[Supervisor] consumer={} reconnect #{} in {} ms", slot.consumer.getConsumerId(), attempt, delay);
        } catch (IllegalStateException e) {
            // 时间轮已停止
            log.debug("[Supervisor] consumer={} reconnect skipped: {}", slot.consumer.getConsumerId(), e.getMessage());
        }
    }

    private static void closeQuietly(BrokerGateway gateway) {
        if (gateway == null) {
            return;
        }
        try {
            gateway.close();
        } catch (RuntimeException e) {
            log.debug("[Supervisor] session close failed: {}", e.toString());
        }
    }

    private static final class Slot {
        private final AbstractQueueConsumer consumer;
        private final AtomicInteger attempts = new AtomicInteger();
        private volatile BrokerGateway gateway;

        private Slot(AbstractQueueConsumer consumer) {
            this.consumer = consumer;
        }
    }
}
