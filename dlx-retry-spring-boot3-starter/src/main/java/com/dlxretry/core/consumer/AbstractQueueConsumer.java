package com.dlxretry.core.consumer;

import com.dlxretry.core.spi.BrokerGateway;
import com.dlxretry.core.spi.DeliveryStream;
import com.dlxretry.model.Delivery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 单队列拉取循环
 * 一个实例同一时刻只在一个线程、一个会话上运行; 会话断开后由 supervisor 用新会话再次调用 run
 */
public abstract class AbstractQueueConsumer {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final String consumerId;

    protected final String queue;

    protected final int prefetch;

    protected final Duration pollTimeout;

    private volatile boolean running = true;

    private volatile boolean paused = false;

    private final Object pauseLock = new Object();

    protected AbstractQueueConsumer(String consumerId, String queue, int prefetch, Duration pollTimeout) {
        if (prefetch < 1) {
            throw new IllegalArgumentException("prefetch must be >= 1, got " + prefetch);
        }
        this.consumerId = consumerId;
        this.queue = queue;
        this.prefetch = prefetch;
        this.pollTimeout = pollTimeout;
    }

    /**
     * 在给定会话上消费, 直到 stop() 后返回
     * @throws com.dlxretry.exception.BrokerConnectivityException 会话不可用
     * @throws InterruptedException 停机中断, 在途投递保持未确认
     */
    public void run(BrokerGateway gateway) throws InterruptedException {
        DeliveryStream stream = null;
        try {
            while (running) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("consumer " + consumerId + " interrupted");
                }
                if (paused) {
                    if (stream != null) {
                        stream.close();
                        stream = null;
                        log.info("[{}] consumer={} paused, queue={}", tag(), consumerId, queue);
                    }
                    awaitResume();
                    continue;
                }
                if (stream == null) {
                    stream = gateway.consume(queue, prefetch);
                    log.info("[{}] consumer={} consuming queue={}, prefetch={}, session={}",
                            tag(), consumerId, queue, prefetch, gateway.sessionId());
                }
                Delivery delivery = stream.poll(pollTimeout);
                if (delivery == null) {
                    continue;
                }
                process(gateway, delivery);
                if (!delivery.getHandle().isSettled() && !Thread.currentThread().isInterrupted()) {
                    throw new IllegalStateException("delivery left unsettled by " + consumerId + ": " + delivery);
                }
            }
        } finally {
            if (stream != null) {
                closeQuietly(stream);
            }
        }
    }

    /**
     * 处理一条投递, 返回前必须 ack 或 reject 恰好一次
     */
    protected abstract void process(BrokerGateway gateway, Delivery delivery);

    /** 日志标签 */
    protected abstract String tag();

    /** 处理完在途投递后退出 run */
    public void stop() {
        running = false;
        synchronized (pauseLock) {
            pauseLock.notifyAll();
        }
    }

    /** 取消消费, 保留会话 */
    public void pause() {
        paused = true;
    }

    public void resume() {
        paused = false;
        synchronized (pauseLock) {
            pauseLock.notifyAll();
        }
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isPaused() {
        return paused;
    }

    public String getConsumerId() {
        return consumerId;
    }

    public String getQueue() {
        return queue;
    }

    private void awaitResume() throws InterruptedException {
        synchronized (pauseLock) {
            if (paused && running) {
                pauseLock.wait(Math.max(1, pollTimeout.toMillis()));
            }
        }
    }

    private void closeQuietly(DeliveryStream stream) {
        try {
            stream.close();
        } catch (RuntimeException e) {
            log.debug("[{}] consumer={} stream close failed: {}", tag(), consumerId, e.toString());
        }
    }
}
