package com.dlxretry.core.rabbit;

import com.dlxretry.core.spi.DeliveryStream;
import com.dlxretry.exception.BrokerConnectivityException;
import com.dlxretry.model.Delivery;
import com.dlxretry.model.DeliveryHandle;
import com.dlxretry.model.TaskMessage;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 把 broker 推送的投递缓冲起来, 供消费线程按需拉取
 * 缓冲上限等于 prefetch, broker 不会推送更多未确认消息
 */
@Slf4j
class RabbitDeliveryStream extends DefaultConsumer implements DeliveryStream {

    private final String queue;

    private final String sessionId;

    private final BlockingQueue<Delivery> buffer;

    private volatile String consumerTag;

    private volatile ShutdownSignalException shutdown;

    private volatile boolean cancelledByBroker;

    private volatile boolean closed;

    RabbitDeliveryStream(Channel channel, String queue, String sessionId, int prefetch) {
        super(channel);
        this.queue = queue;
        this.sessionId = sessionId;
        this.buffer = new LinkedBlockingQueue<>(Math.max(1, prefetch));
    }

    void start() throws IOException {
        this.consumerTag = getChannel().basicConsume(queue, false, this);
    }

    @Override
    public String queue() {
        return queue;
    }

    @Override
    public void handleDelivery(String tag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        TaskMessage message = new TaskMessage(
                properties == null ? null : properties.getMessageId(),
                body,
                RabbitHeaders.fromBroker(properties == null ? null : properties.getHeaders()),
                properties == null ? null : properties.getContentType());
        Delivery d = new Delivery(new DeliveryHandle(envelope.getDeliveryTag(), sessionId), message, queue,
                envelope.isRedeliver());
        if (closed || !buffer.offer(d)) {
            // 已取消或超出预取窗口, 放回队列头部
            requeue(envelope.getDeliveryTag());
        }
    }

    @Override
    public void handleShutdownSignal(String tag, ShutdownSignalException sig) {
        this.shutdown = sig;
    }

    @Override
    public void handleCancel(String tag) {
        // 队列被删除等原因, broker 主动取消
        this.cancelledByBroker = true;
    }

    @Override
    public Delivery poll(Duration timeout) throws InterruptedException {
        ensureAlive();
        Delivery d = buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (d == null) {
            ensureAlive();
        }
        return d;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        Channel ch = getChannel();
        if (consumerTag != null && ch.isOpen() && !cancelledByBroker) {
            try {
                ch.basicCancel(consumerTag);
            } catch (IOException | ShutdownSignalException e) {
                log.debug("[Rabbit] basicCancel {} on {} failed: {}", consumerTag, queue, e.toString());
            }
        }
        // 已缓冲但未处理的投递直接放回
        Delivery d;
        while ((d = buffer.poll()) != null) {
            requeue(d.getHandle().getDeliveryTag());
        }
    }

    private void ensureAlive() {
        if (shutdown != null) {
            throw new BrokerConnectivityException("channel closed on session " + sessionId + ": " + shutdown.getMessage(), shutdown);
        }
        if (cancelledByBroker) {
            throw new BrokerConnectivityException("consumer on " + queue + " cancelled by broker");
        }
    }

    private void requeue(long deliveryTag) {
        Channel ch = getChannel();
        if (!ch.isOpen()) {
            return;
        }
        try {
            ch.basicReject(deliveryTag, true);
        } catch (IOException | ShutdownSignalException e) {
            log.debug("[Rabbit] requeue {} on {} failed: {}", deliveryTag, queue, e.toString());
        }
    }
}
