package com.dlxretry.core.rabbit;

import com.dlxretry.core.spi.BrokerGateway;
import com.dlxretry.core.spi.DeliveryStream;
import com.dlxretry.exception.BrokerConnectivityException;
import com.dlxretry.model.DeliveryHandle;
import com.dlxretry.model.TaskMessage;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.MessageProperties;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 基于单个 AMQP Channel 的会话
 * 发布走 publisher confirm + mandatory, broker 确认并且可路由才算发布成功
 */
@Slf4j
public class RabbitBrokerGateway implements BrokerGateway {

    static final String ARG_TTL = "x-message-ttl";
    static final String ARG_DLX = "x-dead-letter-exchange";
    static final String ARG_DLK = "x-dead-letter-routing-key";

    static final Duration DEFAULT_CONFIRM_TIMEOUT = Duration.ofSeconds(5);

    private final Channel channel;

    private final String sessionId;

    private final Duration confirmTimeout;

    /** 首次发布时开启 confirm 模式 */
    private boolean confirming;

    /** 当前发布被 broker 退回时的原因 */
    private final AtomicReference<String> returned = new AtomicReference<>();

    public RabbitBrokerGateway(Channel channel, String sessionId) {
        this(channel, sessionId, DEFAULT_CONFIRM_TIMEOUT);
    }

    public RabbitBrokerGateway(Channel channel, String sessionId, Duration confirmTimeout) {
        this.channel = channel;
        this.sessionId = sessionId;
        this.confirmTimeout = confirmTimeout == null ? DEFAULT_CONFIRM_TIMEOUT : confirmTimeout;
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void declareExchange(String name, String type) {
        call("exchangeDeclare " + name, () -> channel.exchangeDeclare(name, type, true));
    }

    @Override
    public void declareQueue(String name, Duration messageTtl, String deadLetterExchange, String deadLetterRoutingKey) {
        Map<String, Object> args = new HashMap<>();
        if (messageTtl != null) {
            args.put(ARG_TTL, messageTtl.toMillis());
        }
        if (deadLetterExchange != null) {
            args.put(ARG_DLX, deadLetterExchange);
        }
        if (deadLetterRoutingKey != null) {
            args.put(ARG_DLK, deadLetterRoutingKey);
        }
        call("queueDeclare " + name, () -> channel.queueDeclare(name, true, false, false, args));
    }

    @Override
    public void bindQueue(String queue, String exchange, String routingKey) {
        call("queueBind " + queue + "->" + exchange, () -> channel.queueBind(queue, exchange, routingKey));
    }

    @Override
    public DeliveryStream consume(String queue, int prefetch) {
        RabbitDeliveryStream stream = new RabbitDeliveryStream(channel, queue, sessionId, prefetch);
        call("consume " + queue, () -> {
            channel.basicQos(prefetch);
            stream.start();
            return null;
        });
        return stream;
    }

    @Override
    public void ack(DeliveryHandle handle) {
        settle(handle, "ack", () -> channel.basicAck(handle.getDeliveryTag(), false));
    }

    @Override
    public void reject(DeliveryHandle handle, boolean requeue) {
        settle(handle, "reject", () -> channel.basicReject(handle.getDeliveryTag(), requeue));
    }

    @Override
    public void publish(String exchange, String routingKey, byte[] payload, Map<String, Object> headers) {
        AMQP.BasicProperties props = MessageProperties.PERSISTENT_BASIC.builder()
                .headers(RabbitHeaders.toBroker(headers))
                .build();
        confirmedPublish(exchange, routingKey, props, payload);
    }

    @Override
    public void publish(String exchange, String routingKey, TaskMessage message, Map<String, Object> headers) {
        AMQP.BasicProperties props = MessageProperties.PERSISTENT_BASIC.builder()
                .messageId(message.getMessageId())
                .contentType(message.getContentType())
                .headers(RabbitHeaders.toBroker(headers))
                .build();
        confirmedPublish(exchange, routingKey, props, message.getPayload());
    }

    @Override
    public void close() {
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.close();
        } catch (IOException | TimeoutException | ShutdownSignalException e) {
            log.debug("[Rabbit] session {} close failed: {}", sessionId, e.toString());
        }
    }

    /**
     * 发布并等待 broker 确认
     * nack / 超时 / 不可路由均抛 BrokerConnectivityException, 调用方不得继续 ack 原消息
     */
    private void confirmedPublish(String exchange, String routingKey, AMQP.BasicProperties props, byte[] body) {
        String op = "publish " + exchange + "/" + routingKey;
        call(op, () -> {
            if (!confirming) {
                channel.confirmSelect();
                channel.addReturnListener(r -> returned.set(r.getReplyCode() + " " + r.getReplyText()));
                confirming = true;
            }
            returned.set(null);
            channel.basicPublish(exchange, routingKey, true, props, body);
            return null;
        });

        boolean acked;
        try {
            acked = channel.waitForConfirms(confirmTimeout.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new BrokerConnectivityException(op + " interrupted awaiting confirm on session " + sessionId, ie);
        } catch (TimeoutException | ShutdownSignalException e) {
            throw new BrokerConnectivityException(op + " not confirmed within " + confirmTimeout
                    + " on session " + sessionId, e);
        }
        if (!acked) {
            throw new BrokerConnectivityException(op + " nacked by broker on session " + sessionId);
        }
        // basic.return 先于 basic.ack 到达
        String reply = returned.getAndSet(null);
        if (reply != null) {
            throw new BrokerConnectivityException(op + " unroutable (" + reply + ") on session " + sessionId);
        }
    }

    private void settle(DeliveryHandle handle, String op, IoAction action) {
        if (!sessionId.equals(handle.getSessionId())) {
            throw new IllegalStateException(op + " of " + handle + " on foreign session " + sessionId);
        }
        handle.claim();
        try {
            action.run();
        } catch (IOException | ShutdownSignalException e) {
            handle.release();
            throw new BrokerConnectivityException(op + " failed on session " + sessionId, e);
        }
    }

    private <T> T call(String op, IoCall<T> call) {
        try {
            return call.call();
        } catch (IOException | ShutdownSignalException e) {
            throw new BrokerConnectivityException(op + " failed on session " + sessionId, e);
        }
    }

    @FunctionalInterface
    private interface IoCall<T> {
        T call() throws IOException;
    }

    @FunctionalInterface
    private interface IoAction {
        void run() throws IOException;
    }
}
