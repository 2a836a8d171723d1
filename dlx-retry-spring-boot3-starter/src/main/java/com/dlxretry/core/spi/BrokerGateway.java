package com.dlxretry.core.spi;

import com.dlxretry.model.DeliveryHandle;
import com.dlxretry.model.TaskMessage;

import java.time.Duration;
import java.util.Map;

/**
 * broker 会话抽象
 * 一个实例对应一个通道, 只供一个消费者线程使用; 所有方法在连接不可用时抛 BrokerConnectivityException
 */
public interface BrokerGateway extends AutoCloseable {

    /** 会话标识, 写入 DeliveryHandle */
    String sessionId();

    boolean isOpen();

    /** 声明交换机, 已存在且参数一致时无副作用 */
    void declareExchange(String name, String type);

    /**
     * 声明队列
     * @param messageTtl           为空不设置 x-message-ttl
     * @param deadLetterExchange   为空不设置 x-dead-letter-exchange
     * @param deadLetterRoutingKey 为空不设置 x-dead-letter-routing-key
     */
    void declareQueue(String name, Duration messageTtl, String deadLetterExchange, String deadLetterRoutingKey);

    void bindQueue(String queue, String exchange, String routingKey);

    /** 开始消费, 最多 prefetch 条未确认投递 */
    DeliveryStream consume(String queue, int prefetch);

    /** 确认, 句柄只能结算一次 */
    void ack(DeliveryHandle handle);

    /** 拒绝, requeue=false 时由队列的死信配置路由 */
    void reject(DeliveryHandle handle, boolean requeue);

    void publish(String exchange, String routingKey, byte[] payload, Map<String, Object> headers);

    /** 转发一条已收到的消息, 保留消息标识 */
    default void publish(String exchange, String routingKey, TaskMessage message, Map<String, Object> headers) {
        publish(exchange, routingKey, message.getPayload(), headers);
    }

    @Override
    void close();
}
