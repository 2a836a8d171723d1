package com.dlxretry.core.spi;

import com.dlxretry.model.Delivery;

import java.time.Duration;

/**
 * 一次 consume 产生的投递流
 */
public interface DeliveryStream extends AutoCloseable {

    String queue();

    /**
     * 拉取下一条投递
     * @return 超时返回 null
     * @throws com.dlxretry.exception.BrokerConnectivityException 底层通道已关闭
     */
    Delivery poll(Duration timeout) throws InterruptedException;

    /** 取消消费, 未确认投递由 broker 重新投递 */
    @Override
    void close();
}
