package com.dlxretry.core.spi;

/**
 * 打开新的 broker 会话, 重连即重新 open
 */
@FunctionalInterface
public interface BrokerConnector {

    BrokerGateway open();
}
