package com.dlxretry.core.rabbit;

import com.dlxretry.core.spi.BrokerConnector;
import com.dlxretry.core.spi.BrokerGateway;
import com.dlxretry.exception.BrokerConnectivityException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 所有会话共享一条 AMQP 连接, 每个会话一个 Channel
 * 连接断开后由下一次 open() 重建
 */
@Slf4j
public class RabbitBrokerConnector implements BrokerConnector, AutoCloseable {

    private final ConnectionFactory factory;

    private final String connectionName;

    /** 会话发布确认的等待上限 */
    private final Duration confirmTimeout;

    private final AtomicLong sessions = new AtomicLong();

    private Connection connection;

    public RabbitBrokerConnector(ConnectionFactory factory, String connectionName) {
        this(factory, connectionName, RabbitBrokerGateway.DEFAULT_CONFIRM_TIMEOUT);
    }

    public RabbitBrokerConnector(ConnectionFactory factory, String connectionName, Duration confirmTimeout) {
        this.factory = factory;
        this.connectionName = connectionName;
        this.confirmTimeout = confirmTimeout;
    }

    @Override
    public BrokerGateway open() {
        try {
            Channel channel = connection().createChannel();
            if (channel == null) {
                throw new BrokerConnectivityException("no channel available on connection " + connectionName);
            }
            String sessionId = connectionName + "#" + sessions.incrementAndGet() + "/ch" + channel.getChannelNumber();
            log.debug("[Rabbit] session {} opened", sessionId);
            return new RabbitBrokerGateway(channel, sessionId, confirmTimeout);
        } catch (IOException | TimeoutException | ShutdownSignalException e) {
            throw new BrokerConnectivityException("cannot open session on " + connectionName, e);
        }
    }

    private synchronized Connection connection() throws IOException, TimeoutException {
        if (connection == null || !connection.isOpen()) {
            connection = factory.newConnection(connectionName);
            log.info("[Rabbit] connection {} established to {}:{}", connectionName, factory.getHost(), factory.getPort());
        }
        return connection;
    }

    @Override
    public synchronized void close() {
        if (connection != null && connection.isOpen()) {
            try {
                connection.close();
            } catch (IOException e) {
                log.debug("[Rabbit] connection {} close failed: {}", connectionName, e.toString());
            }
        }
        connection = null;
    }
}
