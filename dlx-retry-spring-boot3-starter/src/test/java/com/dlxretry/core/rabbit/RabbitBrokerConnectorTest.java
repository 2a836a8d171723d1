package com.dlxretry.core.rabbit;

import com.dlxretry.core.spi.BrokerGateway;
import com.dlxretry.exception.BrokerConnectivityException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RabbitBrokerConnectorTest {

    private final ConnectionFactory factory = mock(ConnectionFactory.class);

    private final Connection connection = mock(Connection.class);

    @Test
    void sharesOneConnectionAcrossSessions() throws Exception {
        Channel c1 = mock(Channel.class);
        Channel c2 = mock(Channel.class);
        when(c1.getChannelNumber()).thenReturn(1);
        when(c2.getChannelNumber()).thenReturn(2);
        when(factory.newConnection("orders")).thenReturn(connection);
        when(connection.isOpen()).thenReturn(true);
        when(connection.createChannel()).thenReturn(c1, c2);
        RabbitBrokerConnector connector = new RabbitBrokerConnector(factory, "orders");

        BrokerGateway g1 = connector.open();
        BrokerGateway g2 = connector.open();

        assertThat(g1.sessionId()).isEqualTo("orders#1/ch1");
        assertThat(g2.sessionId()).isEqualTo("orders#2/ch2");
        verify(factory, times(1)).newConnection("orders");
    }

    @Test
    void unreachableBrokerIsConnectivityError() throws Exception {
        when(factory.newConnection("orders")).thenThrow(new ConnectException("refused"));

        assertThatThrownBy(() -> new RabbitBrokerConnector(factory, "orders").open())
                .isInstanceOf(BrokerConnectivityException.class)
                .hasCauseInstanceOf(ConnectException.class);
    }

    @Test
    void exhaustedChannelsAreConnectivityError() throws Exception {
        when(factory.newConnection("orders")).thenReturn(connection);
        when(connection.isOpen()).thenReturn(true);
        when(connection.createChannel()).thenReturn(null);

        assertThatThrownBy(() -> new RabbitBrokerConnector(factory, "orders").open())
                .isInstanceOf(BrokerConnectivityException.class)
                .hasMessageContaining("no channel");
    }

    @Test
    void closedConnectionIsRebuilt() throws Exception {
        Connection second = mock(Connection.class);
        when(factory.newConnection("orders")).thenReturn(connection, second);
        when(connection.isOpen()).thenReturn(false);
        when(connection.createChannel()).thenReturn(mock(Channel.class));
        when(second.createChannel()).thenReturn(mock(Channel.class));
        RabbitBrokerConnector connector = new RabbitBrokerConnector(factory, "orders");

        connector.open();
        connector.open();

        verify(factory, times(2)).newConnection("orders");
        verify(second).createChannel();
    }
}
