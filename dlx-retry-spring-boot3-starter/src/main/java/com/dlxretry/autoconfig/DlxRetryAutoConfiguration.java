package com.dlxretry.autoconfig;

import com.dlxretry.annotation.EnableDlxRetry;
import com.dlxretry.config.DlxNotifierProperties;
import com.dlxretry.config.DlxRetryProperties;
import com.dlxretry.core.ConsumerLifecycle;
import com.dlxretry.core.backoff.BackoffRegistry;
import com.dlxretry.core.consumer.AbstractQueueConsumer;
import com.dlxretry.core.consumer.ConsumerSupervisor;
import com.dlxretry.core.consumer.DeadLetterObserver;
import com.dlxretry.core.consumer.TaskConsumer;
import com.dlxretry.core.handler.GuardedTaskExecutor;
import com.dlxretry.core.inspect.DeathHistoryInspector;
import com.dlxretry.core.inspect.DeathHistoryReader;
import com.dlxretry.core.metric.DlxRetryMetrics;
import com.dlxretry.core.notify.NotifyingFacade;
import com.dlxretry.core.outcome.OutcomeHandlerFactory;
import com.dlxretry.core.rabbit.RabbitBrokerConnector;
import com.dlxretry.core.serializer.JacksonPayloadSerializer;
import com.dlxretry.core.spi.BackoffPolicy;
import com.dlxretry.core.spi.BrokerConnector;
import com.dlxretry.core.spi.DeliveryHistoryRecorder;
import com.dlxretry.core.spi.PayloadSerializer;
import com.dlxretry.core.spi.TaskHandler;
import com.dlxretry.core.spi.outcome.OutcomeDecider;
import com.dlxretry.core.topology.TopologyInitializer;
import com.dlxretry.model.RetryPolicy;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 死信回流消费组件: 死信检查、消费者、托管与生命周期
 */
@AutoConfiguration(after = {
        RabbitAutoConfiguration.class,
        DlxRetryMetricsAutoConfiguration.class,
        DlxNotifierAutoConfiguration.class,
        DlxGuardAutoConfiguration.class,
        OutcomeHandlerAutoConfiguration.class
}, afterName = "com.dlxretry.autoconfig.DlxRetryMybatisAutoConfiguration")
@EnableConfigurationProperties({
        DlxRetryProperties.class,
        DlxNotifierProperties.class
})
public class DlxRetryAutoConfiguration {

    /**
     * 重试上限, 启动期校验全部配置
     */
    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy dlxRetryPolicy(DlxRetryProperties props) {
        props.validate();
        return RetryPolicy.of(props.getMaxRetries());
    }

    @Bean
    @ConditionalOnMissingBean
    public DeathHistoryReader deathHistoryReader(DlxRetryProperties props) {
        return new DeathHistoryReader(props.getRetryCountHeader());
    }

    @Bean
    @ConditionalOnMissingBean
    public DeathHistoryInspector deathHistoryInspector(RetryPolicy policy,
                                                       DeathHistoryReader reader,
                                                       DlxRetryProperties props) {
        return new DeathHistoryInspector(policy, reader, props.getTaskQueue().getName());
    }

    @Bean
    @ConditionalOnMissingBean
    public BackoffRegistry backoffRegistry(DlxRetryProperties props, ObjectProvider<BackoffPolicy> policies) {
        return new BackoffRegistry(props, policies.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean
    public PayloadSerializer payloadSerializer() {
        return new JacksonPayloadSerializer();
    }

    @Bean
    @ConditionalOnMissingBean
    public DeliveryHistoryRecorder deliveryHistoryRecorder() {
        return DeliveryHistoryRecorder.NOOP;
    }

    /**
     * 重连时间轮
     */
    @Bean
    @ConditionalOnMissingBean(name = "dlxReconnectTimer")
    public HashedWheelTimer dlxReconnectTimer(DlxRetryProperties props) {
        return new HashedWheelTimer(
                new NamedThreadFactory("dlx-reconnect-timer"),
                props.wheelTickMillis(),
                TimeUnit.MILLISECONDS,
                props.getWheel().getTicksPerWheel(),
                false
        );
    }

    @Bean
    @ConditionalOnProperty(prefix = "dlx-retry.topology", name = "auto-declare", havingValue = "true")
    @ConditionalOnMissingBean
    public TopologyInitializer topologyInitializer(DlxRetryProperties props) {
        return new TopologyInitializer(props);
    }

    /**
     * 消费者托管, 至少存在一个 TaskHandler 时才装配
     */
    @Bean
    @ConditionalOnBean(TaskHandler.class)
    @ConditionalOnMissingBean
    public ConsumerSupervisor consumerSupervisor(BrokerConnector connector,
                                                 ObjectProvider<TopologyInitializer> topology,
                                                 List<TaskHandler<?>> handlers,
                                                 PayloadSerializer serializer,
                                                 GuardedTaskExecutor executor,
                                                 DeathHistoryInspector inspector,
                                                 DeathHistoryReader reader,
                                                 OutcomeDecider decider,
                                                 OutcomeHandlerFactory outcomes,
                                                 NotifyingFacade notifier,
                                                 DlxRetryMetrics meter,
                                                 DeliveryHistoryRecorder history,
                                                 BackoffRegistry backoff,
                                                 HashedWheelTimer dlxReconnectTimer,
                                                 DlxRetryProperties props,
                                                 Environment env) {
        String app = env.getProperty("spring.application.name", "dlx-retry");
        List<AbstractQueueConsumer> consumers = new ArrayList<>();
        for (int i = 0; i < props.getConcurrency(); i++) {
            consumers.add(new TaskConsumer(app + "-task-" + i, props, handlers, serializer, executor,
                    inspector, decider, outcomes, notifier, meter, history));
        }
        if (props.getQuarantine().isEnabled()) {
            consumers.add(new DeadLetterObserver(app + "-dead-letter", props, reader, notifier, meter, history));
        }
        return new ConsumerSupervisor(connector, consumers, topology.getIfAvailable(), backoff,
                dlxReconnectTimer, notifier, meter);
    }

    @Bean
    @ConditionalOnBean(TaskHandler.class)
    @ConditionalOnMissingBean
    public ConsumerLifecycle consumerLifecycle(ConsumerSupervisor supervisor,
                                               DlxRetryProperties props,
                                               DlxNotifierProperties notifyProps,
                                               ListableBeanFactory beanFactory) {
        EnableDlxRetry enable = findEnableDlxRetry(beanFactory);
        return new ConsumerLifecycle(supervisor, props, notifyProps, enable == null || enable.value());
    }

    private EnableDlxRetry findEnableDlxRetry(ListableBeanFactory factory) {
        String[] names = factory.getBeanNamesForAnnotation(EnableDlxRetry.class);
        for (String n : names) {
            EnableDlxRetry an = factory.findAnnotationOnBean(n, EnableDlxRetry.class);
            if (an != null) return an;
        }
        return null;
    }

    /**
     * 复用 Spring AMQP 的连接参数
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(CachingConnectionFactory.class)
    static class RabbitConnectorConfiguration {

        @Bean
        @ConditionalOnBean(CachingConnectionFactory.class)
        @ConditionalOnMissingBean(BrokerConnector.class)
        public RabbitBrokerConnector rabbitBrokerConnector(CachingConnectionFactory cf, DlxRetryProperties props,
                                                           Environment env) {
            String app = env.getProperty("spring.application.name", "dlx-retry");
            return new RabbitBrokerConnector(cf.getRabbitConnectionFactory(), app + "-dlx-consumer",
                    props.getQuarantine().getConfirmTimeout());
        }
    }
}
