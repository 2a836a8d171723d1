package com.dlxretry.core.topology;

import com.dlxretry.config.DlxRetryProperties;
import com.dlxretry.core.spi.BrokerGateway;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 声明死信回流拓扑：
 * task_queue --reject--> dlx --> dl(TTL) --expire--> amq.direct --> task_queue
 * 以及可选的隔离队列。每次建立会话时执行, 声明是幂等的
 */
@Slf4j
public class TopologyInitializer {

    /** broker 预置交换机, 不允许重新声明 */
    private static final String RESERVED_PREFIX = "amq.";

    private static final String DIRECT = "direct";

    private final DlxRetryProperties props;

    public TopologyInitializer(DlxRetryProperties props) {
        this.props = props;
    }

    public void declare(BrokerGateway gateway) {
        DlxRetryProperties.Queue task = props.getTaskQueue();
        DlxRetryProperties.RetryQueue retry = props.getRetryQueue();
        DlxRetryProperties.Quarantine quarantine = props.getQuarantine();

        Set<String> exchanges = new LinkedHashSet<>();
        exchanges.add(task.getExchange());
        exchanges.add(task.getDeadLetterExchange());
        if (retry.isEnabled()) {
            exchanges.add(retry.getExchange());
            exchanges.add(retry.getDeadLetterExchange());
        }
        if (quarantine.isEnabled() || quarantine.isForwardExhausted()) {
            exchanges.add(quarantine.getExchange());
        }
        for (String ex : exchanges) {
            if (ex != null && !ex.isBlank() && !ex.startsWith(RESERVED_PREFIX)) {
                gateway.declareExchange(ex, DIRECT);
            }
        }

        declareAndBind(gateway, task);
        if (retry.isEnabled()) {
            declareAndBind(gateway, retry);
        }
        if (quarantine.isEnabled() || quarantine.isForwardExhausted()) {
            gateway.declareQueue(quarantine.getQueue(), null, null, null);
            gateway.bindQueue(quarantine.getQueue(), quarantine.getExchange(), quarantine.getRoutingKey());
        }
        log.info("[Topology] declared task={}, retry={}, quarantine={} on session={}",
                task.getName(), retry.isEnabled() ? retry.getName() : "-",
                quarantine.isEnabled() || quarantine.isForwardExhausted() ? quarantine.getQueue() : "-",
                gateway.sessionId());
    }

    private static void declareAndBind(BrokerGateway gateway, DlxRetryProperties.Queue q) {
        gateway.declareQueue(q.getName(), q.getMessageTtl(), q.getDeadLetterExchange(), q.getDeadLetterRoutingKey());
        // 默认交换机（空名）自动按队列名路由, 无需绑定
        if (q.getExchange() != null && !q.getExchange().isEmpty()) {
            gateway.bindQueue(q.getName(), q.getExchange(), q.resolvedRoutingKey());
        }
    }
}
