package com.dlxretry.core;

import com.dlxretry.config.DlxNotifierProperties;
import com.dlxretry.config.DlxRetryProperties;
import com.dlxretry.core.consumer.ConsumerSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.atomic.AtomicBoolean;

public class ConsumerLifecycle implements SmartLifecycle {

    Logger log = LoggerFactory.getLogger(ConsumerLifecycle.class);

    private final ConsumerSupervisor supervisor;

    private final DlxRetryProperties props;

    private final DlxNotifierProperties notifyProps;

    /** false 时需手动 start */
    private final boolean autoStartup;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public ConsumerLifecycle(ConsumerSupervisor supervisor, DlxRetryProperties props,
                             DlxNotifierProperties notifyProps) {
        this(supervisor, props, notifyProps, true);
    }

    public ConsumerLifecycle(ConsumerSupervisor supervisor, DlxRetryProperties props,
                             DlxNotifierProperties notifyProps, boolean autoStartup) {
        this.supervisor = supervisor;
        this.props = props;
        this.notifyProps = notifyProps;
        this.autoStartup = autoStartup;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        // 打印关键启动信息（一次性）
        try {
            log.info("┌────────────────────────────────────────────────────────────┐");
            log.info("│ DLX retry consumers starting...");
            log.info("├────────────────────────────────────────────────────────────┤");
            log.info("│ task.queue          : {}", props.getTaskQueue().getName());
            log.info("│ max.retries         : {}", props.getMaxRetries());
            log.info("│ prefetch            : {}", props.getPrefetchCount());
            log.info("│ concurrency         : {}", props.getConcurrency());
            log.info("│ retry.count.header  : {}", props.getRetryCountHeader());
            if (props.getRetryQueue().isEnabled()) {
                log.info("│ retry.queue         : {} (ttl={})", props.getRetryQueue().getName(),
                        props.getRetryQueue().getMessageTtl());
            }
            log.info("│ quarantine.observe  : {}", props.getQuarantine().isEnabled());
            log.info("│ quarantine.forward  : {}", props.getQuarantine().isForwardExhausted());
            log.info("│ topology.declare    : {}", props.getTopology().isAutoDeclare());
            log.info("│ reconnect.strategy  : {}", props.getReconnect().getStrategy());
            log.info("│ history.enabled     : {}", props.getHistory().isEnabled());
            log.info("│ notifier.enabled    : {}", notifyProps.isEnabled());
            log.info("└────────────────────────────────────────────────────────────┘");
        } catch (Throwable t) {
            // 启动日志打印本身不应阻断启动
            log.warn("[Dlx-Retry] failed to render startup banner: {}", t.toString());
        }
        supervisor.start();
        log.info("[Dlx-Retry] started");
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[Dlx-Retry] stop skipped: already stopped");
            return;
        }
        log.info("[Dlx-Retry] stopping...");
        try {
            supervisor.stop(props.getShutdown().getAwait().toMillis());
        } finally {
            log.info("[Dlx-Retry] stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override public boolean isAutoStartup() { return autoStartup; }
}
