package com.dlxretry.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 死信回流重试消费配置（绑定前缀：dlx-retry）
 *
 * YAML 示例：
 * dlx-retry:
 *   max-retries: 5
 *   prefetch-count: 1
 *   concurrency: 1
 *   poll-timeout: 1s
 *   retry-count-header: x-retry-count
 *   task-queue:
 *     name: task_queue
 *     exchange: amq.direct
 *     dead-letter-exchange: dlx
 *     dead-letter-routing-key: dl
 *   retry-queue:
 *     enabled: true
 *     name: dl
 *     exchange: dlx
 *     routing-key: dl
 *     message-ttl: 1s
 *     dead-letter-exchange: amq.direct
 *     dead-letter-routing-key: task_queue
 *   quarantine:
 *     enabled: false
 *     queue: quarantine
 *     exchange: dlx.quarantine
 *     routing-key: quarantine
 *     forward-exhausted: false
 *     confirm-timeout: 5s
 *   topology:
 *     auto-declare: false
 *   reconnect:
 *     strategy: exponential
 *     base: 1s
 *     min: 500ms
 *     max: 60s
 *     jitter-ratio: 0.2
 *   wheel:
 *     tick-duration: 100ms
 *     ticks-per-wheel: 512
 *   shutdown:
 *     await: 30s
 *   history:
 *     enabled: false
 *   command:
 *     enabled: false
 *     timeout: 10m
 */
@Validated
@ConfigurationProperties(prefix = "dlx-retry")
public class DlxRetryProperties {

    /** 最大重试次数, 部署期内固定 */
    private int maxRetries = 5;

    /** 每个消费者最多持有的未确认投递数 */
    private int prefetchCount = 1;

    /** 主队列消费者实例数, 每个实例独占一个通道 */
    private int concurrency = 1;

    /** 单次拉取等待时长, 决定停机响应速度 */
    private Duration pollTimeout = Duration.ofSeconds(1);

    /** 显式重试计数头 */
    private String retryCountHeader = "x-retry-count";

    private Queue taskQueue = Queue.task();

    private RetryQueue retryQueue = RetryQueue.parking();

    private Quarantine quarantine = new Quarantine();

    private Topology topology = new Topology();

    private Backoff reconnect = new Backoff();

    private Wheel wheel = new Wheel();

    private Shutdown shutdown = new Shutdown();

    private History history = new History();

    private Exec command = new Exec();

    // ----------------- 嵌套配置对象 -----------------

    public static class Queue {
        private String name;

        /** 发布到本队列的交换机 */
        private String exchange;

        /** 绑定键, 为空时取队列名 */
        private String routingKey;

        /** x-message-ttl, 为空不设置 */
        private Duration messageTtl;

        /** x-dead-letter-exchange */
        private String deadLetterExchange;

        /** x-dead-letter-routing-key */
        private String deadLetterRoutingKey;

        static Queue task() {
            Queue q = new Queue();
            q.setName("task_queue");
            q.setExchange("amq.direct");
            q.setDeadLetterExchange("dlx");
            q.setDeadLetterRoutingKey("dl");
            return q;
        }

        public String resolvedRoutingKey() {
            return routingKey == null || routingKey.isBlank() ? name : routingKey;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getExchange() { return exchange; }
        public void setExchange(String exchange) { this.exchange = exchange; }
        public String getRoutingKey() { return routingKey; }
        public void setRoutingKey(String routingKey) { this.routingKey = routingKey; }
        public Duration getMessageTtl() { return messageTtl; }
        public void setMessageTtl(Duration messageTtl) { this.messageTtl = messageTtl; }
        public String getDeadLetterExchange() { return deadLetterExchange; }
        public void setDeadLetterExchange(String deadLetterExchange) { this.deadLetterExchange = deadLetterExchange; }
        public String getDeadLetterRoutingKey() { return deadLetterRoutingKey; }
        public void setDeadLetterRoutingKey(String deadLetterRoutingKey) { this.deadLetterRoutingKey = deadLetterRoutingKey; }
    }

    /**
     * 等待队列：主队列 reject 的消息在此过期后经死信交换机回流主队列
     */
    public static class RetryQueue extends Queue {
        private boolean enabled = true;

        static RetryQueue parking() {
            RetryQueue q = new RetryQueue();
            q.setName("dl");
            q.setExchange("dlx");
            q.setRoutingKey("dl");
            q.setMessageTtl(Duration.ofSeconds(1));
            q.setDeadLetterExchange("amq.direct");
            q.setDeadLetterRoutingKey("task_queue");
            return q;
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class Quarantine {
        /** 是否启动隔离队列观察者 */
        private boolean enabled = false;

        private String queue = "quarantine";

        private String exchange = "dlx.quarantine";

        private String routingKey = "quarantine";

        /** 重试耗尽时先转发一份到隔离交换机再ack */
        private boolean forwardExhausted = false;

        /** 转发副本等待 broker 确认的时长, 超时则原消息不 ack */
        private Duration confirmTimeout = Duration.ofSeconds(5);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getQueue() { return queue; }
        public void setQueue(String queue) { this.queue = queue; }
        public String getExchange() { return exchange; }
        public void setExchange(String exchange) { this.exchange = exchange; }
        public String getRoutingKey() { return routingKey; }
        public void setRoutingKey(String routingKey) { this.routingKey = routingKey; }
        public boolean isForwardExhausted() { return forwardExhausted; }
        public void setForwardExhausted(boolean forwardExhausted) { this.forwardExhausted = forwardExhausted; }
        public Duration getConfirmTimeout() { return confirmTimeout; }
        public void setConfirmTimeout(Duration confirmTimeout) { this.confirmTimeout = confirmTimeout; }
    }

    public static class Topology {
        /** 会话建立时声明交换机/队列/绑定 */
        private boolean autoDeclare = false;

        public boolean isAutoDeclare() { return autoDeclare; }
        public void setAutoDeclare(boolean autoDeclare) { this.autoDeclare = autoDeclare; }
    }

    public static class Backoff {
        /** 策略：fixed | exponential | spi:{name} */
        private String strategy = "exponential";

        /** 基础间隔（指数退避的 base）：如 1s */
        private Duration base = Duration.ofSeconds(1);

        /** 最小间隔 */
        private Duration min = Duration.ofMillis(500);

        /** 最大间隔 */
        private Duration max = Duration.ofSeconds(60);

        /** 抖动比例（0~1），例如 0.2 表示 ±20% */
        private double jitterRatio = 0.2;

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
        public Duration getBase() { return base; }
        public void setBase(Duration base) { this.base = base; }
        public Duration getMin() { return min; }
        public void setMin(Duration min) { this.min = min; }
        public Duration getMax() { return max; }
        public void setMax(Duration max) { this.max = max; }
        public double getJitterRatio() { return jitterRatio; }
        public void setJitterRatio(double jitterRatio) { this.jitterRatio = jitterRatio; }
    }

    public static class Wheel {
        /** 时间轮刻度 */
        private Duration tickDuration = Duration.ofMillis(100);

        /** 槽位数量（2^n 较佳） */
        private int ticksPerWheel = 512;

        public Duration getTickDuration() { return tickDuration; }
        public void setTickDuration(Duration tickDuration) { this.tickDuration = tickDuration; }
        public int getTicksPerWheel() { return ticksPerWheel; }
        public void setTicksPerWheel(int ticksPerWheel) { this.ticksPerWheel = ticksPerWheel; }
    }

    public static class Shutdown {
        /** 优雅停机等待在途投递的时长 */
        private Duration await = Duration.ofSeconds(30);

        public Duration getAwait() { return await; }
        public void setAwait(Duration await) { this.await = await; }
    }

    public static class History {
        /** 投递结果落库（需要 DataSource + MyBatis-Plus） */
        private boolean enabled = false;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    /**
     * 内置命令任务：主队列消息体为 Command JSON, 作为子进程执行
     */
    public static class Exec {
        private boolean enabled = false;

        /** 单条命令最长执行时间 */
        private Duration timeout = Duration.ofMinutes(10);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    // ----------------- getters/setters 顶层 -----------------

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public int getPrefetchCount() { return prefetchCount; }
    public void setPrefetchCount(int prefetchCount) { this.prefetchCount = prefetchCount; }

    public int getConcurrency() { return concurrency; }
    public void setConcurrency(int concurrency) { this.concurrency = concurrency; }

    public Duration getPollTimeout() { return pollTimeout; }
    public void setPollTimeout(Duration pollTimeout) { this.pollTimeout = pollTimeout; }

    public String getRetryCountHeader() { return retryCountHeader; }
    public void setRetryCountHeader(String retryCountHeader) { this.retryCountHeader = retryCountHeader; }

    public Queue getTaskQueue() { return taskQueue; }
    public void setTaskQueue(Queue taskQueue) { this.taskQueue = taskQueue; }

    public RetryQueue getRetryQueue() { return retryQueue; }
    public void setRetryQueue(RetryQueue retryQueue) { this.retryQueue = retryQueue; }

    public Quarantine getQuarantine() { return quarantine; }
    public void setQuarantine(Quarantine quarantine) { this.quarantine = quarantine; }

    public Topology getTopology() { return topology; }
    public void setTopology(Topology topology) { this.topology = topology; }

    public Backoff getReconnect() { return reconnect; }
    public void setReconnect(Backoff reconnect) { this.reconnect = reconnect; }

    public Wheel getWheel() { return wheel; }
    public void setWheel(Wheel wheel) { this.wheel = wheel; }

    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }

    public History getHistory() { return history; }
    public void setHistory(History history) { this.history = history; }

    public Exec getCommand() { return command; }
    public void setCommand(Exec command) { this.command = command; }

    // ----------------- 便捷换算 -----------------

    /** 以毫秒返回刻度（供 HashedWheelTimer 使用） */
    public long wheelTickMillis() { return wheel.getTickDuration().toMillis(); }

    /** 退避：基础/最小/最大毫秒 */
    public long backoffBaseMillis() { return reconnect.getBase().toMillis(); }
    public long backoffMinMillis() { return reconnect.getMin().toMillis(); }
    public long backoffMaxMillis() { return reconnect.getMax().toMillis(); }

    /**
     * 启动期校验, 配置错误直接阻断容器启动
     */
    public void validate() {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("dlx-retry.max-retries must be >= 0");
        }
        if (prefetchCount < 1) {
            throw new IllegalArgumentException("dlx-retry.prefetch-count must be >= 1");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("dlx-retry.concurrency must be >= 1");
        }
        if (taskQueue == null || taskQueue.getName() == null || taskQueue.getName().isBlank()) {
            throw new IllegalArgumentException("dlx-retry.task-queue.name must not be blank");
        }
        if (backoffMaxMillis() < backoffMinMillis()) {
            throw new IllegalArgumentException("dlx-retry.reconnect.max must be >= dlx-retry.reconnect.min");
        }
    }
}
