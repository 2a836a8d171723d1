package com.dlxretry.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * dlx-retry:
 *   guard:
 *     enabled: true
 *     circuit-breaker:
 *       failure-rate-threshold: 60
 *       slow-call-duration-threshold: 5s
 *       sliding-window-size: 50
 *       wait-duration-in-open-state: 15s
 *     bulkhead:
 *       enabled: true
 *       max-concurrent-calls: 8
 *     rate-limiter:
 *       enabled: true
 *       limit-for-period: 100
 *       limit-refresh-period: 1s
 *     cb-per-queue:
 *       task_queue: { failure-rate-threshold: 30, wait-duration-in-open-state: 5s }
 */
@Data
@ConfigurationProperties(prefix = "dlx-retry.guard")
public class DlxGuardProperties {
    /** 开关, 关闭时任务直接执行 */
    private boolean enabled = false;

    /** 默认配置（可按队列覆盖） */
    private CbConfig circuitBreaker = new CbConfig();
    private BhConfig bulkhead = new BhConfig();
    private RlConfig rateLimiter = new RlConfig();

    /** 按队列名覆盖 */
    private Map<String, CbConfig> cbPerQueue;
    private Map<String, BhConfig> bhPerQueue;
    private Map<String, RlConfig> rlPerQueue;

    @Data
    public static class CbConfig {
        private boolean enabled = true;
        private float failureRateThreshold = 50f;
        private float slowCallRateThreshold = 100f;
        private Duration slowCallDurationThreshold = Duration.ofSeconds(5);
        private int slidingWindowSize = 100;
        private Duration waitDurationInOpenState = Duration.ofSeconds(10);
        private int permittedNumberOfCallsInHalfOpenState = 10;
    }

    @Data
    public static class BhConfig {
        private boolean enabled = false;
        private int maxConcurrentCalls = 16;
        // 0=非阻塞
        private Duration maxWaitDuration = Duration.ofMillis(0);
    }

    @Data
    public static class RlConfig {
        private boolean enabled = false;
        // 每个窗口许可数
        private int limitForPeriod = 200;
        private Duration limitRefreshPeriod = Duration.ofMillis(100);
        // 获取许可最大等待
        private Duration timeoutDuration = Duration.ofMillis(20);
    }
}
