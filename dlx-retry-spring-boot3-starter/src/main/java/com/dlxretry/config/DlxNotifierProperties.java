package com.dlxretry.config;

import com.dlxretry.model.enums.NotifyEventType;
import com.dlxretry.model.enums.Severity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * dlx-retry:
 *   notify:
 *     enabled: true
 *     max-attempts: 3
 *     muted: [CONNECTIVITY_LOST]
 *     logging:
 *       min-severity: WARNING
 *     rate-limit:
 *       window: 30s
 *       threshold: 50
 */
@Data
@ConfigurationProperties(prefix = "dlx-retry.notify")
public class DlxNotifierProperties {

    /** 关闭时所有事件只在消费日志中出现 */
    private boolean enabled = false;

    /** 单个通道派发失败后的最大尝试次数 */
    private int maxAttempts = 3;

    /** 不派发的事件类型 */
    private Set<NotifyEventType> muted = EnumSet.noneOf(NotifyEventType.class);

    private Logging logging = new Logging();

    private Async async = new Async();

    private RateLimit rateLimit = new RateLimit();

    @Data
    public static class Logging {
        private boolean enabled = true;

        private Severity minSeverity = Severity.INFO;

        private int maxErrorLength = 2000;
    }

    /**
     * 派发线程池, 满了直接丢弃
     */
    @Data
    public static class Async {
        private int corePoolSize = 2;

        private int maxPoolSize = 4;

        private int queueCapacity = 1000;

        private Duration keepAlive = Duration.ofSeconds(60);
    }

    /**
     * 同一 (事件类型, 队列, 级别) 在窗口内最多放行 threshold 条
     */
    @Data
    public static class RateLimit {
        private Duration window = Duration.ofSeconds(30);

        private int threshold = 50;
    }
}
