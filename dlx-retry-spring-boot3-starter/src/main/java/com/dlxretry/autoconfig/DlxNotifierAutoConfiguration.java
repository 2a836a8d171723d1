package com.dlxretry.autoconfig;

import com.dlxretry.config.DlxNotifierProperties;
import com.dlxretry.core.metric.DlxRetryMetrics;
import com.dlxretry.core.notify.AsyncNotifyingService;
import com.dlxretry.core.notify.NotifyingFacade;
import com.dlxretry.core.notify.notifier.LoggingNotifier;
import com.dlxretry.core.notify.ratelimit.RateLimitFilter;
import com.dlxretry.core.notify.route.SimpleRouter;
import com.dlxretry.core.spi.notify.Notifier;
import com.dlxretry.core.spi.notify.NotifierFilter;
import com.dlxretry.core.spi.notify.NotifierRouter;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

@AutoConfiguration(after = DlxRetryMetricsAutoConfiguration.class)
@EnableConfigurationProperties(DlxNotifierProperties.class)
public class DlxNotifierAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "loggingNotifier")
    @ConditionalOnProperty(prefix = "dlx-retry.notify.logging", name = "enabled", havingValue = "true", matchIfMissing = true)
    public Notifier loggingNotifier(DlxNotifierProperties props) {
        return new LoggingNotifier(props.getLogging().getMinSeverity(), props.getLogging().getMaxErrorLength());
    }

    @Bean
    @ConditionalOnMissingBean(NotifierRouter.class)
    public NotifierRouter notifierRouter(ObjectProvider<Notifier> notifiers, DlxNotifierProperties props) {
        return new SimpleRouter(notifiers.orderedStream().collect(Collectors.toList()), props.getMuted());
    }

    @Bean
    @ConditionalOnMissingBean(NotifierFilter.class)
    public NotifierFilter notifierRateLimitFilter(DlxNotifierProperties props) {
        return new RateLimitFilter(props.getRateLimit().getWindow(), props.getRateLimit().getThreshold());
    }

    @Bean
    @ConditionalOnProperty(prefix = "dlx-retry.notify", name = "enabled", havingValue = "true")
    public AsyncNotifyingService asyncNotifyingService(NotifierRouter router,
                                                       NotifierFilter filter,
                                                       DlxRetryMetrics metrics,
                                                       DlxNotifierProperties props) {
        DlxNotifierProperties.Async cfg = props.getAsync();
        ThreadPoolExecutor exec = new ThreadPoolExecutor(cfg.getCorePoolSize(),
                cfg.getMaxPoolSize(),
                cfg.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(cfg.getQueueCapacity()),
                r -> {
                    Thread t = new Thread(r, "dlx-retry-notify");
                    t.setDaemon(true);
                    t.setUncaughtExceptionHandler((th, e) -> LoggerFactory.getLogger("notify").error("uncaught", e));
                    return t;
                },
                // 消费线程不代为执行通知, 满了直接丢弃
                new ThreadPoolExecutor.AbortPolicy());
        return new AsyncNotifyingService(exec, router, filter, metrics, props.getMaxAttempts());
    }

    @Bean
    @ConditionalOnMissingBean
    public NotifyingFacade notifyingFacade(ObjectProvider<AsyncNotifyingService> provider) {
        return new NotifyingFacade(provider);
    }
}
