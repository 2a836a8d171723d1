package com.dlxretry.core.notify;

import com.dlxretry.core.metric.DlxRetryMetrics;
import com.dlxretry.core.spi.notify.Notifier;
import com.dlxretry.core.spi.notify.NotifierFilter;
import com.dlxretry.core.spi.notify.NotifierRouter;
import com.dlxretry.model.ctx.NotifyContext;
import com.dlxretry.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * 异步派发
 * 通过路由、限流、异步执行通知, 消费线程不等待通知结果
 */
public class AsyncNotifyingService {

    private static final long MAX_BACKOFF_MS = 4000;

    private final Logger log = LoggerFactory.getLogger(AsyncNotifyingService.class);

    private final ExecutorService exec;

    private final NotifierRouter router;

    private final NotifierFilter filter;

    private final DlxRetryMetrics metrics;

    private final int maxAttempts;

    private final long initialBackoffMs;

    public AsyncNotifyingService(ExecutorService exec, NotifierRouter router, NotifierFilter filter,
                                 DlxRetryMetrics metrics, int maxAttempts) {
        this(exec, router, filter, metrics, maxAttempts, 200);
    }

    AsyncNotifyingService(ExecutorService exec, NotifierRouter router, NotifierFilter filter,
                          DlxRetryMetrics metrics, int maxAttempts, long initialBackoffMs) {
        this.exec = exec;
        this.router = router;
        this.filter = filter;
        this.metrics = metrics;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMs = initialBackoffMs;
    }

    public void fire(NotifyContext ctx, Severity sev) {
        if (filter != null && !filter.allow(ctx, sev)) {
            metrics.incNotifySuppressed();
            return;
        }
        try {
            exec.execute(() -> dispatch(ctx, sev));
        } catch (RejectedExecutionException e) {
            // 队列满或已停机
            metrics.incNotifySuppressed();
            log.warn("[Notify] event={} queue={} dropped, executor rejected", ctx.getType(), ctx.getQueue());
        }
    }

    private void dispatch(NotifyContext ctx, Severity sev) {
        List<Notifier> notifiers = router.route(ctx, sev);
        for (Notifier n : notifiers) {
            try {
                sendWithRetry(n, ctx, sev);
                metrics.incNotifySent();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                metrics.incNotifyFailed();
                log.warn("[Notify] channel={} event={} interrupted", n.name(), ctx.getType());
                return;
            } catch (Exception e) {
                metrics.incNotifyFailed();
                log.error("[Notify] channel={} event={} failed", n.name(), ctx.getType(), e);
            }
        }
    }

    private void sendWithRetry(Notifier n, NotifyContext ctx, Severity sev) throws Exception {
        int attempt = 0;
        long backoff = initialBackoffMs;
        while (true) {
            try {
                n.notify(ctx, sev);
                return;
            } catch (Exception e) {
                if (++attempt >= maxAttempts) {
                    throw e;
                }
                Thread.sleep(backoff);
                // 指数退避
                backoff = Math.min(backoff * 2, MAX_BACKOFF_MS);
            }
        }
    }
}
