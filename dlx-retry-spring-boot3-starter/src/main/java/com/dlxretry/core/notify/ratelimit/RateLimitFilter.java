package com.dlxretry.core.notify.ratelimit;

import com.dlxretry.core.spi.notify.NotifierFilter;
import com.dlxretry.model.ctx.NotifyContext;
import com.dlxretry.model.enums.Severity;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存窗口限流, 按 (事件, 队列, 级别) 各自计窗
 * 某个队列刷屏不会挤掉其他队列的告警
 */
public class RateLimitFilter implements NotifierFilter {

    private final long windowMs;

    private final int threshold;

    private final Clock clock;

    private final ConcurrentHashMap<String, Window> windows = new ConcurrentHashMap<>();

    public RateLimitFilter(Duration window, int threshold) {
        this(window, threshold, Clock.systemUTC());
    }

    public RateLimitFilter(Duration window, int threshold, Clock clock) {
        this.windowMs = window.toMillis();
        this.threshold = threshold;
        this.clock = clock;
    }

    @Override
    public boolean allow(NotifyContext ctx, Severity sev) {
        long now = clock.millis();
        String key = ctx.getType() + "|" + ctx.getQueue() + "|" + sev;
        Window w = windows.compute(key, (k, old) ->
                old == null || now - old.start > windowMs ? new Window(now) : old);
        synchronized (w) {
            return ++w.count <= threshold;
        }
    }

    private static final class Window {
        private final long start;
        private int count;

        private Window(long start) {
            this.start = start;
        }
    }
}
