package com.dlxretry.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

public final class DlxRetryMetrics {
    private final Counter received;
    private final Counter acked;
    private final Counter rejected;
    private final Counter exhausted;
    private final Counter malformed;
    private final Counter quarantined;
    private final Counter observed;
    private final Counter reconnects;
    private final Counter notifySuppressed;
    private final Counter notifySent;
    private final Counter notifyFailed;
    private final DistributionSummary retries;
    private final Timer execTimer;

    private DlxRetryMetrics(MeterRegistry reg) {
        this.received  = Counter.builder("dlx.retry.received").description("deliveries received").register(reg);
        this.acked     = Counter.builder("dlx.retry.acked").description("deliveries succeeded and acked").register(reg);
        this.rejected  = Counter.builder("dlx.retry.rejected").description("deliveries rejected into the retry loop").register(reg);
        this.exhausted = Counter.builder("dlx.retry.exhausted").description("deliveries terminally acked").register(reg);
        this.malformed = Counter.builder("dlx.retry.malformed").description("deliveries with unreadable death history").register(reg);
        this.quarantined = Counter.builder("dlx.retry.quarantined").description("exhausted deliveries forwarded to quarantine").register(reg);
        this.observed  = Counter.builder("dlx.retry.dead.observed").description("dead letters observed").register(reg);
        this.reconnects = Counter.builder("dlx.retry.reconnect").description("broker session reopen attempts").register(reg);
        this.retries   = DistributionSummary.builder("dlx.retry.count")
                .description("retry count seen per delivery").baseUnit("times").register(reg);
        this.notifySuppressed = Counter.builder("dlx.retry.notify.suppressed").description("notify suppressed").register(reg);
        this.notifySent   = Counter.builder("dlx.retry.notify.sent").description("notify sent").register(reg);
        this.notifyFailed = Counter.builder("dlx.retry.notify.failed").description("notify failed").register(reg);
        this.execTimer = Timer.builder("dlx.retry.exec.time").description("task execution time").register(reg);
    }

    public static DlxRetryMetrics create(MeterRegistry reg) { return new DlxRetryMetrics(reg); }

    /** 独立的内存注册表, 测试或未接入 micrometer 时使用 */
    public static DlxRetryMetrics noop() { return new DlxRetryMetrics(new SimpleMeterRegistry()); }

    public void incReceived(){    received.increment(); }
    public void incAcked(){       acked.increment(); }
    public void incRejected(){    rejected.increment(); }
    public void incExhausted(){   exhausted.increment(); }
    public void incMalformed(){   malformed.increment(); }
    public void incQuarantined(){ quarantined.increment(); }
    public void incObserved(){    observed.increment(); }
    public void incReconnect(){   reconnects.increment(); }
    public void incNotifySuppressed(){ notifySuppressed.increment(); }
    public void incNotifyFailed(){ notifyFailed.increment(); }
    public void incNotifySent(){ notifySent.increment(); }
    public void recordRetries(long n){ retries.record(n); }
    public void recordExecNanos(long nanos){ execTimer.record(nanos, TimeUnit.NANOSECONDS); }

    public double acked() { return acked.count(); }
    public double rejected() { return rejected.count(); }
    public double exhausted() { return exhausted.count(); }
    public double notifySuppressed() { return notifySuppressed.count(); }
    public double notifySent() { return notifySent.count(); }
    public double notifyFailed() { return notifyFailed.count(); }
}
