package com.dlxretry.core.notify.notifier;

import com.dlxretry.core.spi.notify.Notifier;
import com.dlxretry.model.ctx.NotifyContext;
import com.dlxretry.model.enums.Severity;
import lombok.extern.slf4j.Slf4j;

/**
 * 日志通道, 默认启用
 * 错误栈只输出前 maxErrorLength 个字符
 */
@Slf4j
public class LoggingNotifier implements Notifier {

    private final Severity minSeverity;

    private final int maxErrorLength;

    public LoggingNotifier() {
        this(Severity.INFO, 2000);
    }

    public LoggingNotifier(Severity minSeverity, int maxErrorLength) {
        this.minSeverity = minSeverity;
        this.maxErrorLength = maxErrorLength;
    }

    @Override
    public String name() {
        return "log";
    }

    @Override
    public Severity minSeverity() {
        return minSeverity;
    }

    @Override
    public void notify(NotifyContext ctx, Severity severity) {
        switch (severity) {
            case CRITICAL, ERROR -> log.error("[Notify-{}] consumer={}, queue={}, msg={}, retries={}/{}, code={}, err={}, attrs={}",
                    ctx.getType(), ctx.getConsumerId(), ctx.getQueue(), ctx.getMessageId(),
                    ctx.getRetryCount(), ctx.getMaxRetries(), ctx.getReasonCode(),
                    abbreviate(ctx.getLastError()), ctx.getAttributes());
            case WARNING -> log.warn("[Notify-{}] consumer={}, queue={}, msg={}, code={}, attrs={}",
                    ctx.getType(), ctx.getConsumerId(), ctx.getQueue(), ctx.getMessageId(),
                    ctx.getReasonCode(), ctx.getAttributes());
            default -> log.info("[Notify-{}] queue={}, msg={}, code={}",
                    ctx.getType(), ctx.getQueue(), ctx.getMessageId(), ctx.getReasonCode());
        }
    }

    private String abbreviate(String err) {
        if (err == null || err.length() <= maxErrorLength) {
            return err;
        }
        return err.substring(0, maxErrorLength) + "...(" + (err.length() - maxErrorLength) + " more)";
    }
}
