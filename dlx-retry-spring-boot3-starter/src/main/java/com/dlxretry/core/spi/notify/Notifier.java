package com.dlxretry.core.spi.notify;

import com.dlxretry.model.ctx.NotifyContext;
import com.dlxretry.model.enums.Severity;

/**
 * 告警通道（日志、IM、邮件等）
 * 由异步派发线程同步调用, 抛出的异常会触发有限次重试
 */
public interface Notifier {

    /** 通道名, 出现在派发日志中 */
    String name();

    /** 低于该级别的事件不会路由到本通道 */
    default Severity minSeverity() {
        return Severity.INFO;
    }

    /** 按事件内容粗粒度过滤, 如只关心某个队列 */
    default boolean supports(NotifyContext ctx) {
        return true;
    }

    void notify(NotifyContext ctx, Severity severity);
}
