package com.dlxretry.core.spi.notify;

import com.dlxretry.model.ctx.NotifyContext;
import com.dlxretry.model.enums.Severity;

/**
 * 过滤器：限流、去抖、按队列过滤等
 */
public interface NotifierFilter {

    /**
     * 返回 true 表示放行，false 表示丢弃/抑制
     */
    boolean allow(NotifyContext ctx, Severity severity);
}
