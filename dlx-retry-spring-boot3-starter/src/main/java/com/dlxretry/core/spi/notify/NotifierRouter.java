package com.dlxretry.core.spi.notify;

import com.dlxretry.model.ctx.NotifyContext;
import com.dlxretry.model.enums.Severity;

import java.util.List;

/**
 * 路由：根据事件选择若干 Notifier
 */
public interface NotifierRouter {

    List<Notifier> route(NotifyContext ctx, Severity severity);
}
