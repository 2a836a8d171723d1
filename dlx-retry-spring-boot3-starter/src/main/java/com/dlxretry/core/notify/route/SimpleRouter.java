package com.dlxretry.core.notify.route;

import com.dlxretry.core.spi.notify.Notifier;
import com.dlxretry.core.spi.notify.NotifierRouter;
import com.dlxretry.model.ctx.NotifyContext;
import com.dlxretry.model.enums.NotifyEventType;
import com.dlxretry.model.enums.Severity;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 按通道级别阈值路由, 被静音的事件类型不派发
 */
public class SimpleRouter implements NotifierRouter {

    private final List<Notifier> notifiers;

    private final Set<NotifyEventType> muted;

    public SimpleRouter(List<Notifier> notifiers) {
        this(notifiers, Collections.emptySet());
    }

    public SimpleRouter(List<Notifier> notifiers, Set<NotifyEventType> muted) {
        this.notifiers = List.copyOf(notifiers);
        this.muted = muted == null || muted.isEmpty()
                ? EnumSet.noneOf(NotifyEventType.class) : EnumSet.copyOf(muted);
    }

    @Override
    public List<Notifier> route(NotifyContext ctx, Severity severity) {
        if (muted.contains(ctx.getType())) {
            return List.of();
        }
        return notifiers.stream()
                .filter(n -> severity.compareTo(n.minSeverity()) >= 0)
                .filter(n -> n.supports(ctx))
                .collect(Collectors.toList());
    }
}
