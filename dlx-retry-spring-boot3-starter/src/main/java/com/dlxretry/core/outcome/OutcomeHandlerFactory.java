package com.dlxretry.core.outcome;

import com.dlxretry.core.spi.outcome.OutcomeDecider;
import com.dlxretry.core.spi.outcome.OutcomeHandler;
import com.dlxretry.model.enums.DeliveryState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 结算策略注册中心
 * 未注册的状态按终态ack处理, 保证消息不会无限回流
 */
public class OutcomeHandlerFactory {

    private final Map<DeliveryState, OutcomeHandler> policies = Collections.synchronizedMap(new EnumMap<>(DeliveryState.class));

    public OutcomeHandlerFactory(List<OutcomeHandler> handlers) {
        if (handlers != null) {
            handlers.forEach(p -> registry(p.support(), p));
        }
    }

    public OutcomeHandler get(OutcomeDecider.Decision d) {
        return get(d.getState());
    }

    public OutcomeHandler get(DeliveryState k) {
        OutcomeHandler h = policies.get(k);
        if (h == null) {
            h = policies.get(DeliveryState.TERMINALLY_ACKED);
        }
        if (h == null) {
            throw new IllegalStateException("no OutcomeHandler registered for " + k + " or TERMINALLY_ACKED");
        }
        return h;
    }

    /**
     * 注册或覆盖
     */
    public OutcomeHandlerFactory registry(DeliveryState k, OutcomeHandler v) {
        policies.put(k, v);
        return this;
    }

    /** 列出已注册状态 */
    public Set<DeliveryState> names() { return Collections.unmodifiableSet(policies.keySet()); }

    /** 内置三种结算 */
    public static OutcomeHandlerFactory defaults() {
        return new OutcomeHandlerFactory(List.of(
                new AckOutcomeHandler(), new RejectOutcomeHandler(), new TerminalAckOutcomeHandler()));
    }
}
