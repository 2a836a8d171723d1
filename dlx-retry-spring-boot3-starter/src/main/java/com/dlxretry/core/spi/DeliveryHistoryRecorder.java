package com.dlxretry.core.spi;

import com.dlxretry.model.ctx.DeliveryContext;
import com.dlxretry.model.enums.DeliveryState;

/**
 * 投递结果记录
 */
public interface DeliveryHistoryRecorder {

    /** 结算完成后调用一次 */
    void record(DeliveryContext ctx, DeliveryState state);

    DeliveryHistoryRecorder NOOP = (ctx, state) -> { };
}
