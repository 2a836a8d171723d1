package com.dlxretry.core.outcome;

import com.dlxretry.core.inspect.Inspection;
import com.dlxretry.core.spi.outcome.OutcomeDecider;
import com.dlxretry.exception.TaskExecutionException;
import com.dlxretry.exception.guard.DownstreamGuardException;
import com.dlxretry.model.ctx.DeliveryContext;
import com.dlxretry.model.enums.DeliveryState;
import com.dlxretry.model.enums.FailureCategory;

/**
 * 成功 → ack；失败且可重试 → reject 进入死信回流；失败且耗尽/历史损坏 → 终态ack
 */
public class DefaultOutcomeDecider implements OutcomeDecider {

    @Override
    public Decision decide(Throwable failure, Inspection inspection, DeliveryContext ctx) {
        if (failure == null) {
            return Decision.of(DeliveryState.ACKED, null);
        }
        FailureCategory category = categorize(failure);
        if (inspection.isRetryEligible()) {
            return Decision.of(DeliveryState.REJECTED, category)
                    .withCode(category.name())
                    .withMsg(failure.getMessage());
        }
        return Decision.of(DeliveryState.TERMINALLY_ACKED, category)
                .malformed(inspection.isMalformed())
                .withCode(inspection.getReasonCode())
                .withMsg(inspection.isMalformed() ? inspection.getDetail() : failure.getMessage());
    }

    static FailureCategory categorize(Throwable t) {
        if (t instanceof DownstreamGuardException) {
            return ((DownstreamGuardException) t).getCategory();
        }
        if (t instanceof TaskExecutionException) {
            return ((TaskExecutionException) t).getCategory();
        }
        return FailureCategory.UNKNOWN;
    }
}
