package com.dlxretry.core.history;

import com.dlxretry.core.spi.DeliveryHistoryRecorder;
import com.dlxretry.mapper.DeliveryHistoryMapper;
import com.dlxretry.model.DeathRecord;
import com.dlxretry.model.ctx.DeliveryContext;
import com.dlxretry.model.entity.DeliveryHistoryEntity;
import com.dlxretry.model.enums.DeliveryState;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 结算结果落库
 */
public class MybatisDeliveryHistoryRecorder implements DeliveryHistoryRecorder {

    private static final int MAX_ERROR_LEN = 2000;

    private final DeliveryHistoryMapper mapper;

    private final Clock clock;

    public MybatisDeliveryHistoryRecorder(DeliveryHistoryMapper mapper) {
        this(mapper, Clock.systemDefaultZone());
    }

    public MybatisDeliveryHistoryRecorder(DeliveryHistoryMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public void record(DeliveryContext ctx, DeliveryState state) {
        mapper.insert(toEntity(ctx, state));
    }

    public List<DeliveryHistoryEntity> findByMessageId(String messageId) {
        return mapper.selectByMessageId(messageId);
    }

    DeliveryHistoryEntity toEntity(DeliveryContext ctx, DeliveryState state) {
        DeliveryHistoryEntity e = new DeliveryHistoryEntity();
        e.setConsumerId(ctx.getConsumerId());
        e.setQueueName(ctx.getQueue());
        e.setMessageId(ctx.getMessageId());
        e.setDeliveryTag(ctx.getDeliveryTag());
        e.setState(state.getCode());
        e.setRetryCount(ctx.getRetryCount());
        e.setMaxRetries(ctx.getMaxRetries());
        e.setRedelivered(ctx.isRedelivered());
        if (ctx.getDeathHistory() != null) {
            e.setDeathCount(ctx.getDeathHistory().size());
            DeathRecord latest = ctx.getDeathHistory().latest().orElse(null);
            if (latest != null) {
                e.setDeathReason(latest.getReason());
                e.setDeathQueue(latest.getQueue());
            }
        }
        if (ctx.getFailureCategory() != null) {
            e.setFailureCategory(ctx.getFailureCategory().name());
        }
        String err = ctx.getErr();
        e.setLastError(err == null || err.length() <= MAX_ERROR_LEN ? err : err.substring(0, MAX_ERROR_LEN));
        e.setCreatedAt(LocalDateTime.now(clock));
        return e;
    }
}
