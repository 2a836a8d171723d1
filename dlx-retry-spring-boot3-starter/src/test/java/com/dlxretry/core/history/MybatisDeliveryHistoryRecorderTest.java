package com.dlxretry.core.history;

import com.dlxretry.mapper.DeliveryHistoryMapper;
import com.dlxretry.model.DeathHistory;
import com.dlxretry.model.DeathRecord;
import com.dlxretry.model.ctx.DeliveryContext;
import com.dlxretry.model.entity.DeliveryHistoryEntity;
import com.dlxretry.model.enums.DeliveryState;
import com.dlxretry.model.enums.FailureCategory;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MybatisDeliveryHistoryRecorderTest {

    private final DeliveryHistoryMapper mapper = mock(DeliveryHistoryMapper.class);

    private final MybatisDeliveryHistoryRecorder recorder = new MybatisDeliveryHistoryRecorder(mapper,
            Clock.fixed(Instant.parse("2026-01-02T03:04:05Z"), ZoneOffset.UTC));

    @Test
    void recordsTerminalAckWithLatestDeath() {
        DeathHistory history = new DeathHistory(List.of(
                DeathRecord.builder().queue("task_queue").reason("rejected").count(3).routingKey("task_queue").build(),
                DeathRecord.builder().queue("dl").reason("expired").count(3).routingKey("dl").build()), null);
        DeliveryContext ctx = DeliveryContext.builder()
                .consumerId("orders-task-0").queue("task_queue").messageId("m-1").deliveryTag(9)
                .retryCount(3).maxRetries(3).deathHistory(history)
                .failureCategory(FailureCategory.UNKNOWN).err("boom")
                .build();

        recorder.record(ctx, DeliveryState.TERMINALLY_ACKED);

        ArgumentCaptor<DeliveryHistoryEntity> captor = ArgumentCaptor.forClass(DeliveryHistoryEntity.class);
        verify(mapper).insert(captor.capture());
        DeliveryHistoryEntity e = captor.getValue();
        assertThat(e.getState()).isEqualTo(DeliveryState.TERMINALLY_ACKED.getCode());
        assertThat(e.getQueueName()).isEqualTo("task_queue");
        assertThat(e.getDeliveryTag()).isEqualTo(9L);
        assertThat(e.getRetryCount()).isEqualTo(3L);
        assertThat(e.getDeathCount()).isEqualTo(2);
        assertThat(e.getDeathReason()).isEqualTo("expired");
        assertThat(e.getDeathQueue()).isEqualTo("dl");
        assertThat(e.getFailureCategory()).isEqualTo("UNKNOWN");
        assertThat(e.getLastError()).isEqualTo("boom");
        assertThat(e.getCreatedAt()).isEqualTo(LocalDateTime.of(2026, 1, 2, 3, 4, 5));
    }

    @Test
    void truncatesLongErrors() {
        DeliveryContext ctx = DeliveryContext.builder().queue("task_queue").err("x".repeat(5000)).build();

        DeliveryHistoryEntity e = recorder.toEntity(ctx, DeliveryState.REJECTED);

        assertThat(e.getLastError()).hasSize(2000);
        assertThat(e.getDeathCount()).isNull();
    }

    @Test
    void looksUpByMessageId() {
        DeliveryHistoryEntity row = new DeliveryHistoryEntity();
        when(mapper.selectByMessageId("m-1")).thenReturn(List.of(row));

        assertThat(recorder.findByMessageId("m-1")).containsExactly(row);
    }
}
