package com.dlxretry.core.inspect;

import com.dlxretry.exception.MalformedDeathHistoryException;
import com.dlxretry.model.DeathHistory;
import com.dlxretry.model.DeathRecord;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeathHistoryReaderTest {

    private final DeathHistoryReader reader = new DeathHistoryReader("x-retry-count");

    @Test
    void readsRecordsInOrder() {
        Instant t = Instant.parse("2024-05-01T10:00:00Z");
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("queue", "task_queue");
        first.put("reason", "rejected");
        first.put("exchange", "amq.direct");
        first.put("routing-keys", List.of("task_queue"));
        first.put("count", 2L);
        first.put("time", Date.from(t));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("queue", "dl");
        second.put("reason", "expired");
        second.put("exchange", "dlx");
        second.put("count", 2);
        second.put("time", t.getEpochSecond() + 1);

        DeathHistory h = reader.read(Map.of("x-death", List.of(first, second)));

        assertThat(h.size()).isEqualTo(2);
        DeathRecord r0 = h.getRecords().get(0);
        assertThat(r0.getQueue()).isEqualTo("task_queue");
        assertThat(r0.getReason()).isEqualTo("rejected");
        assertThat(r0.getRoutingKeys()).containsExactly("task_queue");
        assertThat(r0.getTime()).isEqualTo(t);
        assertThat(r0.getCount()).isEqualTo(2);
        assertThat(h.latest().get().getReason()).isEqualTo("expired");
        assertThat(h.latest().get().getTime()).isEqualTo(t.plusSeconds(1));
        assertThat(h.countFrom("task_queue")).isEqualTo(2);
        assertThat(h.countFrom(null)).isEqualTo(4);
        assertThat(h.getExplicitRetryCount()).isEmpty();
    }

    @Test
    void missingHeadersGiveEmptyHistory() {
        assertThat(reader.read(null).isEmpty()).isTrue();
        assertThat(reader.read(Map.of()).isEmpty()).isTrue();
        assertThat(reader.read(Map.of("other", 1)).isEmpty()).isTrue();
    }

    @Test
    void readsExplicitCounter() {
        DeathHistory h = reader.read(Map.of("x-retry-count", "4"));

        assertThat(h.isEmpty()).isTrue();
        assertThat(h.getExplicitRetryCount()).contains(4L);
    }

    @Test
    void rejectsNonNumericCounter() {
        assertThatThrownBy(() -> reader.read(Map.of("x-retry-count", "many")))
                .isInstanceOf(MalformedDeathHistoryException.class)
                .hasMessageContaining("x-retry-count");
    }

    @Test
    void rejectsEntryThatIsNotATable() {
        assertThatThrownBy(() -> reader.read(Map.of("x-death", List.of("rejected"))))
                .isInstanceOf(MalformedDeathHistoryException.class)
                .hasMessageContaining("x-death[0]");
    }

    @Test
    void rejectsFractionalCount() {
        Map<String, Object> entry = Map.of("queue", "task_queue", "count", 1.5d);

        assertThatThrownBy(() -> reader.read(Map.of("x-death", List.of(entry))))
                .isInstanceOf(MalformedDeathHistoryException.class)
                .hasMessageContaining("invalid count");
    }

    @Test
    void convertsIntegralNumbers() {
        assertThat(DeathHistoryReader.toNonNegativeLong(3)).isEqualTo(3L);
        assertThat(DeathHistoryReader.toNonNegativeLong((short) 2)).isEqualTo(2L);
        assertThat(DeathHistoryReader.toNonNegativeLong(BigInteger.TEN)).isEqualTo(10L);
        assertThat(DeathHistoryReader.toNonNegativeLong(new BigDecimal("7"))).isEqualTo(7L);
        assertThat(DeathHistoryReader.toNonNegativeLong(" 5 ")).isEqualTo(5L);
        assertThat(DeathHistoryReader.toNonNegativeLong(-1L)).isNull();
        assertThat(DeathHistoryReader.toNonNegativeLong(new BigDecimal("1.5"))).isNull();
        assertThat(DeathHistoryReader.toNonNegativeLong(BigInteger.ONE.shiftLeft(70))).isNull();
        assertThat(DeathHistoryReader.toNonNegativeLong(null)).isNull();
    }
}
