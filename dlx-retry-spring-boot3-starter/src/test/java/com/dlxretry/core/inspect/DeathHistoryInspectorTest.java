package com.dlxretry.core.inspect;

import com.dlxretry.model.RetryPolicy;
import com.dlxretry.model.enums.Verdict;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DeathHistoryInspectorTest {

    private static final String TASK = "task_queue";

    private final DeathHistoryReader reader = new DeathHistoryReader("x-retry-count");

    private DeathHistoryInspector inspector(int maxRetries) {
        return new DeathHistoryInspector(RetryPolicy.of(maxRetries), reader, TASK);
    }

    private static Map<String, Object> death(String queue, String reason, Object count) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("queue", queue);
        m.put("reason", reason);
        m.put("exchange", "amq.direct");
        m.put("count", count);
        return m;
    }

    /** 一次完整回流 = 主队列 rejected + 等待队列 expired */
    private static Map<String, Object> roundTrips(long n) {
        Map<String, Object> headers = new HashMap<>();
        headers.put("x-death", List.of(death(TASK, "rejected", n), death("dl", "expired", n)));
        return headers;
    }

    @Test
    void firstDeliveryIsEligible() {
        Inspection r = inspector(3).inspect(Map.of());

        assertThat(r.getVerdict()).isEqualTo(Verdict.RETRY_ELIGIBLE);
        assertThat(r.getRetryCount()).isZero();
        assertThat(r.isMalformed()).isFalse();
        assertThat(r.getHistory().isEmpty()).isTrue();
    }

    @Test
    void nullHeadersAreTreatedAsFirstDelivery() {
        assertThat(inspector(3).verdict(null)).isEqualTo(Verdict.RETRY_ELIGIBLE);
    }

    @Test
    void firstDeliveryRunsEvenWhenRetriesAreDisabled() {
        assertThat(inspector(0).verdict(Map.of("content-type", "json"))).isEqualTo(Verdict.RETRY_ELIGIBLE);
    }

    @Test
    void countsOnlyDeathsOfThePrimaryQueue() {
        Inspection r = inspector(3).inspect(roundTrips(2));

        assertThat(r.getRetryCount()).isEqualTo(2);
        assertThat(r.isRetryEligible()).isTrue();
        assertThat(r.getHistory().size()).isEqualTo(2);
    }

    @Test
    void exhaustedWhenCountReachesMax() {
        Inspection r = inspector(3).inspect(roundTrips(3));

        assertThat(r.getVerdict()).isEqualTo(Verdict.RETRIES_EXHAUSTED);
        assertThat(r.getRetryCount()).isEqualTo(3);
        assertThat(r.isMalformed()).isFalse();
        assertThat(r.getReasonCode()).isEqualTo(Inspection.MAX_RETRIES_REACHED);
    }

    @Test
    void eachVerdictFollowsTheCountAcrossTheLoop() {
        DeathHistoryInspector inspector = inspector(3);

        assertThat(inspector.verdict(Map.of())).isEqualTo(Verdict.RETRY_ELIGIBLE);
        assertThat(inspector.verdict(roundTrips(1))).isEqualTo(Verdict.RETRY_ELIGIBLE);
        assertThat(inspector.verdict(roundTrips(2))).isEqualTo(Verdict.RETRY_ELIGIBLE);
        assertThat(inspector.verdict(roundTrips(3))).isEqualTo(Verdict.RETRIES_EXHAUSTED);
        assertThat(inspector.verdict(roundTrips(7))).isEqualTo(Verdict.RETRIES_EXHAUSTED);
    }

    @Test
    void withoutOriginQueueEveryRecordCounts() {
        DeathHistoryInspector all = new DeathHistoryInspector(RetryPolicy.of(3), reader, null);

        Inspection r = all.inspect(roundTrips(1));

        assertThat(r.getRetryCount()).isEqualTo(2);
    }

    @Test
    void explicitCounterWinsOverDeathRecords() {
        Map<String, Object> headers = roundTrips(1);
        headers.put("x-retry-count", 3);

        Inspection r = inspector(3).inspect(headers);

        assertThat(r.getVerdict()).isEqualTo(Verdict.RETRIES_EXHAUSTED);
        assertThat(r.getRetryCount()).isEqualTo(3);
    }

    @Test
    void explicitCounterBehindDeathRecordsIsInconsistent() {
        Map<String, Object> headers = roundTrips(1);
        headers.put("x-retry-count", 0);

        Inspection r = inspector(3).inspect(headers);

        assertThat(r.getVerdict()).isEqualTo(Verdict.RETRIES_EXHAUSTED);
        assertThat(r.isMalformed()).isTrue();
        assertThat(r.getReasonCode()).isEqualTo(Inspection.INCONSISTENT_COUNT);
        assertThat(r.getRetryCount()).isEqualTo(1);
        assertThat(r.getDetail()).contains("x-retry-count=0");
    }

    @Test
    void explicitCounterEqualToDeathRecordsIsTrusted() {
        Map<String, Object> headers = roundTrips(2);
        headers.put("x-retry-count", 2);

        Inspection r = inspector(3).inspect(headers);

        assertThat(r.isRetryEligible()).isTrue();
        assertThat(r.getRetryCount()).isEqualTo(2);
    }

    @Test
    void explicitCounterWithoutHistoryIsInconsistent() {
        Inspection r = inspector(5).inspect(Map.of("x-retry-count", 2));

        assertThat(r.getVerdict()).isEqualTo(Verdict.RETRIES_EXHAUSTED);
        assertThat(r.isMalformed()).isTrue();
        assertThat(r.getReasonCode()).isEqualTo(Inspection.INCONSISTENT_COUNT);
        assertThat(r.getRetryCount()).isEqualTo(2);
    }

    @Test
    void explicitZeroWithoutHistoryIsFirstDelivery() {
        Inspection r = inspector(5).inspect(Map.of("x-retry-count", 0));

        assertThat(r.isRetryEligible()).isTrue();
        assertThat(r.getRetryCount()).isZero();
    }

    @Test
    void deathHeaderThatIsNotAListIsExhausted() {
        Inspection r = inspector(5).inspect(Map.of("x-death", "garbage"));

        assertThat(r.getVerdict()).isEqualTo(Verdict.RETRIES_EXHAUSTED);
        assertThat(r.isMalformed()).isTrue();
        assertThat(r.getReasonCode()).isEqualTo(Inspection.MALFORMED_HISTORY);
        assertThat(r.getRetryCount()).isEqualTo(-1);
        assertThat(r.getDetail()).contains("x-death");
    }

    @Test
    void recordWithoutCountIsExhaustedDespiteLowNominalCount() {
        Map<String, Object> broken = new LinkedHashMap<>();
        broken.put("queue", TASK);
        broken.put("reason", "rejected");

        Inspection r = inspector(5).inspect(Map.of("x-death", List.of(broken)));

        assertThat(r.getVerdict()).isEqualTo(Verdict.RETRIES_EXHAUSTED);
        assertThat(r.isMalformed()).isTrue();
    }

    @Test
    void negativeCountIsMalformed() {
        Inspection r = inspector(5).inspect(Map.of("x-death", List.of(death(TASK, "rejected", -1L))));

        assertThat(r.isMalformed()).isTrue();
        assertThat(r.getVerdict()).isEqualTo(Verdict.RETRIES_EXHAUSTED);
    }

    @Test
    void sameHeadersGiveSameResult() {
        DeathHistoryInspector inspector = inspector(3);
        Map<String, Object> headers = roundTrips(2);

        Inspection a = inspector.inspect(headers);
        Inspection b = inspector.inspect(headers);

        assertThat(a.getVerdict()).isEqualTo(b.getVerdict());
        assertThat(a.getRetryCount()).isEqualTo(b.getRetryCount());
    }
}
