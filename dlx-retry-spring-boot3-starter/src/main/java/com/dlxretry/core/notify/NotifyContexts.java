package com.dlxretry.core.notify;

import com.dlxretry.model.DeathRecord;
import com.dlxretry.model.ctx.DeliveryContext;
import com.dlxretry.model.ctx.NotifyContext;
import com.dlxretry.model.enums.NotifyEventType;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

public final class NotifyContexts {

    private static final int MAX_ERROR_LEN = 4000;

    private NotifyContexts() {}

    /* ========== 对外入口（使用系统UTC时钟） ========== */

    public static NotifyContext ctxForExhausted(DeliveryContext d, String reasonCode) {
        return ctxForExhausted(d, reasonCode, Clock.systemUTC());
    }

    public static NotifyContext ctxForMalformed(DeliveryContext d, String reasonCode, String detail) {
        return ctxForMalformed(d, reasonCode, detail, Clock.systemUTC());
    }

    public static NotifyContext ctxForQuarantined(DeliveryContext d) {
        return ctxForQuarantined(d, Clock.systemUTC());
    }

    public static NotifyContext ctxForConnectivity(String consumerId, String queue, String sessionId, Throwable e) {
        return ctxForConnectivity(consumerId, queue, sessionId, e, Clock.systemUTC());
    }

    public static NotifyContext ctxForPersistFail(DeliveryContext d, String op, Exception e) {
        return ctxForPersistFail(d, op, e, Clock.systemUTC());
    }

    public static NotifyContext ctxForEngineError(String consumerId, String queue, Throwable e) {
        return new NotifyContext(NotifyEventType.ENGINE_ERROR, consumerId, queue, null, null, null,
                "ENGINE_ERROR", truncate(toError(e)), Instant.now(), new HashMap<>());
    }

    /* ========== 带 Clock 的重载（方便测试） ========== */

    public static NotifyContext ctxForExhausted(DeliveryContext d, String reasonCode, Clock clock) {
        Map<String, Object> attrs = baseAttrs(d);
        attrs.put("state", "TERMINALLY_ACKED");
        return of(NotifyEventType.RETRIES_EXHAUSTED, d, reasonCode, d.getErr(), clock, attrs);
    }

    public static NotifyContext ctxForMalformed(DeliveryContext d, String reasonCode, String detail, Clock clock) {
        Map<String, Object> attrs = baseAttrs(d);
        attrs.put("state", "TERMINALLY_ACKED");
        attrs.put("detail", detail);
        return of(NotifyEventType.MALFORMED_DEATH_HISTORY, d, reasonCode, d.getErr(), clock, attrs);
    }

    public static NotifyContext ctxForQuarantined(DeliveryContext d, Clock clock) {
        return of(NotifyEventType.QUARANTINED, d, "DEAD_LETTER_OBSERVED", null, clock, baseAttrs(d));
    }

    public static NotifyContext ctxForConnectivity(String consumerId, String queue, String sessionId,
                                                   Throwable e, Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("session", sessionId);
        return new NotifyContext(NotifyEventType.CONNECTIVITY_LOST, consumerId, queue, null, null, null,
                "CHANNEL_CLOSED", truncate(toError(e)), Instant.now(clock), attrs);
    }

    public static NotifyContext ctxForPersistFail(DeliveryContext d, String op, Exception e, Clock clock) {
        Map<String, Object> attrs = baseAttrs(d);
        attrs.put("op", op);
        return of(NotifyEventType.PERSIST_FAILED, d, "PERSIST_FAILED", toError(e), clock, attrs);
    }

    /* ========== 私有工具 ========== */

    private static NotifyContext of(NotifyEventType type, DeliveryContext d, String reasonCode, String err,
                                    Clock clock, Map<String, Object> attrs) {
        return new NotifyContext(
                type,
                d.getConsumerId(),
                d.getQueue(),
                d.getMessageId(),
                d.getRetryCount(),
                d.getMaxRetries(),
                reasonCode,
                truncate(err),
                Instant.now(clock),
                attrs
        );
    }

    private static Map<String, Object> baseAttrs(DeliveryContext d) {
        Map<String, Object> m = new HashMap<>();
        m.put("deliveryTag", d.getDeliveryTag());
        if (d.getFailureCategory() != null) {
            m.put("category", d.getFailureCategory().name());
        }
        if (d.getDeathHistory() != null) {
            m.put("deaths", d.getDeathHistory().size());
            d.getDeathHistory().latest().ifPresent(r -> putLatest(m, r));
        }
        return m;
    }

    private static void putLatest(Map<String, Object> m, DeathRecord r) {
        m.put("deathReason", r.getReason());
        m.put("deathQueue", r.getQueue());
        m.put("deathExchange", r.getExchange());
    }

    private static String toError(Throwable e) {
        if (e == null) return null;
        String msg = e.getClass().getName() + ": " + (e.getMessage() == null ? "" : e.getMessage());
        StringBuilder sb = new StringBuilder(msg);
        StackTraceElement[] stack = e.getStackTrace();
        // 只取前10行
        int n = Math.min(stack.length, 10);
        for (int i = 0; i < n; i++) sb.append("\n  at ").append(stack[i]);
        return sb.toString();
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() > MAX_ERROR_LEN ? s.substring(0, MAX_ERROR_LEN) : s;
    }
}
