package com.dlxretry.core.inspect;

import com.dlxretry.exception.MalformedDeathHistoryException;
import com.dlxretry.model.DeathHistory;
import com.dlxretry.model.DeathRecord;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * 解析消息头中的 x-death 与显式重试计数头
 * 输入要求已按时间正序排列（broker 适配层负责）
 */
public class DeathHistoryReader {

    public static final String X_DEATH = "x-death";

    private final String retryCountHeader;

    public DeathHistoryReader(String retryCountHeader) {
        this.retryCountHeader = retryCountHeader;
    }

    public String getRetryCountHeader() {
        return retryCountHeader;
    }

    /**
     * @throws MalformedDeathHistoryException x-death 或计数头结构不合法
     */
    public DeathHistory read(Map<String, Object> headers) {
        if (headers == null || headers.isEmpty()) {
            return DeathHistory.empty();
        }
        Long explicit = readExplicitCount(headers);
        Object raw = headers.get(X_DEATH);
        if (raw == null) {
            return explicit == null ? DeathHistory.empty() : new DeathHistory(List.of(), explicit);
        }
        if (!(raw instanceof List)) {
            throw new MalformedDeathHistoryException(X_DEATH + " is not a list: " + raw.getClass().getSimpleName());
        }
        List<?> entries = (List<?>) raw;
        List<DeathRecord> records = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            Object e = entries.get(i);
            if (!(e instanceof Map)) {
                throw new MalformedDeathHistoryException(X_DEATH + "[" + i + "] is not a table");
            }
            records.add(toRecord(i, (Map<?, ?>) e));
        }
        return new DeathHistory(records, explicit);
    }

    private Long readExplicitCount(Map<String, Object> headers) {
        if (retryCountHeader == null || !headers.containsKey(retryCountHeader)) {
            return null;
        }
        Object v = headers.get(retryCountHeader);
        Long n = toNonNegativeLong(v);
        if (n == null) {
            throw new MalformedDeathHistoryException(retryCountHeader + " is not a non-negative integer: " + v);
        }
        return n;
    }

    private static DeathRecord toRecord(int idx, Map<?, ?> entry) {
        Object rawCount = entry.get("count");
        if (rawCount == null) {
            throw new MalformedDeathHistoryException(X_DEATH + "[" + idx + "] has no count");
        }
        Long count = toNonNegativeLong(rawCount);
        if (count == null) {
            throw new MalformedDeathHistoryException(X_DEATH + "[" + idx + "] has invalid count: " + rawCount);
        }
        DeathRecord.DeathRecordBuilder b = DeathRecord.builder()
                .reason(asString(entry.get("reason")))
                .queue(asString(entry.get("queue")))
                .exchange(asString(entry.get("exchange")))
                .time(asInstant(entry.get("time")))
                .count(count);
        Object keys = entry.get("routing-keys");
        if (keys instanceof List) {
            ((List<?>) keys).forEach(k -> b.routingKey(asString(k)));
        }
        return b.build();
    }

    /** 非负整数, 否则返回 null */
    static Long toNonNegativeLong(Object v) {
        long n;
        if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
            n = ((Number) v).longValue();
        } else if (v instanceof BigInteger) {
            BigInteger bi = (BigInteger) v;
            if (bi.bitLength() > 63) {
                return null;
            }
            n = bi.longValue();
        } else if (v instanceof BigDecimal) {
            try {
                n = ((BigDecimal) v).longValueExact();
            } catch (ArithmeticException e) {
                return null;
            }
        } else if (v instanceof String) {
            try {
                n = Long.parseLong(((String) v).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return n < 0 ? null : n;
    }

    private static String asString(Object v) {
        return v == null ? null : v.toString();
    }

    private static Instant asInstant(Object v) {
        if (v instanceof Instant) {
            return (Instant) v;
        }
        if (v instanceof Date) {
            return ((Date) v).toInstant();
        }
        // AMQP timestamp 为秒
        if (v instanceof Number) {
            return Instant.ofEpochSecond(((Number) v).longValue());
        }
        return null;
    }
}
