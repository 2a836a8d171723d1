package com.dlxretry.core.rabbit;

import com.dlxretry.core.inspect.DeathHistoryReader;
import com.rabbitmq.client.LongString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AMQP 头与内部表示之间的转换
 * - LongString 转为 String
 * - x-death 在 RabbitMQ 中最近一次在前, 内部统一为时间正序
 */
public final class RabbitHeaders {

    private RabbitHeaders() {}

    /** broker → 内部 */
    public static Map<String, Object> fromBroker(Map<String, Object> headers) {
        if (headers == null || headers.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> out = new LinkedHashMap<>(headers.size());
        headers.forEach((k, v) -> out.put(k, normalize(v)));
        reverseDeaths(out);
        return out;
    }

    /** 内部 → broker */
    public static Map<String, Object> toBroker(Map<String, Object> headers) {
        if (headers == null || headers.isEmpty()) {
            return null;
        }
        Map<String, Object> out = new LinkedHashMap<>(headers.size());
        headers.forEach((k, v) -> out.put(k, denormalize(v)));
        reverseDeaths(out);
        return out;
    }

    private static void reverseDeaths(Map<String, Object> headers) {
        Object deaths = headers.get(DeathHistoryReader.X_DEATH);
        if (deaths instanceof List) {
            List<Object> copy = new ArrayList<>((List<?>) deaths);
            Collections.reverse(copy);
            headers.put(DeathHistoryReader.X_DEATH, copy);
        }
    }

    private static Object normalize(Object v) {
        if (v instanceof LongString) {
            return v.toString();
        }
        if (v instanceof List) {
            List<?> in = (List<?>) v;
            List<Object> out = new ArrayList<>(in.size());
            in.forEach(e -> out.add(normalize(e)));
            return out;
        }
        if (v instanceof Map) {
            Map<?, ?> in = (Map<?, ?>) v;
            Map<String, Object> out = new LinkedHashMap<>(in.size());
            in.forEach((k, e) -> out.put(String.valueOf(k), normalize(e)));
            return out;
        }
        return v;
    }

    private static Object denormalize(Object v) {
        if (v instanceof Instant) {
            return Date.from((Instant) v);
        }
        if (v instanceof List) {
            List<?> in = (List<?>) v;
            List<Object> out = new ArrayList<>(in.size());
            in.forEach(e -> out.add(denormalize(e)));
            return out;
        }
        if (v instanceof Map) {
            Map<?, ?> in = (Map<?, ?>) v;
            Map<String, Object> out = new LinkedHashMap<>(in.size());
            in.forEach((k, e) -> out.put(String.valueOf(k), denormalize(e)));
            return out;
        }
        return v;
    }
}
