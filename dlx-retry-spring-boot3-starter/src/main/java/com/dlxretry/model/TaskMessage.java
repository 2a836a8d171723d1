package com.dlxretry.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 任务消息
 * payload 生命周期内不可变, headers 只由 broker 追加（x-death 等）, 消费端只读
 */
public final class TaskMessage {

    private final String messageId;

    private final byte[] payload;

    private final Map<String, Object> headers;

    private final String contentType;

    public TaskMessage(String messageId, byte[] payload, Map<String, Object> headers, String contentType) {
        this.messageId = messageId;
        this.payload = payload == null ? new byte[0] : payload.clone();
        this.headers = headers == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.contentType = contentType;
    }

    public static TaskMessage of(String messageId, byte[] payload, Map<String, Object> headers) {
        return new TaskMessage(messageId, payload, headers, null);
    }

    /** 逻辑任务标识, 可能为空 */
    public String getMessageId() {
        return messageId;
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    public Map<String, Object> getHeaders() {
        return headers;
    }

    public String getContentType() {
        return contentType;
    }

    @Override
    public String toString() {
        return "TaskMessage{messageId=" + messageId
                + ", size=" + payload.length
                + ", headers=" + headers.keySet()
                + ", payloadHash=" + Arrays.hashCode(payload) + "}";
    }
}
