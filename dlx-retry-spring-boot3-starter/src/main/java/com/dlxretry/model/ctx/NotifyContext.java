package com.dlxretry.model.ctx;


import com.dlxretry.model.enums.NotifyEventType;

import java.time.Instant;
import java.util.Map;

/**
 * 事件上下文
 */
public class NotifyContext {

    private NotifyEventType type;
    private String consumerId;
    private String queue;
    private String messageId;
    private Long retryCount;
    private Integer maxRetries;
    // 分类码，如 MAX_RETRIES_REACHED/MALFORMED_HISTORY/CHANNEL_CLOSED
    private String reasonCode;
    // 可被截断
    private String lastError;
    // 事件发生时间
    private Instant when;
    // 额外字段：deathReason、deathQueue、session、op 等
    private Map<String, Object> attributes;

    public NotifyContext() {
    }

    public NotifyContext(NotifyEventType type, String consumerId, String queue, String messageId, Long retryCount,
                         Integer maxRetries, String reasonCode, String lastError, Instant when,
                         Map<String, Object> attributes) {
        this.type = type;
        this.consumerId = consumerId;
        this.queue = queue;
        this.messageId = messageId;
        this.retryCount = retryCount;
        this.maxRetries = maxRetries;
        this.reasonCode = reasonCode;
        this.lastError = lastError;
        this.when = when;
        this.attributes = attributes;
    }

    public NotifyEventType getType() {
        return type;
    }

    public void setType(NotifyEventType type) {
        this.type = type;
    }

    public String getConsumerId() {
        return consumerId;
    }

    public void setConsumerId(String consumerId) {
        this.consumerId = consumerId;
    }

    public String getQueue() {
        return queue;
    }

    public void setQueue(String queue) {
        this.queue = queue;
    }

    public String getMessageId() {
        return messageId;
    }

    public void setMessageId(String messageId) {
        this.messageId = messageId;
    }

    public Long getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(Long retryCount) {
        this.retryCount = retryCount;
    }

    public Integer getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(Integer maxRetries) {
        this.maxRetries = maxRetries;
    }

    public String getReasonCode() {
        return reasonCode;
    }

    public void setReasonCode(String reasonCode) {
        this.reasonCode = reasonCode;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public Instant getWhen() {
        return when;
    }

    public void setWhen(Instant when) {
        this.when = when;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public void setAttributes(Map<String, Object> attributes) {
        this.attributes = attributes;
    }
}
