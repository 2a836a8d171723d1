package com.dlxretry.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单次投递的确认句柄
 * 只能被 ack 或 reject 一次, 重试会产生新的句柄
 */
public final class DeliveryHandle {

    private final long deliveryTag;

    /** 所属会话, 用于识别跨会话误用 */
    private final String sessionId;

    private final AtomicBoolean settled = new AtomicBoolean(false);

    public DeliveryHandle(long deliveryTag, String sessionId) {
        this.deliveryTag = deliveryTag;
        this.sessionId = sessionId;
    }

    public long getDeliveryTag() {
        return deliveryTag;
    }

    public String getSessionId() {
        return sessionId;
    }

    public boolean isSettled() {
        return settled.get();
    }

    /**
     * 占用句柄, 网关在发送 ack/reject 前调用
     * @throws IllegalStateException 已被确认过
     */
    public void claim() {
        if (!settled.compareAndSet(false, true)) {
            throw new IllegalStateException("delivery " + deliveryTag + " of session " + sessionId + " already settled");
        }
    }

    /**
     * 撤销占用, 仅供网关在 ack/reject 未送达 broker 时调用
     */
    public void release() {
        settled.set(false);
    }

    @Override
    public String toString() {
        return "DeliveryHandle{tag=" + deliveryTag + ", session=" + sessionId + ", settled=" + settled.get() + "}";
    }
}
