package com.dlxretry.model;

/**
 * 一次投递 = 句柄 + 消息
 * 同一逻辑任务的多次投递只通过 x-death 历史关联
 */
public final class Delivery {

    private final DeliveryHandle handle;

    private final TaskMessage message;

    private final String queue;

    private final boolean redelivered;

    public Delivery(DeliveryHandle handle, TaskMessage message, String queue, boolean redelivered) {
        this.handle = handle;
        this.message = message;
        this.queue = queue;
        this.redelivered = redelivered;
    }

    public DeliveryHandle getHandle() {
        return handle;
    }

    public TaskMessage getMessage() {
        return message;
    }

    public String getQueue() {
        return queue;
    }

    /** broker 因连接中断等原因重新投递 */
    public boolean isRedelivered() {
        return redelivered;
    }

    @Override
    public String toString() {
        return "Delivery{queue=" + queue + ", " + handle + ", messageId=" + message.getMessageId() + "}";
    }
}
