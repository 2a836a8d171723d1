package com.dlxretry.core.consumer;

import io.netty.util.Timeout;
import io.netty.util.TimerTask;

/**
 * 时间轮上的重连任务
 * 让时间轮返回的 Timeout 能识别是哪个消费者在等待重连
 */
public class ReconnectTask implements TimerTask {

    private final String consumerId;

    /** 第几次连续重连 */
    private final int attempt;

    private final Runnable actual;

    public ReconnectTask(String consumerId, int attempt, Runnable actual) {
        this.consumerId = consumerId;
        this.attempt = attempt;
        this.actual = actual;
    }

    @Override
    public void run(Timeout timeout) {
        if (timeout.isCancelled()) {
            return;
        }
        actual.run();
    }

    public String getConsumerId() {
        return consumerId;
    }

    public int getAttempt() {
        return attempt;
    }
}
