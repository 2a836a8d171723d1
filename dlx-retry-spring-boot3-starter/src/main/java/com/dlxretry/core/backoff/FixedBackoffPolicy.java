package com.dlxretry.core.backoff;

import com.dlxretry.config.DlxRetryProperties;
import com.dlxretry.core.spi.BackoffPolicy;

import java.util.concurrent.ThreadLocalRandom;

/**
 * 固定间隔策略（可选小幅抖动）
 */
public class FixedBackoffPolicy implements BackoffPolicy {
    @Override
    public String name() {
        return "fixed";
    }

    @Override
    public long delayMillis(int attempt, DlxRetryProperties props) {
        long delay = props.backoffBaseMillis();
        double jr = props.getReconnect().getJitterRatio();
        if (jr > 0) {
            delay += Math.round(ThreadLocalRandom.current().nextDouble(-jr, jr) * delay);
        }
        return Math.max(props.backoffMinMillis(), Math.min(delay, props.backoffMaxMillis()));
    }
}
