package com.dlxretry.core.backoff;

import com.dlxretry.config.DlxRetryProperties;
import com.dlxretry.core.spi.BackoffPolicy;

import java.util.concurrent.ThreadLocalRandom;

/**
 * 指数退避 + 抖动, 结果夹在 [min, max]
 */
public class ExponentialJitterBackoffPolicy implements BackoffPolicy {
    @Override
    public String name() {
        return "exponential";
    }

    @Override
    public long delayMillis(int attempt, DlxRetryProperties props) {
        long base = props.backoffBaseMillis(), min = props.backoffMinMillis(), max = props.backoffMaxMillis();
        double jr = props.getReconnect().getJitterRatio();

        // attempt从1开始：1 -> base, 2 -> base * 2, 3 -> base * 4 ...
        double pow = Math.pow(2.0, Math.max(0, attempt - 1));
        long ideal = (long) Math.min((double) max, base * pow);

        long jittered = ideal;
        if (jr > 0) {
            jittered += Math.round(ThreadLocalRandom.current().nextDouble(-jr, jr) * ideal);
        }
        return Math.max(min, Math.min(jittered, max));
    }
}
