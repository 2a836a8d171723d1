package com.dlxretry.core.spi;

import com.dlxretry.config.DlxRetryProperties;

/**
 * 回退策略（计算重连前的等待时长）
 */
public interface BackoffPolicy {

    /** 策略唯一名称（如 "fixed"、"exponential"、"myPolicy"） */
    String name();

    /**
     * 计算等待毫秒
     * @param attempt 第几次连续失败（从1开始）
     * @param props   全局配置（读取 reconnect.base/min/max/jitterRatio）
     */
    long delayMillis(int attempt, DlxRetryProperties props);
}
