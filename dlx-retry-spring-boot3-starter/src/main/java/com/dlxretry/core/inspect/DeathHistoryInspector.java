package com.dlxretry.core.inspect;

import com.dlxretry.exception.MalformedDeathHistoryException;
import com.dlxretry.model.DeathHistory;
import com.dlxretry.model.RetryPolicy;
import com.dlxretry.model.enums.Verdict;

import java.util.Map;
import java.util.Optional;

/**
 * 根据死信历史判定是否还能重试
 * 纯函数, 不抛异常, 同样的输入得到同样的结果
 */
public class DeathHistoryInspector {

    private final RetryPolicy policy;

    private final DeathHistoryReader reader;

    /** 主队列名, 只统计该队列产生的死信; null 统计全部 */
    private final String originQueue;

    public DeathHistoryInspector(RetryPolicy policy, DeathHistoryReader reader, String originQueue) {
        this.policy = policy;
        this.reader = reader;
        this.originQueue = originQueue;
    }

    public Verdict verdict(Map<String, Object> headers) {
        return inspect(headers).getVerdict();
    }

    public Inspection inspect(Map<String, Object> headers) {
        DeathHistory history;
        try {
            history = reader.read(headers);
        } catch (MalformedDeathHistoryException e) {
            return Inspection.malformed(Inspection.MALFORMED_HISTORY, -1, DeathHistory.empty(), e.getMessage());
        }

        Optional<Long> explicit = history.getExplicitRetryCount();
        if (history.isEmpty()) {
            // 计数头声称重试过但没有任何死信记录
            if (explicit.isPresent() && explicit.get() > 0) {
                return Inspection.malformed(Inspection.INCONSISTENT_COUNT, explicit.get(), history,
                        reader.getRetryCountHeader() + "=" + explicit.get() + " without x-death");
            }
            return Inspection.eligible(0, history);
        }

        long deathCount = history.countFrom(originQueue);
        // broker 不会改写发布方写入的计数头, 计数头落后于死信记录说明已过期, 继续采用会无限回流
        if (explicit.isPresent() && explicit.get() < deathCount) {
            return Inspection.malformed(Inspection.INCONSISTENT_COUNT, deathCount, history,
                    reader.getRetryCountHeader() + "=" + explicit.get() + " behind x-death count " + deathCount);
        }
        long retryCount = explicit.orElse(deathCount);
        return policy.allowsRetry(retryCount)
                ? Inspection.eligible(retryCount, history)
                : Inspection.exhausted(retryCount, history);
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    public String getOriginQueue() {
        return originQueue;
    }
}
