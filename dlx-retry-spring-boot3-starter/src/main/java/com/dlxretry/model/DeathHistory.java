package com.dlxretry.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 死信历史, 按时间正序（最早在前, 最近一次在末尾）
 */
public final class DeathHistory {

    private static final DeathHistory EMPTY = new DeathHistory(List.of(), null);

    private final List<DeathRecord> records;

    /** 显式重试计数头, 未携带为 null */
    private final Long explicitRetryCount;

    public DeathHistory(List<DeathRecord> records, Long explicitRetryCount) {
        this.records = records == null ? List.of() : Collections.unmodifiableList(records);
        this.explicitRetryCount = explicitRetryCount;
    }

    public static DeathHistory empty() {
        return EMPTY;
    }

    public List<DeathRecord> getRecords() {
        return records;
    }

    public Optional<Long> getExplicitRetryCount() {
        return Optional.ofNullable(explicitRetryCount);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }

    /** 最近一次死信记录 */
    public Optional<DeathRecord> latest() {
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(records.size() - 1));
    }

    /**
     * 折叠计数求和
     * @param originQueue 只统计该队列产生的记录, null 统计全部
     */
    public long countFrom(String originQueue) {
        return records.stream()
                .filter(r -> originQueue == null || Objects.equals(originQueue, r.getQueue()))
                .mapToLong(DeathRecord::getCount)
                .sum();
    }

    @Override
    public String toString() {
        return "DeathHistory{records=" + records + ", explicitRetryCount=" + explicitRetryCount + "}";
    }
}
