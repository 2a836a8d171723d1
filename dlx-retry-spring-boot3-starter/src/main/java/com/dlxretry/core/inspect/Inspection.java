package com.dlxretry.core.inspect;

import com.dlxretry.model.DeathHistory;
import com.dlxretry.model.enums.Verdict;
import lombok.Getter;
import lombok.ToString;

/**
 * 一次判定的结果
 */
@Getter
@ToString
public final class Inspection {

    public static final String MAX_RETRIES_REACHED = "MAX_RETRIES_REACHED";
    public static final String MALFORMED_HISTORY = "MALFORMED_HISTORY";
    public static final String INCONSISTENT_COUNT = "INCONSISTENT_COUNT";

    private final Verdict verdict;

    /** 已发生的重试次数, 历史无法解析时为 -1 */
    private final long retryCount;

    private final boolean malformed;

    private final String reasonCode;

    /** 无法解析时为空历史 */
    private final DeathHistory history;

    /** 解析失败原因 */
    private final String detail;

    private Inspection(Verdict verdict, long retryCount, boolean malformed, String reasonCode,
                       DeathHistory history, String detail) {
        this.verdict = verdict;
        this.retryCount = retryCount;
        this.malformed = malformed;
        this.reasonCode = reasonCode;
        this.history = history;
        this.detail = detail;
    }

    static Inspection eligible(long retryCount, DeathHistory history) {
        return new Inspection(Verdict.RETRY_ELIGIBLE, retryCount, false, null, history, null);
    }

    static Inspection exhausted(long retryCount, DeathHistory history) {
        return new Inspection(Verdict.RETRIES_EXHAUSTED, retryCount, false, MAX_RETRIES_REACHED, history, null);
    }

    static Inspection malformed(String reasonCode, long retryCount, DeathHistory history, String detail) {
        return new Inspection(Verdict.RETRIES_EXHAUSTED, retryCount, true, reasonCode, history, detail);
    }

    public boolean isRetryEligible() {
        return verdict == Verdict.RETRY_ELIGIBLE;
    }
}
