package com.dlxretry.exception.guard;

import com.dlxretry.model.enums.FailureCategory;

public class DownstreamRateLimitedException extends DownstreamGuardException {
    public DownstreamRateLimitedException(Throwable cause) {
        super("task rate limited", FailureCategory.RATE_LIMITED, cause);
    }
}
