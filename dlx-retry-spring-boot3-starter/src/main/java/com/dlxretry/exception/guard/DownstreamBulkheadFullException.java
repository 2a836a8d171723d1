package com.dlxretry.exception.guard;

import com.dlxretry.model.enums.FailureCategory;

public class DownstreamBulkheadFullException extends DownstreamGuardException {
    public DownstreamBulkheadFullException(Throwable cause) {
        super("task bulkhead full", FailureCategory.BULKHEAD_FULL, cause);
    }
}
