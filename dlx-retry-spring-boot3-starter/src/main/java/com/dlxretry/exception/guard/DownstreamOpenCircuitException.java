package com.dlxretry.exception.guard;

import com.dlxretry.model.enums.FailureCategory;

/**
 * 熔断打开, 任务未执行
 */
public class DownstreamOpenCircuitException extends DownstreamGuardException {

    public DownstreamOpenCircuitException(Throwable cause) {
        super("task circuit open", FailureCategory.OPEN_CIRCUIT, cause);
    }
}
