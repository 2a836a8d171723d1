package com.dlxretry.model.ctx;

import com.dlxretry.model.DeathHistory;
import com.dlxretry.model.enums.DeliveryState;
import com.dlxretry.model.enums.FailureCategory;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class DeliveryContext {

    private String consumerId;
    private String queue;
    private String messageId;
    private long deliveryTag;
    private boolean redelivered;
    private Map<String, Object> headers;
    private DeathHistory deathHistory;
    /** 本次投递前已发生的重试次数 */
    private long retryCount;
    private int maxRetries;
    private String err;
    private FailureCategory failureCategory;
    /** 处理中为 RECEIVED, 结算后为结算状态 */
    @Builder.Default
    private DeliveryState state = DeliveryState.RECEIVED;
}
