package com.dlxretry.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 每次结算一行
 */
@TableName("dlx_delivery_history")
@Data
public class DeliveryHistoryEntity {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String consumerId;

    private String queueName;

    /** 逻辑任务标识, 可能为空 */
    private String messageId;

    private Long deliveryTag;

    /**
     * 结算状态
     * 1=ACKED,2=REJECTED,3=TERMINALLY_ACKED,4=QUARANTINED
     */
    private Integer state;

    /** 本次投递前的重试次数 */
    private Long retryCount;

    private Integer maxRetries;

    /** 最近一条死信记录 */
    private String deathReason;

    private String deathQueue;

    /** 死信记录条数 */
    private Integer deathCount;

    private String failureCategory;

    /** 最后一次错误信息（可截断） */
    private String lastError;

    private Boolean redelivered;

    private LocalDateTime createdAt;
}
