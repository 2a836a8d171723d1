package com.dlxretry.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.dlxretry.model.entity.DeliveryHistoryEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface DeliveryHistoryMapper extends BaseMapper<DeliveryHistoryEntity> {

    /**
     * 某个逻辑任务的全部结算记录, 按发生顺序
     */
    @Select("""
        select * from dlx_delivery_history
        where message_id = #{messageId}
        order by id asc
    """)
    List<DeliveryHistoryEntity> selectByMessageId(@Param("messageId") String messageId);
}
