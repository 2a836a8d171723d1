package com.dlxretry.autoconfig;

import com.baomidou.mybatisplus.extension.spring.MybatisSqlSessionFactoryBean;
import com.dlxretry.core.history.MybatisDeliveryHistoryRecorder;
import com.dlxretry.core.spi.DeliveryHistoryRecorder;
import com.dlxretry.mapper.DeliveryHistoryMapper;
import org.apache.ibatis.session.SqlSessionFactory;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * 投递历史落库, 需显式开启 dlx-retry.history.enabled
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration",
        "com.baomidou.mybatisplus.autoconfigure.MybatisPlusAutoConfiguration"
})
@ConditionalOnClass({
        SqlSessionFactory.class,
        MybatisSqlSessionFactoryBean.class
})
@ConditionalOnBean(DataSource.class)
@ConditionalOnProperty(prefix = "dlx-retry.history", name = "enabled", havingValue = "true")
@MapperScan(basePackages = "com.dlxretry.mapper")
public class DlxRetryMybatisAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(DeliveryHistoryRecorder.class)
    public DeliveryHistoryRecorder deliveryHistoryRecorder(DeliveryHistoryMapper mapper) {
        return new MybatisDeliveryHistoryRecorder(mapper);
    }
}
