package com.dlxretry.autoconfig;

import com.dlxretry.config.DlxGuardProperties;
import com.dlxretry.core.handler.GuardedTaskExecutor;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(DlxGuardProperties.class)
public class DlxGuardAutoConfiguration {

    /**
     * 任务执行统一入口
     */
    @Bean
    @ConditionalOnMissingBean
    public GuardedTaskExecutor guardedTaskExecutor(DlxGuardProperties props) {
        return new GuardedTaskExecutor(props);
    }
}
