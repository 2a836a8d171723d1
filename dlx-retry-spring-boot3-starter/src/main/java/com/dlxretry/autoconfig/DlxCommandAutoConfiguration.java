package com.dlxretry.autoconfig;

import com.dlxretry.config.DlxRetryProperties;
import com.dlxretry.core.handler.CommandTaskHandler;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * 内置命令任务, 需显式开启 dlx-retry.command.enabled=true
 */
@AutoConfiguration(before = DlxRetryAutoConfiguration.class)
@EnableConfigurationProperties(DlxRetryProperties.class)
@ConditionalOnProperty(prefix = "dlx-retry.command", name = "enabled", havingValue = "true")
public class DlxCommandAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CommandTaskHandler commandTaskHandler(DlxRetryProperties props) {
        return new CommandTaskHandler(props.getTaskQueue().getName(), props.getCommand().getTimeout());
    }
}
