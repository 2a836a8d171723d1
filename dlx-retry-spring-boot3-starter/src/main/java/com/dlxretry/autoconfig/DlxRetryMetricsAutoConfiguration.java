package com.dlxretry.autoconfig;

import com.dlxretry.core.metric.DlxMeterRegistryProvider;
import com.dlxretry.core.metric.DlxRetryMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

import java.util.stream.Collectors;

@AutoConfiguration(afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
public class DlxRetryMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public DlxMeterRegistryProvider dlxMeterRegistryProvider(ObjectProvider<MeterRegistry> discovered, Environment env) {
        return new DlxMeterRegistryProvider(discovered.orderedStream().collect(Collectors.toList()),
                env.getProperty("spring.application.name", "dlx-retry"));
    }

    @Bean
    @ConditionalOnMissingBean
    public DlxRetryMetrics dlxRetryMetrics(DlxMeterRegistryProvider provider) {
        return DlxRetryMetrics.create(provider.getRegistry());
    }
}
