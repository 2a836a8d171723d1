package com.dlxretry.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;

/**
 * 汇总应用侧注册表, 指标统一带上 application 标签
 * 没有任何注册表时退化为内存版, 保证计数可读
 */
public class DlxMeterRegistryProvider {

    private final CompositeMeterRegistry composite = new CompositeMeterRegistry();

    public DlxMeterRegistryProvider(List<MeterRegistry> discovered, String application) {
        composite.config().commonTags(List.of(Tag.of("application", application)));
        if (discovered != null) {
            discovered.forEach(this::attach);
        }
        if (composite.getRegistries().isEmpty()) {
            composite.add(new SimpleMeterRegistry());
        }
    }

    private void attach(MeterRegistry mr) {
        // 展开嵌套的 composite, 避免重复计数
        if (mr instanceof CompositeMeterRegistry) {
            ((CompositeMeterRegistry) mr).getRegistries().forEach(this::attach);
        } else {
            composite.add(mr);
        }
    }

    public MeterRegistry getRegistry() { return composite; }
}
