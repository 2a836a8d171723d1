package com.dlxretry.autoconfig;

import com.dlxretry.core.outcome.AckOutcomeHandler;
import com.dlxretry.core.outcome.DefaultOutcomeDecider;
import com.dlxretry.core.outcome.OutcomeHandlerFactory;
import com.dlxretry.core.outcome.RejectOutcomeHandler;
import com.dlxretry.core.outcome.TerminalAckOutcomeHandler;
import com.dlxretry.core.spi.outcome.OutcomeDecider;
import com.dlxretry.core.spi.outcome.OutcomeHandler;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.util.List;

@AutoConfiguration
public class OutcomeHandlerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(OutcomeDecider.class)
    public OutcomeDecider outcomeDecider() {
        return new DefaultOutcomeDecider();
    }

    // 默认内置一组结算处理器（用户可通过Bean覆盖/新增）
    @Bean
    @ConditionalOnMissingBean(AckOutcomeHandler.class)
    public AckOutcomeHandler ackOutcomeHandler() { return new AckOutcomeHandler(); }

    @Bean
    @ConditionalOnMissingBean(RejectOutcomeHandler.class)
    public RejectOutcomeHandler rejectOutcomeHandler() { return new RejectOutcomeHandler(); }

    @Bean
    @ConditionalOnMissingBean(TerminalAckOutcomeHandler.class)
    public TerminalAckOutcomeHandler terminalAckOutcomeHandler() { return new TerminalAckOutcomeHandler(); }

    // 注入所有 OutcomeHandler, 后注册的同状态处理器覆盖先注册的
    @Bean
    @ConditionalOnMissingBean(OutcomeHandlerFactory.class)
    public OutcomeHandlerFactory outcomeHandlerFactory(List<OutcomeHandler> handlers) {
        return new OutcomeHandlerFactory(handlers);
    }
}
