package io.invoicebot.server.automation;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AutomationConfig {

    @Bean
    @ConditionalOnMissingBean(DecisionOracle.class)
    public DecisionOracle heuristicDecisionOracle() {
        return new HeuristicDecisionOracle();
    }

    @Bean
    @ConditionalOnMissingBean(Sleeper.class)
    public Sleeper backoffSleeper() {
        return Sleeper.threadSleep();
    }
}
