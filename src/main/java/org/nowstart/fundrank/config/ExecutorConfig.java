package org.nowstart.fundrank.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.nowstart.fundrank.data.property.BacktestProperties;
import org.nowstart.fundrank.data.property.ScoringProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
public class ExecutorConfig {

    public static final String SCORING_EXECUTOR = "scoringExecutor";
    public static final String NAV_FETCH_EXECUTOR = "navFetchExecutor";

    @Bean(name = SCORING_EXECUTOR)
    public ExecutorService scoringExecutor(ScoringProperties scoringProperties) {
        return Executors.newFixedThreadPool(
                Math.max(1, scoringProperties.concurrency()),
                new CustomizableThreadFactory("fund-scoring-")
        );
    }

    @Bean(name = NAV_FETCH_EXECUTOR)
    public ExecutorService navFetchExecutor(BacktestProperties backtestProperties) {
        return Executors.newFixedThreadPool(
                Math.max(1, backtestProperties.fetchConcurrency()),
                new CustomizableThreadFactory("nav-fetch-")
        );
    }
}
