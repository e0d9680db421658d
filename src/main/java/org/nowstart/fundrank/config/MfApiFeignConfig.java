package org.nowstart.fundrank.config;

import feign.Logger;
import feign.Retryer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MfApiFeignConfig {

    // 재시도는 UpstreamCallExecutor가 담당
    @Bean
    public Retryer mfApiRetryer() {
        return Retryer.NEVER_RETRY;
    }

    @Bean
    public Logger.Level mfApiLoggerLevel() {
        return Logger.Level.BASIC;
    }
}
