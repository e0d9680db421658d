package org.nowstart.fundrank.config;

import org.nowstart.fundrank.repository.MfApiFeignClient;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableFeignClients(basePackageClasses = MfApiFeignClient.class)
public class FeignClientsConfig {
}
