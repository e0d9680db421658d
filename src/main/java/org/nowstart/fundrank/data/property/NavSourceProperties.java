package org.nowstart.fundrank.data.property;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.nowstart.fundrank.data.type.NavSourceProvider;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "fundrank.nav-source")
public record NavSourceProperties(
        // NAV 조회 소스(DATABASE 또는 MFAPI)
        @NotNull @DefaultValue("DATABASE") NavSourceProvider provider,
        // MFAPI 기본 URL
        @NotBlank @DefaultValue("https://api.mfapi.in") String baseUrl,
        // 외부 조회 최대 시도 횟수
        @Positive @DefaultValue("3") int maxAttempts,
        // 첫 재시도 대기 시간
        @NotNull @DefaultValue("200ms") Duration initialBackoff,
        // 재시도 대기 배수
        @DecimalMin("1.0") @DefaultValue("2.0") double backoffMultiplier
) {
}
