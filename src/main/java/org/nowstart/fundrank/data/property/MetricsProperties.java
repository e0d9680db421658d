package org.nowstart.fundrank.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "fundrank.metrics")
public record MetricsProperties(
        // 지표 계산 최소 NAV 관측치 수(미만이면 전체 지표 없음)
        @Positive @DefaultValue("60") int minObservations,
        // 변동성/샤프/베타 계산 최소 일간 수익률 수(3Y 변동성은 3배)
        @Positive @DefaultValue("150") int minDailyReturns,
        // 이상치로 제외할 일간 수익률 절대값 경계
        @DecimalMin(value = "0", inclusive = false) @DecimalMax("1.0") @DefaultValue("0.2") double outlierReturnBound,
        // 연 무위험 수익률(예: 0.06 = 6%)
        @DecimalMin("0") @DefaultValue("0.06") double riskFreeRate,
        // 기준일 대비 최신 NAV 허용 지연 일수
        @Positive @DefaultValue("10") int maxStalenessDays,
        // 최대 낙폭 계산 구간(일)
        @Positive @DefaultValue("1095") int drawdownWindowDays
) {
}
