package org.nowstart.fundrank.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "fundrank.backtest")
public record BacktestProperties(
        // 샤프/알파 계산용 연 무위험 수익률
        @DecimalMin("0") @DefaultValue("0.06") double riskFreeRate,
        // 비중 합계 허용 오차(1.0 ± tolerance)
        @DecimalMin("0") @DecimalMax("0.1") @DefaultValue("0.01") double weightTolerance,
        // 리밸런싱 거래비용률(회전율 기준, 0이면 미반영)
        @DecimalMin("0") @DecimalMax("0.1") @DefaultValue("0") double transactionCostRate,
        // 시작일 이전 NAV 이월 조회 일수
        @PositiveOrZero @DefaultValue("30") int navLookbackDays,
        // 펀드별 NAV 조회 타임아웃
        @NotNull @DefaultValue("30s") Duration fetchTimeout,
        // NAV 병렬 조회 스레드 수
        @Positive @DefaultValue("4") int fetchConcurrency
) {
}
