package org.nowstart.fundrank.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.nowstart.fundrank.data.type.ReturnScoringMethod;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "fundrank.scoring")
public record ScoringProperties(
        // 기간 수익률 점수 방식(PERCENTILE 또는 STEP)
        @NotNull @DefaultValue("PERCENTILE") ReturnScoringMethod returnMethod,
        // 백분위 방식 적용 최소 피어 표본 수(미만이면 STEP 사용)
        @Positive @DefaultValue("5") int minPeerSample,
        // 펀더멘털 점수 상한
        @DecimalMin("0") @DecimalMax("30") @DefaultValue("15") double fundamentalsCap,
        // 기타 지표 점수 상한
        @DecimalMin("0") @DecimalMax("30") @DefaultValue("15") double otherMetricsCap,
        // INSUFFICIENT_DATA 레코드 순위 포함 여부
        @DefaultValue("false") boolean rankInsufficientData,
        // 배치 1회당 펀드 수(체크포인트 단위)
        @Positive @DefaultValue("25") int batchSize,
        // 동시 처리 펀드 수 상한
        @Positive @DefaultValue("8") int concurrency,
        // 일괄 채점 스케줄(cron, "-"이면 비활성)
        @NotBlank @DefaultValue("-") String cron
) {
}
