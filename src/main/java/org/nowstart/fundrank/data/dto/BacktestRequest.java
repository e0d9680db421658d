package org.nowstart.fundrank.data.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import org.nowstart.fundrank.data.type.RebalancePeriod;

public record BacktestRequest(
        PortfolioAllocation allocation,
        LocalDate startDate,
        LocalDate endDate,
        BigDecimal initialAmount,
        RebalancePeriod rebalancePeriod,
        String benchmarkName
) {

    public BacktestRequest {
        rebalancePeriod = rebalancePeriod == null ? RebalancePeriod.NONE : rebalancePeriod;
        benchmarkName = (benchmarkName == null || benchmarkName.isBlank()) ? null : benchmarkName.trim();
    }
}
