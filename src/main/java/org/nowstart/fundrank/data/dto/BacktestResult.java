package org.nowstart.fundrank.data.dto;

import java.util.List;
import org.nowstart.fundrank.data.type.DataStatus;

/**
 * Simulated portfolio run. {@code performance} is {@code null} when no fund in the allocation had NAV data
 * in range; {@code benchmark} is {@code null} when no benchmark was requested or none could be aligned.
 */
public record BacktestResult(
        BacktestRequest request,
        DataStatus status,
        List<BacktestPoint> curve,
        BacktestPerformance performance,
        BenchmarkComparison benchmark,
        List<FundContribution> attribution,
        List<String> excludedFundIds
) {

    public BacktestResult {
        curve = List.copyOf(curve);
        attribution = List.copyOf(attribution);
        excludedFundIds = List.copyOf(excludedFundIds);
    }

    public double totalContributionPct() {
        return attribution.stream().mapToDouble(FundContribution::contributionPct).sum();
    }
}
