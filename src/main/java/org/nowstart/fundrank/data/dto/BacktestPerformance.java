package org.nowstart.fundrank.data.dto;

public record BacktestPerformance(
        double initialAmount,
        double finalValue,
        double totalReturnPct,
        Double annualizedReturnPct,
        Double volatilityPct,
        Double sharpeRatio,
        Double sortinoRatio,
        double maxDrawdownPct,
        Double calmarRatio,
        Double valueAtRisk95Pct,
        int rebalanceCount,
        double transactionCosts
) {
}
