package org.nowstart.fundrank.data.dto;

public record FundContribution(
        String fundId,
        double weight,
        Double absoluteReturnPct,
        double contributionPct,
        boolean excluded
) {
}
