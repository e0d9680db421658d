package org.nowstart.fundrank.data.dto;

import java.time.LocalDate;

public record BacktestPoint(
        LocalDate date,
        double portfolioValue,
        Double benchmarkValue,
        double drawdownPct
) {
}
