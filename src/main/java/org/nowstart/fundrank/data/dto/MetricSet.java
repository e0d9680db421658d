package org.nowstart.fundrank.data.dto;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.nowstart.fundrank.data.type.ReturnPeriod;

/**
 * Point-in-time return and risk statistics of one fund.
 *
 * <p>Every metric is either a finite number or {@code null} when it cannot be derived from the NAV history.
 * Returns, volatility, drawdown, capture ratios and value-at-risk are percentages; Sharpe, Sortino, beta and
 * Calmar are plain ratios. {@link #periodReturns()} holds absolute returns and only contains periods that
 * could be computed.
 */
public record MetricSet(
        String fundId,
        LocalDate asOf,
        int observationCount,
        boolean sufficient,
        Map<ReturnPeriod, Double> periodReturns,
        Double annualizedReturn3y,
        Double annualizedReturn5y,
        Double volatility1y,
        Double volatility3y,
        Double sharpeRatio,
        Double sortinoRatio,
        Double maxDrawdown,
        Double beta,
        Double upCaptureRatio,
        Double downCaptureRatio,
        Double valueAtRisk95,
        Double calmarRatio
) {

    public MetricSet {
        EnumMap<ReturnPeriod, Double> copy = new EnumMap<>(ReturnPeriod.class);
        if (periodReturns != null) {
            periodReturns.forEach((period, value) -> {
                if (value != null && Double.isFinite(value)) {
                    copy.put(period, value);
                }
            });
        }
        periodReturns = Collections.unmodifiableMap(copy);
    }

    public static MetricSet insufficient(String fundId, LocalDate asOf, int observationCount) {
        return new MetricSet(
                fundId,
                asOf,
                observationCount,
                false,
                Map.of(),
                null,
                null,
                null,
                null,
                null,
                null,
                null,
                null,
                null,
                null,
                null,
                null
        );
    }

    public Double periodReturn(ReturnPeriod period) {
        return periodReturns.get(period);
    }

    /**
     * Return used for scoring: CAGR for the multi-year periods, absolute return otherwise.
     */
    public Double scoringReturn(ReturnPeriod period) {
        return switch (period) {
            case YEAR_3 -> annualizedReturn3y;
            case YEAR_5 -> annualizedReturn5y;
            default -> periodReturn(period);
        };
    }

    /**
     * Up capture over down capture, {@code null} when either side is absent or down capture is not positive.
     */
    public Double captureRatio() {
        if (upCaptureRatio == null || downCaptureRatio == null || downCaptureRatio <= 0.0) {
            return null;
        }
        return upCaptureRatio / downCaptureRatio;
    }
}
