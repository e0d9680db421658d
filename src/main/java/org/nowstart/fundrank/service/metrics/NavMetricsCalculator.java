package org.nowstart.fundrank.service.metrics;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.fundrank.data.dto.MetricSet;
import org.nowstart.fundrank.data.dto.NavObservation;
import org.nowstart.fundrank.data.property.MetricsProperties;
import org.nowstart.fundrank.data.type.ReturnPeriod;
import org.nowstart.fundrank.service.source.NavSeries;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RefreshScope
@RequiredArgsConstructor
public class NavMetricsCalculator {

    private static final int ONE_YEAR_DAYS = 365;
    private static final int THREE_YEAR_DAYS = 1095;

    private final MetricsProperties metricsProperties;

    public MetricSet calculate(
            String fundId,
            LocalDate asOf,
            List<NavObservation> navSeries,
            List<NavObservation> benchmarkSeries
    ) {
        List<NavObservation> series = upTo(navSeries, asOf);
        if (series.size() < metricsProperties.minObservations()) {
            log.debug("Insufficient NAV history. fund={}, asOf={}, observations={}", fundId, asOf, series.size());
            return MetricSet.insufficient(fundId, asOf, series.size());
        }

        NavObservation latest = series.get(series.size() - 1);
        if (latest.date().isBefore(asOf.minusDays(metricsProperties.maxStalenessDays()))) {
            log.debug("Stale NAV history. fund={}, asOf={}, latestNavDate={}", fundId, asOf, latest.date());
            return MetricSet.insufficient(fundId, asOf, series.size());
        }

        Map<ReturnPeriod, Double> periodReturns = new EnumMap<>(ReturnPeriod.class);
        Map<ReturnPeriod, Double> annualizedReturns = new EnumMap<>(ReturnPeriod.class);
        for (ReturnPeriod period : ReturnPeriod.values()) {
            NavObservation base = NavSeries.closestObservation(series, period.targetDate(asOf), period.getToleranceDays(), latest.date());
            if (base == null) {
                continue;
            }
            periodReturns.put(period, (latest.value() / base.value() - 1.0) * 100.0);
            if (period.isAnnualized()) {
                long days = ChronoUnit.DAYS.between(base.date(), latest.date());
                Double annualized = ReturnStatistics.finiteOrNull(
                        ReturnStatistics.annualizedReturnPct(base.value(), latest.value(), days)
                );
                if (annualized != null) {
                    annualizedReturns.put(period, annualized);
                }
            }
        }

        List<DatedReturn> dailyReturns = dailyReturns(series);
        double[] returns1y = returnsAfter(dailyReturns, asOf.minusDays(ONE_YEAR_DAYS));
        double[] returns3y = returnsAfter(dailyReturns, asOf.minusDays(THREE_YEAR_DAYS));
        int minReturns = metricsProperties.minDailyReturns();
        double riskFreeRate = metricsProperties.riskFreeRate();
        boolean enough1y = returns1y.length >= minReturns;

        Double volatility1y = enough1y ? ReturnStatistics.finiteOrNull(ReturnStatistics.annualizedVolatilityPct(returns1y)) : null;
        Double volatility3y = returns3y.length >= minReturns * 3
                ? ReturnStatistics.finiteOrNull(ReturnStatistics.annualizedVolatilityPct(returns3y))
                : null;
        Double sharpe = enough1y ? ReturnStatistics.finiteOrNull(ReturnStatistics.sharpeRatio(returns1y, riskFreeRate)) : null;
        Double sortino = enough1y ? ReturnStatistics.finiteOrNull(ReturnStatistics.sortinoRatio(returns1y, riskFreeRate)) : null;
        Double valueAtRisk = enough1y ? ReturnStatistics.finiteOrNull(ReturnStatistics.valueAtRisk95Pct(returns1y)) : null;

        double[] drawdownWindow = series.stream()
                .filter(point -> point.date().isAfter(asOf.minusDays(metricsProperties.drawdownWindowDays())))
                .mapToDouble(NavObservation::value)
                .toArray();
        Double maxDrawdown = drawdownWindow.length < 2
                ? null
                : ReturnStatistics.finiteOrNull(ReturnStatistics.maxDrawdownPct(drawdownWindow));

        Double oneYearReturn = periodReturns.get(ReturnPeriod.YEAR_1);
        Double calmar = (oneYearReturn != null && maxDrawdown != null && maxDrawdown > 0.0)
                ? oneYearReturn / maxDrawdown
                : null;

        BenchmarkStats benchmarkStats = benchmarkStats(series, benchmarkSeries, asOf.minusDays(ONE_YEAR_DAYS));

        return new MetricSet(
                fundId,
                asOf,
                series.size(),
                true,
                periodReturns,
                annualizedReturns.get(ReturnPeriod.YEAR_3),
                annualizedReturns.get(ReturnPeriod.YEAR_5),
                volatility1y,
                volatility3y,
                sharpe,
                sortino,
                maxDrawdown,
                benchmarkStats.beta(),
                benchmarkStats.upCapture(),
                benchmarkStats.downCapture(),
                valueAtRisk,
                calmar
        );
    }

    private List<NavObservation> upTo(List<NavObservation> navSeries, LocalDate asOf) {
        if (navSeries == null) {
            return List.of();
        }
        return navSeries.stream()
                .filter(point -> point != null && point.isValid() && !point.date().isAfter(asOf))
                .sorted(Comparator.comparing(NavObservation::date))
                .toList();
    }

    private List<DatedReturn> dailyReturns(List<NavObservation> series) {
        double bound = metricsProperties.outlierReturnBound();
        List<DatedReturn> returns = new ArrayList<>(series.size());
        int outliers = 0;
        for (int i = 1; i < series.size(); i++) {
            double value = series.get(i).value() / series.get(i - 1).value() - 1.0;
            if (Math.abs(value) >= bound) {
                outliers++;
                continue;
            }
            returns.add(new DatedReturn(series.get(i).date(), value));
        }
        if (outliers > 0) {
            log.debug("Excluded outlier daily returns. count={}, bound={}", outliers, bound);
        }
        return returns;
    }

    private double[] returnsAfter(List<DatedReturn> returns, LocalDate windowStart) {
        return returns.stream()
                .filter(daily -> daily.date().isAfter(windowStart))
                .mapToDouble(DatedReturn::value)
                .toArray();
    }

    private BenchmarkStats benchmarkStats(
            List<NavObservation> series,
            List<NavObservation> benchmarkSeries,
            LocalDate windowStart
    ) {
        if (benchmarkSeries == null || benchmarkSeries.isEmpty()) {
            return BenchmarkStats.EMPTY;
        }

        Map<LocalDate, Double> benchmarkByDate = new HashMap<>();
        for (NavObservation point : benchmarkSeries) {
            if (point != null && point.isValid()) {
                benchmarkByDate.putIfAbsent(point.date(), point.value());
            }
        }

        double bound = metricsProperties.outlierReturnBound();
        List<double[]> pairs = new ArrayList<>();
        for (int i = 1; i < series.size(); i++) {
            NavObservation previous = series.get(i - 1);
            NavObservation current = series.get(i);
            Double previousBenchmark = benchmarkByDate.get(previous.date());
            Double currentBenchmark = benchmarkByDate.get(current.date());
            if (!current.date().isAfter(windowStart) || previousBenchmark == null || currentBenchmark == null) {
                continue;
            }
            double fundReturn = current.value() / previous.value() - 1.0;
            double benchmarkReturn = currentBenchmark / previousBenchmark - 1.0;
            if (Math.abs(fundReturn) >= bound || Math.abs(benchmarkReturn) >= bound) {
                continue;
            }
            pairs.add(new double[] {fundReturn, benchmarkReturn});
        }

        if (pairs.size() < metricsProperties.minDailyReturns()) {
            return BenchmarkStats.EMPTY;
        }

        double[] fundReturns = pairs.stream().mapToDouble(pair -> pair[0]).toArray();
        double[] benchmarkReturns = pairs.stream().mapToDouble(pair -> pair[1]).toArray();
        double benchmarkVariance = Math.pow(ReturnStatistics.sampleStdev(benchmarkReturns), 2);
        Double beta = benchmarkVariance > 0.0
                ? ReturnStatistics.finiteOrNull(ReturnStatistics.sampleCovariance(fundReturns, benchmarkReturns) / benchmarkVariance)
                : null;

        return new BenchmarkStats(
                beta,
                ReturnStatistics.finiteOrNull(ReturnStatistics.captureRatioPct(fundReturns, benchmarkReturns, true)),
                ReturnStatistics.finiteOrNull(ReturnStatistics.captureRatioPct(fundReturns, benchmarkReturns, false))
        );
    }

    private record DatedReturn(LocalDate date, double value) {
    }

    private record BenchmarkStats(Double beta, Double upCapture, Double downCapture) {

        private static final BenchmarkStats EMPTY = new BenchmarkStats(null, null, null);
    }
}
