package org.nowstart.fundrank.service.backtest;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.fundrank.data.dto.AllocationWeight;
import org.nowstart.fundrank.data.dto.BacktestPerformance;
import org.nowstart.fundrank.data.dto.BacktestPoint;
import org.nowstart.fundrank.data.dto.BacktestRequest;
import org.nowstart.fundrank.data.dto.BacktestResult;
import org.nowstart.fundrank.data.dto.BenchmarkComparison;
import org.nowstart.fundrank.data.dto.FundContribution;
import org.nowstart.fundrank.data.dto.NavObservation;
import org.nowstart.fundrank.data.property.BacktestProperties;
import org.nowstart.fundrank.data.type.DataStatus;
import org.nowstart.fundrank.data.type.RebalancePeriod;
import org.nowstart.fundrank.service.metrics.ReturnStatistics;
import org.springframework.stereotype.Component;

/**
 * Replays a weighted basket over the union of its funds' NAV dates.
 *
 * <p>Each sleeve holds units bought at the last known NAV (carried forward across missing dates). A sleeve
 * whose fund has no NAV yet holds its amount flat until the first observation. Funds without any NAV in range
 * are excluded and their weight stays uninvested cash.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BacktestSimulator {

    private final BacktestProperties backtestProperties;

    public BacktestResult simulate(
            BacktestRequest request,
            Map<String, List<NavObservation>> navSeriesByFund,
            List<NavObservation> benchmarkSeries
    ) {
        LocalDate start = request.startDate();
        LocalDate end = request.endDate();
        double initialAmount = request.initialAmount().doubleValue();
        double weightSum = request.allocation().totalWeight().doubleValue();

        List<Sleeve> sleeves = new ArrayList<>();
        List<String> excludedFundIds = new ArrayList<>();
        double cashWeight = 0.0;
        for (AllocationWeight allocationWeight : request.allocation().weights()) {
            double weight = allocationWeight.weight().doubleValue() / weightSum;
            List<NavObservation> series = upTo(navSeriesByFund.get(allocationWeight.fundId()), end);
            if (series.isEmpty()) {
                excludedFundIds.add(allocationWeight.fundId());
                cashWeight += weight;
                continue;
            }
            sleeves.add(new Sleeve(allocationWeight.fundId(), weight, series));
        }

        if (!excludedFundIds.isEmpty()) {
            log.warn("Funds without NAV data in range are held as cash. excluded={}, start={}, end={}", excludedFundIds, start, end);
        }
        if (sleeves.isEmpty()) {
            return insufficientResult(request, excludedFundIds);
        }

        TreeSet<LocalDate> curveDates = new TreeSet<>();
        curveDates.add(start);
        for (Sleeve sleeve : sleeves) {
            sleeve.series().stream()
                    .map(NavObservation::date)
                    .filter(date -> date.isAfter(start))
                    .forEach(curveDates::add);
        }

        SeriesCursor benchmark = new SeriesCursor(upTo(benchmarkSeries, end));
        Double benchmarkBase = null;

        for (Sleeve sleeve : sleeves) {
            sleeve.advanceTo(start);
            sleeve.allocate(sleeve.weight() * initialAmount);
        }
        double cash = cashWeight * initialAmount;

        RebalancePeriod rebalancePeriod = request.rebalancePeriod();
        int boundaryIndex = 1;
        LocalDate nextBoundary = rebalancePeriod.rebalances() ? rebalancePeriod.boundary(start, boundaryIndex) : null;
        int rebalanceCount = 0;
        double transactionCosts = 0.0;
        double peak = initialAmount;
        List<BacktestPoint> curve = new ArrayList<>(curveDates.size());

        for (LocalDate date : curveDates) {
            double value = cash;
            for (Sleeve sleeve : sleeves) {
                sleeve.advanceTo(date);
                value += sleeve.value();
            }

            if (nextBoundary != null && !date.isBefore(nextBoundary)) {
                double[] costs = new double[sleeves.size()];
                double cost = 0.0;
                for (int i = 0; i < sleeves.size(); i++) {
                    costs[i] = turnoverCost(sleeves.get(i), value);
                    cost += costs[i];
                }
                double rebalancedValue = value - cost;
                for (int i = 0; i < sleeves.size(); i++) {
                    Sleeve sleeve = sleeves.get(i);
                    sleeve.closePeriod(costs[i]);
                    sleeve.allocate(sleeve.weight() * rebalancedValue);
                }
                value = rebalancedValue;
                transactionCosts += cost;
                cash = cashWeight * value;
                rebalanceCount++;
                while (!date.isBefore(nextBoundary)) {
                    boundaryIndex++;
                    nextBoundary = rebalancePeriod.boundary(start, boundaryIndex);
                }
            }

            Double benchmarkLevel = benchmark.advanceTo(date);
            if (benchmarkBase == null && benchmarkLevel != null) {
                benchmarkBase = benchmarkLevel;
            }
            Double benchmarkValue = benchmarkLevel == null ? null : initialAmount * benchmarkLevel / benchmarkBase;

            peak = Math.max(peak, value);
            curve.add(new BacktestPoint(date, value, benchmarkValue, peak > 0.0 ? (peak - value) / peak * 100.0 : 0.0));
        }

        List<FundContribution> attribution = new ArrayList<>();
        for (AllocationWeight allocationWeight : request.allocation().weights()) {
            double weight = allocationWeight.weight().doubleValue() / weightSum;
            Sleeve sleeve = sleeves.stream()
                    .filter(candidate -> candidate.fundId().equals(allocationWeight.fundId()))
                    .findFirst()
                    .orElse(null);
            if (sleeve == null) {
                attribution.add(new FundContribution(allocationWeight.fundId(), weight, null, 0.0, true));
                continue;
            }
            sleeve.closePeriod(0.0);
            attribution.add(new FundContribution(
                    sleeve.fundId(),
                    weight,
                    sleeve.absoluteReturnPct(),
                    sleeve.profit() / initialAmount * 100.0,
                    false
            ));
        }

        BacktestPerformance performance = performance(curve, initialAmount, start, end, rebalanceCount, transactionCosts);
        BenchmarkComparison comparison = request.benchmarkName() == null
                ? null
                : benchmarkComparison(request.benchmarkName(), curve, start, end, performance);

        log.info(
                "event=backtest_simulated portfolio={} start={} end={} points={} totalReturnPct={} rebalances={}",
                request.allocation().name(),
                start,
                end,
                curve.size(),
                performance.totalReturnPct(),
                rebalanceCount
        );

        return new BacktestResult(
                request,
                excludedFundIds.isEmpty() ? DataStatus.COMPLETE : DataStatus.PARTIAL,
                curve,
                performance,
                comparison,
                attribution,
                excludedFundIds
        );
    }

    private double turnoverCost(Sleeve sleeve, double portfolioValue) {
        double rate = backtestProperties.transactionCostRate();
        if (rate <= 0.0) {
            return 0.0;
        }
        return Math.abs(sleeve.weight() * portfolioValue - sleeve.value()) * rate;
    }

    private BacktestPerformance performance(
            List<BacktestPoint> curve,
            double initialAmount,
            LocalDate start,
            LocalDate end,
            int rebalanceCount,
            double transactionCosts
    ) {
        double[] values = curve.stream().mapToDouble(BacktestPoint::portfolioValue).toArray();
        double[] returns = periodReturns(values);
        double finalValue = values[values.length - 1];
        double riskFreeRate = backtestProperties.riskFreeRate();

        Double annualizedReturn = ReturnStatistics.finiteOrNull(
                ReturnStatistics.annualizedReturnPct(initialAmount, finalValue, ChronoUnit.DAYS.between(start, end))
        );
        double maxDrawdown = ReturnStatistics.maxDrawdownPct(values);
        Double calmar = (annualizedReturn != null && maxDrawdown > 0.0) ? annualizedReturn / maxDrawdown : null;

        return new BacktestPerformance(
                initialAmount,
                finalValue,
                (finalValue / initialAmount - 1.0) * 100.0,
                annualizedReturn,
                ReturnStatistics.finiteOrNull(ReturnStatistics.annualizedVolatilityPct(returns)),
                ReturnStatistics.finiteOrNull(ReturnStatistics.sharpeRatio(returns, riskFreeRate)),
                ReturnStatistics.finiteOrNull(ReturnStatistics.sortinoRatio(returns, riskFreeRate)),
                maxDrawdown,
                calmar,
                ReturnStatistics.finiteOrNull(ReturnStatistics.valueAtRisk95Pct(returns)),
                rebalanceCount,
                transactionCosts
        );
    }

    private BenchmarkComparison benchmarkComparison(
            String benchmarkName,
            List<BacktestPoint> curve,
            LocalDate start,
            LocalDate end,
            BacktestPerformance performance
    ) {
        List<BacktestPoint> aligned = curve.stream()
                .filter(point -> point.benchmarkValue() != null)
                .toList();
        if (aligned.isEmpty()) {
            log.warn("No benchmark levels aligned with backtest curve. benchmark={}, start={}, end={}", benchmarkName, start, end);
            return null;
        }

        double[] portfolioValues = aligned.stream().mapToDouble(BacktestPoint::portfolioValue).toArray();
        double[] benchmarkValues = aligned.stream().mapToDouble(BacktestPoint::benchmarkValue).toArray();
        double[] portfolioReturns = periodReturns(portfolioValues);
        double[] benchmarkReturns = periodReturns(benchmarkValues);
        double[] activeReturns = new double[portfolioReturns.length];
        for (int i = 0; i < activeReturns.length; i++) {
            activeReturns[i] = portfolioReturns[i] - benchmarkReturns[i];
        }

        double benchmarkVariance = Math.pow(ReturnStatistics.sampleStdev(benchmarkReturns), 2);
        Double beta = benchmarkVariance > 0.0
                ? ReturnStatistics.finiteOrNull(ReturnStatistics.sampleCovariance(portfolioReturns, benchmarkReturns) / benchmarkVariance)
                : null;

        double benchmarkStart = benchmarkValues[0];
        double benchmarkEnd = benchmarkValues[benchmarkValues.length - 1];
        Double benchmarkAnnualized = ReturnStatistics.finiteOrNull(
                ReturnStatistics.annualizedReturnPct(benchmarkStart, benchmarkEnd, ChronoUnit.DAYS.between(start, end))
        );
        double riskFreePct = backtestProperties.riskFreeRate() * 100.0;
        Double alpha = (beta == null || benchmarkAnnualized == null || performance.annualizedReturnPct() == null)
                ? null
                : performance.annualizedReturnPct() - (riskFreePct + beta * (benchmarkAnnualized - riskFreePct));

        double activeStdev = ReturnStatistics.sampleStdev(activeReturns);
        Double trackingError = ReturnStatistics.finiteOrNull(activeStdev * Math.sqrt(ReturnStatistics.TRADING_DAYS_PER_YEAR) * 100.0);
        Double informationRatio = (Double.isFinite(activeStdev) && activeStdev > 0.0)
                ? ReturnStatistics.mean(activeReturns) * ReturnStatistics.TRADING_DAYS_PER_YEAR
                        / (activeStdev * Math.sqrt(ReturnStatistics.TRADING_DAYS_PER_YEAR))
                : null;

        return new BenchmarkComparison(
                benchmarkName,
                (benchmarkEnd / benchmarkStart - 1.0) * 100.0,
                alpha,
                beta,
                trackingError,
                informationRatio,
                ReturnStatistics.finiteOrNull(ReturnStatistics.captureRatioPct(portfolioReturns, benchmarkReturns, true)),
                ReturnStatistics.finiteOrNull(ReturnStatistics.captureRatioPct(portfolioReturns, benchmarkReturns, false))
        );
    }

    private BacktestResult insufficientResult(BacktestRequest request, List<String> excludedFundIds) {
        log.warn(
                "No fund in allocation has NAV data in range. portfolio={}, start={}, end={}",
                request.allocation().name(),
                request.startDate(),
                request.endDate()
        );
        double weightSum = request.allocation().totalWeight().doubleValue();
        List<FundContribution> attribution = request.allocation().weights().stream()
                .map(weight -> new FundContribution(weight.fundId(), weight.weight().doubleValue() / weightSum, null, 0.0, true))
                .toList();
        return new BacktestResult(request, DataStatus.INSUFFICIENT_DATA, List.of(), null, null, attribution, excludedFundIds);
    }

    private static double[] periodReturns(double[] values) {
        if (values.length < 2) {
            return new double[0];
        }
        double[] returns = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            returns[i - 1] = values[i] / values[i - 1] - 1.0;
        }
        return returns;
    }

    private static List<NavObservation> upTo(List<NavObservation> series, LocalDate end) {
        if (series == null) {
            return List.of();
        }
        return series.stream()
                .filter(point -> point != null && point.isValid() && !point.date().isAfter(end))
                .sorted(Comparator.comparing(NavObservation::date))
                .toList();
    }

    private static final class SeriesCursor {

        private final List<NavObservation> series;
        private int position = -1;

        private SeriesCursor(List<NavObservation> series) {
            this.series = series;
        }

        private Double advanceTo(LocalDate date) {
            while (position + 1 < series.size() && !series.get(position + 1).date().isAfter(date)) {
                position++;
            }
            return position < 0 ? null : series.get(position).value();
        }
    }

    private static final class Sleeve {

        private final String fundId;
        private final double weight;
        private final List<NavObservation> series;
        private final SeriesCursor cursor;
        private Double currentNav;
        private Double firstNav;
        private double units;
        private double pendingCash;
        private double periodStartValue;
        private double profit;

        private Sleeve(String fundId, double weight, List<NavObservation> series) {
            this.fundId = fundId;
            this.weight = weight;
            this.series = series;
            this.cursor = new SeriesCursor(series);
        }

        private void advanceTo(LocalDate date) {
            currentNav = cursor.advanceTo(date);
            if (currentNav == null) {
                return;
            }
            if (firstNav == null) {
                firstNav = currentNav;
            }
            if (pendingCash > 0.0) {
                units += pendingCash / currentNav;
                pendingCash = 0.0;
            }
        }

        private void allocate(double amount) {
            periodStartValue = amount;
            if (currentNav == null) {
                units = 0.0;
                pendingCash = amount;
                return;
            }
            units = amount / currentNav;
            pendingCash = 0.0;
        }

        // 리밸런싱 비용은 해당 슬리브 손익에서 차감
        private void closePeriod(double cost) {
            double value = value();
            profit += value - periodStartValue - cost;
            periodStartValue = value;
        }

        private double value() {
            return currentNav == null ? pendingCash : units * currentNav + pendingCash;
        }

        private Double absoluteReturnPct() {
            if (firstNav == null || currentNav == null) {
                return null;
            }
            return (currentNav / firstNav - 1.0) * 100.0;
        }

        private String fundId() {
            return fundId;
        }

        private double weight() {
            return weight;
        }

        private List<NavObservation> series() {
            return series;
        }

        private double profit() {
            return profit;
        }
    }
}
