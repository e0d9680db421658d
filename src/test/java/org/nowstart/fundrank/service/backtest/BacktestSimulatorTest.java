package org.nowstart.fundrank.service.backtest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.fundrank.data.dto.AllocationWeight;
import org.nowstart.fundrank.data.dto.BacktestPoint;
import org.nowstart.fundrank.data.dto.BacktestRequest;
import org.nowstart.fundrank.data.dto.BacktestResult;
import org.nowstart.fundrank.data.dto.FundContribution;
import org.nowstart.fundrank.data.dto.NavObservation;
import org.nowstart.fundrank.data.dto.PortfolioAllocation;
import org.nowstart.fundrank.data.property.BacktestProperties;
import org.nowstart.fundrank.data.type.DataStatus;
import org.nowstart.fundrank.data.type.RebalancePeriod;

class BacktestSimulatorTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private final BacktestSimulator simulator = new BacktestSimulator(properties(0.0));

    @Test
    void simulate_singleFundReproducesItsOwnCurve() {
        List<NavObservation> nav = series(START, 100, 105, 110, 95, 120);

        BacktestResult result = simulator.simulate(
                request(START.plusDays(4), RebalancePeriod.NONE, null, weight("A", "1.0")),
                Map.of("A", nav),
                List.of()
        );

        assertThat(result.status()).isEqualTo(DataStatus.COMPLETE);
        assertThat(result.curve()).extracting(BacktestPoint::portfolioValue)
                .containsExactly(100_000.0, 105_000.0, 110_000.0, 95_000.0, 120_000.0);
        assertThat(result.performance().totalReturnPct()).isCloseTo(20.0, within(1e-9));
        assertThat(result.performance().maxDrawdownPct()).isCloseTo(13.636, within(0.001));
        assertThat(result.curve().get(3).drawdownPct()).isCloseTo(13.636, within(0.001));
        assertThat(result.curve().get(4).drawdownPct()).isZero();
    }

    @Test
    void simulate_weightsFundReturnsAndAttributesContribution() {
        BacktestResult result = simulator.simulate(
                request(START.plusDays(1), RebalancePeriod.NONE, null, weight("A", "0.6"), weight("B", "0.4")),
                Map.of(
                        "A", series(START, 100, 110),
                        "B", series(START, 100, 95)
                ),
                List.of()
        );

        assertThat(result.performance().totalReturnPct()).isCloseTo(4.0, within(1e-9));
        assertThat(result.attribution()).extracting(FundContribution::fundId).containsExactly("A", "B");
        assertThat(result.attribution().get(0).contributionPct()).isCloseTo(6.0, within(1e-9));
        assertThat(result.attribution().get(1).contributionPct()).isCloseTo(-2.0, within(1e-9));
        assertThat(result.attribution().get(0).absoluteReturnPct()).isCloseTo(10.0, within(1e-9));
        assertThat(result.totalContributionPct()).isCloseTo(result.performance().totalReturnPct(), within(1e-9));
    }

    @Test
    void simulate_carriesLastNavForwardAcrossMissingDates() {
        BacktestResult result = simulator.simulate(
                request(START.plusDays(2), RebalancePeriod.NONE, null, weight("A", "0.5"), weight("B", "0.5")),
                Map.of(
                        "A", List.of(new NavObservation(START, 10), new NavObservation(START.plusDays(2), 12)),
                        "B", series(START, 20, 22, 24)
                ),
                List.of()
        );

        assertThat(result.curve()).extracting(BacktestPoint::date)
                .containsExactly(START, START.plusDays(1), START.plusDays(2));
        assertThat(result.curve().get(1).portfolioValue()).isCloseTo(50_000 + 55_000, within(1e-6));
        assertThat(result.curve().get(2).portfolioValue()).isCloseTo(60_000 + 60_000, within(1e-6));
    }

    @Test
    void simulate_holdsExcludedFundWeightAsCash() {
        BacktestResult result = simulator.simulate(
                request(START.plusDays(1), RebalancePeriod.NONE, null, weight("A", "0.5"), weight("X", "0.5")),
                Map.of("A", series(START, 100, 110)),
                List.of()
        );

        assertThat(result.status()).isEqualTo(DataStatus.PARTIAL);
        assertThat(result.excludedFundIds()).containsExactly("X");
        assertThat(result.performance().totalReturnPct()).isCloseTo(5.0, within(1e-9));
        assertThat(result.attribution().get(1).excluded()).isTrue();
        assertThat(result.attribution().get(1).contributionPct()).isZero();
    }

    @Test
    void simulate_reportsInsufficientDataWhenNoFundHasNav() {
        BacktestResult result = simulator.simulate(
                request(START.plusDays(10), RebalancePeriod.MONTHLY, null, weight("X", "0.5"), weight("Y", "0.5")),
                Map.of("X", List.of()),
                List.of()
        );

        assertThat(result.status()).isEqualTo(DataStatus.INSUFFICIENT_DATA);
        assertThat(result.curve()).isEmpty();
        assertThat(result.performance()).isNull();
        assertThat(result.excludedFundIds()).containsExactly("X", "Y");
    }

    @Test
    void simulate_defersInvestmentUntilFirstNavOfLateFund() {
        BacktestResult result = simulator.simulate(
                request(START.plusDays(3), RebalancePeriod.NONE, null, weight("A", "0.5"), weight("L", "0.5")),
                Map.of(
                        "A", series(START, 10, 10, 10, 10),
                        "L", List.of(new NavObservation(START.plusDays(2), 50), new NavObservation(START.plusDays(3), 55))
                ),
                List.of()
        );

        assertThat(result.curve().get(1).portfolioValue()).isCloseTo(100_000.0, within(1e-6));
        assertThat(result.curve().get(3).portfolioValue()).isCloseTo(105_000.0, within(1e-6));
        assertThat(result.totalContributionPct()).isCloseTo(result.performance().totalReturnPct(), within(1e-9));
    }

    @Test
    void simulate_rebalancesOnEachMonthlyBoundary() {
        LocalDate end = LocalDate.of(2024, 12, 31);
        List<NavObservation> growing = new ArrayList<>();
        List<NavObservation> flat = new ArrayList<>();
        for (LocalDate date = START; !date.isAfter(end); date = date.plusDays(1)) {
            growing.add(new NavObservation(date, 100.0 * Math.pow(1.001, date.toEpochDay() - START.toEpochDay())));
            flat.add(new NavObservation(date, 100.0));
        }

        BacktestResult result = simulator.simulate(
                request(end, RebalancePeriod.MONTHLY, null, weight("G", "0.5"), weight("F", "0.5")),
                Map.of("G", growing, "F", flat),
                List.of()
        );
        BacktestResult buyAndHold = simulator.simulate(
                request(end, RebalancePeriod.NONE, null, weight("G", "0.5"), weight("F", "0.5")),
                Map.of("G", growing, "F", flat),
                List.of()
        );

        assertThat(result.performance().rebalanceCount()).isEqualTo(11);
        assertThat(buyAndHold.performance().rebalanceCount()).isZero();
        assertThat(result.performance().finalValue()).isLessThan(buyAndHold.performance().finalValue());
        assertThat(result.totalContributionPct()).isCloseTo(result.performance().totalReturnPct(), within(1e-9));
    }

    @Test
    void simulate_chargesTransactionCostsOnRebalanceTurnover() {
        BacktestSimulator costly = new BacktestSimulator(properties(0.01));
        List<NavObservation> a = List.of(new NavObservation(START, 100), new NavObservation(START.plusMonths(1), 200));
        List<NavObservation> b = List.of(new NavObservation(START, 100), new NavObservation(START.plusMonths(1), 100));

        BacktestResult result = costly.simulate(
                request(START.plusMonths(1), RebalancePeriod.MONTHLY, null, weight("A", "0.5"), weight("B", "0.5")),
                Map.of("A", a, "B", b),
                List.of()
        );

        // 150k before rebalancing, 25k moved out of A and 25k into B
        assertThat(result.performance().transactionCosts()).isCloseTo(500.0, within(1e-6));
        assertThat(result.performance().finalValue()).isCloseTo(149_500.0, within(1e-6));
        assertThat(result.totalContributionPct()).isCloseTo(result.performance().totalReturnPct(), within(1e-9));
    }

    @Test
    void simulate_comparesAgainstBenchmark() {
        List<NavObservation> nav = series(START, 100, 102, 101, 104, 103, 106);

        BacktestResult result = simulator.simulate(
                request(START.plusDays(5), RebalancePeriod.NONE, "NIFTY 50 TRI", weight("A", "1.0")),
                Map.of("A", nav),
                nav
        );

        assertThat(result.benchmark()).isNotNull();
        assertThat(result.benchmark().benchmarkReturnPct()).isCloseTo(6.0, within(1e-9));
        assertThat(result.benchmark().beta()).isCloseTo(1.0, within(1e-9));
        assertThat(result.benchmark().alphaPct()).isCloseTo(0.0, within(1e-6));
        assertThat(result.benchmark().trackingErrorPct()).isCloseTo(0.0, within(1e-9));
        assertThat(result.benchmark().informationRatio()).isNull();
        assertThat(result.curve().get(5).benchmarkValue()).isCloseTo(106_000.0, within(1e-6));
    }

    @Test
    void simulate_omitsBenchmarkComparisonWhenNotRequested() {
        BacktestResult result = simulator.simulate(
                request(START.plusDays(1), RebalancePeriod.NONE, null, weight("A", "1.0")),
                Map.of("A", series(START, 100, 101)),
                series(START, 100, 101)
        );

        assertThat(result.benchmark()).isNull();
    }

    private static BacktestProperties properties(double transactionCostRate) {
        return new BacktestProperties(0.06, 0.01, transactionCostRate, 30, Duration.ofSeconds(30), 4);
    }

    private static BacktestRequest request(
            LocalDate end,
            RebalancePeriod rebalancePeriod,
            String benchmarkName,
            AllocationWeight... weights
    ) {
        return new BacktestRequest(
                new PortfolioAllocation("test", List.of(weights)),
                START,
                end,
                new BigDecimal("100000"),
                rebalancePeriod,
                benchmarkName
        );
    }

    private static AllocationWeight weight(String fundId, String weight) {
        return new AllocationWeight(fundId, new BigDecimal(weight));
    }

    private static List<NavObservation> series(LocalDate first, double... values) {
        List<NavObservation> series = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            series.add(new NavObservation(first.plusDays(i), values[i]));
        }
        return series;
    }
}
