package org.nowstart.fundrank.service.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToDoubleFunction;
import org.junit.jupiter.api.Test;
import org.nowstart.fundrank.data.dto.MetricSet;
import org.nowstart.fundrank.data.dto.NavObservation;
import org.nowstart.fundrank.data.property.MetricsProperties;
import org.nowstart.fundrank.data.type.ReturnPeriod;

class NavMetricsCalculatorTest {

    private static final LocalDate AS_OF = LocalDate.of(2024, 6, 28);
    private static final String FUND = "120503";

    private final NavMetricsCalculator calculator = new NavMetricsCalculator(
            new MetricsProperties(60, 150, 0.2, 0.06, 10, 1095)
    );

    @Test
    void calculate_returnsInsufficientSetBelowMinimumObservations() {
        List<NavObservation> series = dailySeries(59, day -> 100.0 + day);

        MetricSet metrics = calculator.calculate(FUND, AS_OF, series, List.of());

        assertThat(metrics.sufficient()).isFalse();
        assertThat(metrics.observationCount()).isEqualTo(59);
        assertThat(metrics.periodReturns()).isEmpty();
        assertThat(metrics.volatility1y()).isNull();
        assertThat(metrics.sharpeRatio()).isNull();
    }

    @Test
    void calculate_returnsInsufficientSetWhenLatestNavIsStale() {
        List<NavObservation> series = new ArrayList<>();
        for (int day = 0; day < 400; day++) {
            series.add(new NavObservation(AS_OF.minusDays(20 + day), 100.0));
        }

        MetricSet metrics = calculator.calculate(FUND, AS_OF, series, List.of());

        assertThat(metrics.sufficient()).isFalse();
        assertThat(metrics.periodReturns()).isEmpty();
    }

    @Test
    void calculate_computesPeriodReturnsFromObservationAtLookback() {
        List<NavObservation> series = dailySeries(800, day -> 100.0 * Math.pow(1.0005, day));

        MetricSet metrics = calculator.calculate(FUND, AS_OF, series, List.of());

        assertThat(metrics.sufficient()).isTrue();
        assertThat(metrics.periodReturn(ReturnPeriod.MONTH_3))
                .isCloseTo((Math.pow(1.0005, 90) - 1.0) * 100.0, within(1e-9));
        assertThat(metrics.periodReturn(ReturnPeriod.YEAR_1))
                .isCloseTo((Math.pow(1.0005, 365) - 1.0) * 100.0, within(1e-9));
        assertThat(metrics.periodReturn(ReturnPeriod.YEAR_3)).isNull();
        assertThat(metrics.periodReturn(ReturnPeriod.YEAR_5)).isNull();
        assertThat(metrics.annualizedReturn3y()).isNull();
        assertThat(metrics.maxDrawdown()).isZero();
    }

    @Test
    void calculate_usesClosestObservationWithinToleranceAndPrefersEarlierOnTie() {
        LocalDate target = ReturnPeriod.MONTH_3.targetDate(AS_OF);
        List<NavObservation> series = new ArrayList<>();
        for (NavObservation point : dailySeries(400, day -> 100.0 + day)) {
            long offset = point.date().toEpochDay() - target.toEpochDay();
            if (Math.abs(offset) < 10) {
                continue;
            }
            series.add(point);
        }
        NavObservation latest = series.get(series.size() - 1);
        NavObservation base = series.stream()
                .filter(point -> point.date().equals(target.minusDays(10)))
                .findFirst()
                .orElseThrow();

        MetricSet metrics = calculator.calculate(FUND, AS_OF, series, List.of());

        assertThat(metrics.periodReturn(ReturnPeriod.MONTH_3))
                .isCloseTo((latest.value() / base.value() - 1.0) * 100.0, within(1e-9));
    }

    @Test
    void calculate_leavesPeriodAbsentWhenNoObservationWithinTolerance() {
        LocalDate target = ReturnPeriod.MONTH_3.targetDate(AS_OF);
        List<NavObservation> series = dailySeries(400, day -> 100.0 + day).stream()
                .filter(point -> Math.abs(point.date().toEpochDay() - target.toEpochDay()) > 10)
                .toList();

        MetricSet metrics = calculator.calculate(FUND, AS_OF, series, List.of());

        assertThat(metrics.sufficient()).isTrue();
        assertThat(metrics.periodReturn(ReturnPeriod.MONTH_3)).isNull();
        assertThat(metrics.periodReturn(ReturnPeriod.YEAR_1)).isNotNull();
    }

    @Test
    void calculate_excludesOutlierDailyReturnsFromVolatility() {
        List<NavObservation> series = dailySeries(400, NavMetricsCalculatorTest::alternatingLevel);
        List<NavObservation> withJump = dailySeries(400, day -> alternatingLevel(day) * (day >= 200 ? 1.5 : 1.0));

        MetricSet clean = calculator.calculate(FUND, AS_OF, series, List.of());
        MetricSet jumped = calculator.calculate(FUND, AS_OF, withJump, List.of());

        assertThat(clean.volatility1y()).isBetween(11.0, 13.0);
        assertThat(jumped.volatility1y()).isBetween(11.0, 13.0);
        assertThat(jumped.sharpeRatio()).isNotNull();
    }

    @Test
    void calculate_isDeterministicForSameInputs() {
        List<NavObservation> series = dailySeries(800, NavMetricsCalculatorTest::alternatingLevel);

        MetricSet first = calculator.calculate(FUND, AS_OF, series, series);
        MetricSet second = calculator.calculate(FUND, AS_OF, new ArrayList<>(series), series);

        assertThat(first).isEqualTo(second);
    }

    @Test
    void calculate_derivesBetaAndCaptureAgainstIdenticalBenchmark() {
        List<NavObservation> series = dailySeries(800, NavMetricsCalculatorTest::alternatingLevel);

        MetricSet metrics = calculator.calculate(FUND, AS_OF, series, series);

        assertThat(metrics.beta()).isCloseTo(1.0, within(1e-9));
        assertThat(metrics.upCaptureRatio()).isCloseTo(100.0, within(1e-9));
        assertThat(metrics.downCaptureRatio()).isCloseTo(100.0, within(1e-9));
        assertThat(metrics.captureRatio()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void calculate_leavesBenchmarkStatisticsAbsentWithoutBenchmark() {
        MetricSet metrics = calculator.calculate(FUND, AS_OF, dailySeries(800, NavMetricsCalculatorTest::alternatingLevel), List.of());

        assertThat(metrics.beta()).isNull();
        assertThat(metrics.upCaptureRatio()).isNull();
        assertThat(metrics.captureRatio()).isNull();
    }

    @Test
    void calculate_ignoresObservationsAfterAsOf() {
        List<NavObservation> series = new ArrayList<>(dailySeries(400, day -> 100.0));
        series.add(new NavObservation(AS_OF.plusDays(1), 500.0));

        MetricSet metrics = calculator.calculate(FUND, AS_OF, series, List.of());

        assertThat(metrics.observationCount()).isEqualTo(400);
        assertThat(metrics.periodReturn(ReturnPeriod.MONTH_3)).isZero();
    }

    private static double alternatingLevel(int day) {
        double level = 100.0;
        for (int i = 1; i <= day; i++) {
            level *= i % 2 == 0 ? 0.995 : 1.01;
        }
        return level;
    }

    // day 0 is the oldest observation, the last one falls on AS_OF
    private static List<NavObservation> dailySeries(int count, IntToDoubleFunction level) {
        List<NavObservation> series = new ArrayList<>(count);
        for (int day = 0; day < count; day++) {
            series.add(new NavObservation(AS_OF.minusDays(count - 1 - day), level.applyAsDouble(day)));
        }
        return series;
    }
}
