package org.nowstart.fundrank.service.scoring;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.fundrank.data.dto.CompositeScore;
import org.nowstart.fundrank.data.dto.FundAttributes;
import org.nowstart.fundrank.data.dto.MetricSet;
import org.nowstart.fundrank.data.property.ScoringProperties;
import org.nowstart.fundrank.data.type.ReturnPeriod;
import org.nowstart.fundrank.data.type.ReturnScoringMethod;
import org.nowstart.fundrank.data.type.ScoreComponent;
import org.nowstart.fundrank.data.type.DataStatus;
import org.nowstart.fundrank.data.type.SubScoreGroup;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Component;

@Component
@RefreshScope
@RequiredArgsConstructor
public class CompositeScorer {

    public static final double RETURNS_MAX = 40.0;
    public static final double RISK_MAX = 30.0;
    public static final double TOTAL_MAX = 100.0;

    private static final Map<ReturnPeriod, ScoreComponent> RETURN_COMPONENTS = Map.of(
            ReturnPeriod.MONTH_3, ScoreComponent.RETURN_3M,
            ReturnPeriod.MONTH_6, ScoreComponent.RETURN_6M,
            ReturnPeriod.YEAR_1, ScoreComponent.RETURN_1Y,
            ReturnPeriod.YEAR_3, ScoreComponent.RETURN_3Y,
            ReturnPeriod.YEAR_5, ScoreComponent.RETURN_5Y
    );

    // 8/8 .. 2/8 구간 하한(%), 그 아래는 -5% 이상이면 1/8
    private static final Map<ReturnPeriod, double[]> STEP_BREAKPOINTS = Map.of(
            ReturnPeriod.MONTH_3, new double[] {15, 12, 8, 6, 4, 2, 0},
            ReturnPeriod.MONTH_6, new double[] {12, 8, 6, 4, 2, 0, -2},
            ReturnPeriod.YEAR_1, new double[] {20, 15, 12, 8, 5, 2, 0},
            ReturnPeriod.YEAR_3, new double[] {18, 14, 10, 7, 4, 1, -1},
            ReturnPeriod.YEAR_5, new double[] {16, 12, 9, 6, 3, 0, -2}
    );
    private static final double STEP_FLOOR = -5.0;

    private static final double[] PERCENTILE_BANDS = {5, 10, 20, 30, 40, 50, 60, 70, 80, 90};
    private static final double[] PERCENTILE_SHARES = {1.0, 0.9, 0.8, 0.7, 0.6, 0.5, 0.4, 0.3, 0.2, 0.1};

    private static final double[] VOLATILITY_BANDS = {10, 15, 20, 25};
    private static final double[] SHARPE_BANDS = {2.0, 1.5, 1.0, 0.5};
    private static final double[] DRAWDOWN_BANDS = {5, 10, 15, 25};
    private static final double[] CAPTURE_BANDS = {1.2, 1.0, 0.8, 0.6};
    private static final double[] FOUR_STEP_SHARES = {1.0, 0.75, 0.5, 0.25};

    private static final double[] EQUITY_EXPENSE_BANDS = {1.0, 1.5, 2.0, 2.5};
    private static final double[] DEBT_EXPENSE_BANDS = {0.5, 1.0, 1.5, 2.0};
    private static final double[] HYBRID_EXPENSE_BANDS = {1.2, 1.8, 2.3, 2.8};
    private static final double[] EXPENSE_SHARES = {1.0, 0.7, 0.5, 0.2};

    private static final double[] TRACK_RECORD_BANDS = {10, 5, 3, 1};
    private static final double[] MOMENTUM_BANDS = {5, 0, -5};
    private static final double[] MOMENTUM_SHARES = {1.0, 0.7, 0.4};
    private static final double[] AUM_BANDS = {10000, 5000, 1000, 500, 100};
    private static final double[] AUM_SHARES = {1.0, 0.8, 0.6, 0.4, 0.2};

    private final ScoringProperties scoringProperties;

    public CompositeScore score(
            MetricSet metrics,
            FundAttributes attributes,
            PeerReturnDistribution peers,
            LocalDate scoreDate
    ) {
        Map<ScoreComponent, Double> components = new EnumMap<>(ScoreComponent.class);
        scoreReturns(metrics, peers == null ? PeerReturnDistribution.empty() : peers, components);
        scoreRisk(metrics, components);
        scoreFundamentals(attributes, scoreDate, components);
        scoreOtherMetrics(metrics, attributes, components);

        double returnsTotal = groupTotal(components, SubScoreGroup.RETURNS, RETURNS_MAX);
        double riskTotal = groupTotal(components, SubScoreGroup.RISK, RISK_MAX);
        double fundamentalsTotal = groupTotal(components, SubScoreGroup.FUNDAMENTALS, scoringProperties.fundamentalsCap());
        double otherTotal = groupTotal(components, SubScoreGroup.OTHER, scoringProperties.otherMetricsCap());
        double total = Math.min(TOTAL_MAX, returnsTotal + riskTotal + fundamentalsTotal + otherTotal);

        return new CompositeScore(
                components,
                returnsTotal,
                riskTotal,
                fundamentalsTotal,
                otherTotal,
                total,
                resolveStatus(metrics, components)
        );
    }

    private void scoreReturns(MetricSet metrics, PeerReturnDistribution peers, Map<ScoreComponent, Double> components) {
        RETURN_COMPONENTS.forEach((period, component) -> {
            Double value = metrics.scoringReturn(period);
            if (value == null) {
                return;
            }
            double share = usesPercentile(peers, period)
                    ? percentileShare(peers.percentileOf(period, value))
                    : stepShare(period, value);
            components.put(component, component.getMaxPoints() * share);
        });
    }

    private boolean usesPercentile(PeerReturnDistribution peers, ReturnPeriod period) {
        return scoringProperties.returnMethod() == ReturnScoringMethod.PERCENTILE
                && peers.sampleSize(period) >= scoringProperties.minPeerSample();
    }

    static double stepShare(ReturnPeriod period, double value) {
        double[] breakpoints = STEP_BREAKPOINTS.get(period);
        for (int i = 0; i < breakpoints.length; i++) {
            if (value >= breakpoints[i]) {
                return (8 - i) / 8.0;
            }
        }
        return value >= STEP_FLOOR ? 1 / 8.0 : 0.0;
    }

    static double percentileShare(double percentile) {
        if (!Double.isFinite(percentile)) {
            return 0.0;
        }
        for (int i = 0; i < PERCENTILE_BANDS.length; i++) {
            if (percentile <= PERCENTILE_BANDS[i]) {
                return PERCENTILE_SHARES[i];
            }
        }
        return 0.0;
    }

    private void scoreRisk(MetricSet metrics, Map<ScoreComponent, Double> components) {
        putAtMost(components, ScoreComponent.VOLATILITY, metrics.volatility1y(), VOLATILITY_BANDS, FOUR_STEP_SHARES);
        putAtLeast(components, ScoreComponent.SHARPE, metrics.sharpeRatio(), SHARPE_BANDS, FOUR_STEP_SHARES);
        putAtMost(components, ScoreComponent.MAX_DRAWDOWN, metrics.maxDrawdown(), DRAWDOWN_BANDS, FOUR_STEP_SHARES);
        scoreCapture(metrics, components);
    }

    private void scoreCapture(MetricSet metrics, Map<ScoreComponent, Double> components) {
        Double upCapture = metrics.upCaptureRatio();
        Double downCapture = metrics.downCaptureRatio();
        if (upCapture == null || downCapture == null) {
            return;
        }
        if (downCapture <= 0.0) {
            // 하락일에 이익: 상승 참여가 있으면 최상위 구간, 없으면 0점
            double share = upCapture > 0.0 ? FOUR_STEP_SHARES[0] : 0.0;
            components.put(ScoreComponent.CAPTURE_RATIO, ScoreComponent.CAPTURE_RATIO.getMaxPoints() * share);
            return;
        }
        putAtLeast(components, ScoreComponent.CAPTURE_RATIO, metrics.captureRatio(), CAPTURE_BANDS, FOUR_STEP_SHARES);
    }

    private void scoreFundamentals(FundAttributes attributes, LocalDate scoreDate, Map<ScoreComponent, Double> components) {
        if (attributes == null) {
            return;
        }
        String category = normalize(attributes.category());
        putAtMost(components, ScoreComponent.EXPENSE_RATIO, attributes.expenseRatio(), expenseBands(category), EXPENSE_SHARES);

        Double ageYears = attributes.ageYears(scoreDate);
        putAtLeast(components, ScoreComponent.TRACK_RECORD, ageYears, TRACK_RECORD_BANDS, FOUR_STEP_SHARES);
        if (ageYears != null) {
            double share = ageYears >= maturityYears(category) ? 1.0 : 0.0;
            components.put(ScoreComponent.CATEGORY_MATURITY, ScoreComponent.CATEGORY_MATURITY.getMaxPoints() * share);
        }

        putAtMost(components, ScoreComponent.MINIMUM_INVESTMENT, attributes.minimumInvestment(), new double[] {1000, 5000}, new double[] {1.0, 0.5});
        putAtMost(components, ScoreComponent.EXIT_LOAD, attributes.exitLoad(), new double[] {0.0, 1.0}, new double[] {1.0, 0.5});
    }

    private void scoreOtherMetrics(MetricSet metrics, FundAttributes attributes, Map<ScoreComponent, Double> components) {
        if (attributes != null && attributes.subcategory() != null && !attributes.subcategory().isBlank()) {
            components.put(
                    ScoreComponent.SECTOR_SIMILARITY,
                    ScoreComponent.SECTOR_SIMILARITY.getMaxPoints() * sectorShare(normalize(attributes.subcategory()))
            );
        }

        Double threeMonth = metrics.periodReturn(ReturnPeriod.MONTH_3);
        Double oneYear = metrics.periodReturn(ReturnPeriod.YEAR_1);
        Double momentum = (threeMonth == null || oneYear == null) ? null : threeMonth * 4.0 - oneYear;
        putAtLeast(components, ScoreComponent.MOMENTUM, momentum, MOMENTUM_BANDS, MOMENTUM_SHARES);

        putAtLeast(components, ScoreComponent.AUM_SIZE, attributes == null ? null : attributes.aumCrores(), AUM_BANDS, AUM_SHARES);
    }

    private DataStatus resolveStatus(MetricSet metrics, Map<ScoreComponent, Double> components) {
        if (!metrics.sufficient()) {
            return DataStatus.INSUFFICIENT_DATA;
        }
        for (ScoreComponent component : ScoreComponent.values()) {
            if (component.isMetricDriven() && !components.containsKey(component)) {
                return DataStatus.PARTIAL;
            }
        }
        return DataStatus.COMPLETE;
    }

    private static double groupTotal(Map<ScoreComponent, Double> components, SubScoreGroup group, double cap) {
        double sum = components.entrySet().stream()
                .filter(entry -> entry.getKey().getGroup() == group)
                .mapToDouble(Map.Entry::getValue)
                .sum();
        return Math.min(cap, sum);
    }

    private static void putAtLeast(
            Map<ScoreComponent, Double> components,
            ScoreComponent component,
            Double value,
            double[] floors,
            double[] shares
    ) {
        if (value == null || !Double.isFinite(value)) {
            return;
        }
        double share = 0.0;
        for (int i = 0; i < floors.length; i++) {
            if (value >= floors[i]) {
                share = shares[i];
                break;
            }
        }
        components.put(component, component.getMaxPoints() * share);
    }

    private static void putAtMost(
            Map<ScoreComponent, Double> components,
            ScoreComponent component,
            Double value,
            double[] ceilings,
            double[] shares
    ) {
        if (value == null || !Double.isFinite(value)) {
            return;
        }
        double share = 0.0;
        for (int i = 0; i < ceilings.length; i++) {
            if (value <= ceilings[i]) {
                share = shares[i];
                break;
            }
        }
        components.put(component, component.getMaxPoints() * share);
    }

    private static double[] expenseBands(String category) {
        if (category.contains("debt")) {
            return DEBT_EXPENSE_BANDS;
        }
        if (category.contains("hybrid")) {
            return HYBRID_EXPENSE_BANDS;
        }
        return EQUITY_EXPENSE_BANDS;
    }

    private static double maturityYears(String category) {
        if (category.contains("debt")) {
            return 3.0;
        }
        if (category.contains("hybrid")) {
            return 4.0;
        }
        return 5.0;
    }

    private static double sectorShare(String subcategory) {
        List<String> core = List.of("large cap", "index");
        List<String> diversified = List.of("mid cap", "multi cap", "flexi cap");
        if (core.stream().anyMatch(subcategory::contains)) {
            return 1.0;
        }
        if (diversified.stream().anyMatch(subcategory::contains)) {
            return 0.7;
        }
        return 0.4;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
