package org.nowstart.fundrank.data.type;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ScoreComponent {
    RETURN_3M(SubScoreGroup.RETURNS, 5.0, true),
    RETURN_6M(SubScoreGroup.RETURNS, 10.0, true),
    RETURN_1Y(SubScoreGroup.RETURNS, 10.0, true),
    RETURN_3Y(SubScoreGroup.RETURNS, 8.0, true),
    RETURN_5Y(SubScoreGroup.RETURNS, 7.0, true),
    VOLATILITY(SubScoreGroup.RISK, 8.0, true),
    SHARPE(SubScoreGroup.RISK, 8.0, true),
    MAX_DRAWDOWN(SubScoreGroup.RISK, 8.0, true),
    CAPTURE_RATIO(SubScoreGroup.RISK, 6.0, true),
    EXPENSE_RATIO(SubScoreGroup.FUNDAMENTALS, 5.0, false),
    TRACK_RECORD(SubScoreGroup.FUNDAMENTALS, 4.0, false),
    MINIMUM_INVESTMENT(SubScoreGroup.FUNDAMENTALS, 2.0, false),
    EXIT_LOAD(SubScoreGroup.FUNDAMENTALS, 2.0, false),
    CATEGORY_MATURITY(SubScoreGroup.FUNDAMENTALS, 2.0, false),
    SECTOR_SIMILARITY(SubScoreGroup.OTHER, 5.0, false),
    MOMENTUM(SubScoreGroup.OTHER, 5.0, true),
    AUM_SIZE(SubScoreGroup.OTHER, 5.0, false);

    private final SubScoreGroup group;
    private final double maxPoints;
    // NAV 지표 기반 여부(없으면 PARTIAL 판정에 사용)
    private final boolean metricDriven;
}
