package org.nowstart.fundrank.service.ranking;

import lombok.RequiredArgsConstructor;
import org.nowstart.fundrank.data.property.ScoringProperties;
import org.nowstart.fundrank.data.type.Recommendation;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Component;

/**
 * Ordered threshold rules, most restrictive first. The first matching rule wins.
 */
@Component
@RefreshScope
@RequiredArgsConstructor
public class RecommendationClassifier {

    // 펀더멘털 기준점은 30점 만점 기준 20점을 현재 상한에 맞춰 환산
    private static final double FUNDAMENTALS_REFERENCE_CAP = 30.0;
    private static final double FUNDAMENTALS_REFERENCE_FLOOR = 20.0;

    private final ScoringProperties scoringProperties;

    public Recommendation classify(double total, int quartile, double riskTotal, double fundamentalsTotal) {
        if (total >= 70.0 || (total >= 65.0 && quartile == 1 && riskTotal >= 25.0)) {
            return Recommendation.STRONG_BUY;
        }
        if (total >= 60.0 || (total >= 55.0 && quartile <= 2 && fundamentalsTotal >= fundamentalsFloor())) {
            return Recommendation.BUY;
        }
        if (total >= 50.0 || (total >= 45.0 && quartile <= 3 && riskTotal >= 20.0)) {
            return Recommendation.HOLD;
        }
        if (total >= 35.0 || (total >= 30.0 && riskTotal >= 15.0)) {
            return Recommendation.SELL;
        }
        return Recommendation.STRONG_SELL;
    }

    private double fundamentalsFloor() {
        return FUNDAMENTALS_REFERENCE_FLOOR * scoringProperties.fundamentalsCap() / FUNDAMENTALS_REFERENCE_CAP;
    }
}
