package org.nowstart.fundrank.service.ranking;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.nowstart.fundrank.data.property.ScoringProperties;
import org.nowstart.fundrank.data.type.Recommendation;
import org.nowstart.fundrank.data.type.ReturnScoringMethod;

class RecommendationClassifierTest {

    private final RecommendationClassifier classifier = new RecommendationClassifier(
            new ScoringProperties(ReturnScoringMethod.PERCENTILE, 5, 15, 15, false, 25, 8, "-")
    );

    @Test
    void classify_appliesTotalThresholds() {
        assertThat(classifier.classify(75, 4, 0, 0)).isEqualTo(Recommendation.STRONG_BUY);
        assertThat(classifier.classify(62, 4, 0, 0)).isEqualTo(Recommendation.BUY);
        assertThat(classifier.classify(52, 4, 0, 0)).isEqualTo(Recommendation.HOLD);
        assertThat(classifier.classify(40, 4, 0, 0)).isEqualTo(Recommendation.SELL);
        assertThat(classifier.classify(20, 1, 30, 15)).isEqualTo(Recommendation.STRONG_SELL);
    }

    @Test
    void classify_promotesTopQuartileWithStrongRisk() {
        assertThat(classifier.classify(66, 1, 26, 0)).isEqualTo(Recommendation.STRONG_BUY);
        assertThat(classifier.classify(66, 2, 26, 0)).isEqualTo(Recommendation.BUY);
    }

    @Test
    void classify_scalesFundamentalsFloorToConfiguredCap() {
        assertThat(classifier.classify(56, 2, 0, 10.0)).isEqualTo(Recommendation.BUY);
        assertThat(classifier.classify(56, 2, 0, 9.9)).isEqualTo(Recommendation.HOLD);
    }

    @Test
    void classify_appliesHoldAndSellAlternatives() {
        assertThat(classifier.classify(47, 3, 21, 0)).isEqualTo(Recommendation.HOLD);
        assertThat(classifier.classify(47, 4, 21, 0)).isEqualTo(Recommendation.SELL);
        assertThat(classifier.classify(31, 4, 15, 0)).isEqualTo(Recommendation.SELL);
        assertThat(classifier.classify(31, 4, 14, 0)).isEqualTo(Recommendation.STRONG_SELL);
    }

    @Test
    void classify_neverWeakensAsTotalRises() {
        for (int quartile = 1; quartile <= 4; quartile++) {
            Recommendation previous = Recommendation.STRONG_SELL;
            for (int total = 0; total <= 100; total++) {
                Recommendation current = classifier.classify(total, quartile, 22, 8);
                assertThat(current.isAtLeast(previous)).isTrue();
                previous = current;
            }
        }
    }
}
