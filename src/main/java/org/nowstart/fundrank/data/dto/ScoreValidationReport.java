package org.nowstart.fundrank.data.dto;

import java.time.LocalDate;
import java.util.Map;
import org.nowstart.fundrank.data.type.Recommendation;

public record ScoreValidationReport(
        LocalDate scoreDate,
        int horizonDays,
        PeerGroupKey peerGroup,
        int sampleSize,
        Double scoreReturnCorrelation,
        Map<Integer, Double> meanForwardReturnByQuartile,
        Map<Recommendation, Double> meanForwardReturnByRecommendation,
        Boolean topQuartileOutperformed
) {

    public ScoreValidationReport {
        meanForwardReturnByQuartile = Map.copyOf(meanForwardReturnByQuartile);
        meanForwardReturnByRecommendation = Map.copyOf(meanForwardReturnByRecommendation);
    }
}
