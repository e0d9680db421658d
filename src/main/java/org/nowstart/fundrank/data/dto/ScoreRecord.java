package org.nowstart.fundrank.data.dto;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.nowstart.fundrank.data.type.Recommendation;
import org.nowstart.fundrank.data.type.ScoreComponent;
import org.nowstart.fundrank.data.type.DataStatus;

/**
 * Score of one fund on one score date. Ranking fields are {@code null} until the peer group is ranked.
 */
public record ScoreRecord(
        String fundId,
        LocalDate scoreDate,
        PeerGroupKey peerGroup,
        double returnsTotal,
        double riskTotal,
        double fundamentalsTotal,
        double otherTotal,
        double total,
        DataStatus status,
        Map<ScoreComponent, Double> components,
        Integer rank,
        Integer quartile,
        Double percentile,
        Integer peerGroupSize,
        Recommendation recommendation
) {

    public ScoreRecord {
        EnumMap<ScoreComponent, Double> copy = new EnumMap<>(ScoreComponent.class);
        if (components != null) {
            copy.putAll(components);
        }
        components = Collections.unmodifiableMap(copy);
    }

    public static ScoreRecord unranked(String fundId, LocalDate scoreDate, PeerGroupKey peerGroup, CompositeScore score) {
        return new ScoreRecord(
                fundId,
                scoreDate,
                peerGroup,
                score.returnsTotal(),
                score.riskTotal(),
                score.fundamentalsTotal(),
                score.otherTotal(),
                score.total(),
                score.status(),
                score.components(),
                null,
                null,
                null,
                null,
                null
        );
    }

    public ScoreRecord withRanking(int rank, int quartile, double percentile, int peerGroupSize, Recommendation recommendation) {
        return new ScoreRecord(
                fundId,
                scoreDate,
                peerGroup,
                returnsTotal,
                riskTotal,
                fundamentalsTotal,
                otherTotal,
                total,
                status,
                components,
                rank,
                quartile,
                percentile,
                peerGroupSize,
                recommendation
        );
    }

    public ScoreRecord withoutRanking() {
        return new ScoreRecord(
                fundId,
                scoreDate,
                peerGroup,
                returnsTotal,
                riskTotal,
                fundamentalsTotal,
                otherTotal,
                total,
                status,
                components,
                null,
                null,
                null,
                null,
                null
        );
    }

    public boolean isRanked() {
        return rank != null;
    }
}
