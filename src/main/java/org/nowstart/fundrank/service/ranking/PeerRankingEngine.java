package org.nowstart.fundrank.service.ranking;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import org.nowstart.fundrank.data.dto.PeerGroupKey;
import org.nowstart.fundrank.data.dto.ScoreRecord;
import org.nowstart.fundrank.data.exception.InvalidInputException;
import org.nowstart.fundrank.data.property.ScoringProperties;
import org.nowstart.fundrank.data.type.DataStatus;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Component;

@Component
@RefreshScope
@RequiredArgsConstructor
public class PeerRankingEngine {

    static final Comparator<ScoreRecord> RANK_ORDER = Comparator
            .comparingDouble(ScoreRecord::total).reversed()
            .thenComparing(ScoreRecord::fundId);

    private final RecommendationClassifier recommendationClassifier;
    private final ScoringProperties scoringProperties;

    /**
     * Ranks the records of a single peer group. Records left out of the ranking come back with
     * their ranking fields cleared, after the ranked ones.
     */
    public List<ScoreRecord> rank(List<ScoreRecord> records) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        requireSinglePeerGroup(records);

        List<ScoreRecord> eligible = records.stream()
                .filter(this::isRankable)
                .sorted(RANK_ORDER)
                .toList();

        int groupSize = eligible.size();
        List<ScoreRecord> result = new ArrayList<>(records.size());
        for (int i = 0; i < groupSize; i++) {
            ScoreRecord record = eligible.get(i);
            int rank = i + 1;
            int quartile = quartile(rank, groupSize);
            result.add(record.withRanking(
                    rank,
                    quartile,
                    rank * 100.0 / groupSize,
                    groupSize,
                    recommendationClassifier.classify(record.total(), quartile, record.riskTotal(), record.fundamentalsTotal())
            ));
        }

        records.stream()
                .filter(record -> !isRankable(record))
                .sorted(RANK_ORDER)
                .map(ScoreRecord::withoutRanking)
                .forEach(result::add);
        return result;
    }

    /**
     * Quartile from the boundaries ceil(n/4), ceil(n/2) and ceil(3n/4).
     */
    public static int quartile(int rank, int groupSize) {
        int firstBoundary = (groupSize + 3) / 4;
        int secondBoundary = (groupSize + 1) / 2;
        int thirdBoundary = (3 * groupSize + 3) / 4;
        if (rank <= firstBoundary) {
            return 1;
        }
        if (rank <= secondBoundary) {
            return 2;
        }
        if (rank <= thirdBoundary) {
            return 3;
        }
        return 4;
    }

    private boolean isRankable(ScoreRecord record) {
        return scoringProperties.rankInsufficientData() || record.status() != DataStatus.INSUFFICIENT_DATA;
    }

    private void requireSinglePeerGroup(List<ScoreRecord> records) {
        PeerGroupKey peerGroup = records.get(0).peerGroup();
        if (peerGroup == null) {
            throw new InvalidInputException(
                    InvalidInputException.INVALID_PEER_GROUP,
                    "Cannot rank fund without peer group: " + records.get(0).fundId()
            );
        }
        for (ScoreRecord record : records) {
            if (!Objects.equals(peerGroup, record.peerGroup())) {
                throw new InvalidInputException(
                        InvalidInputException.INVALID_PEER_GROUP,
                        "Mixed peer groups in ranking input: " + peerGroup.label() + " and "
                                + (record.peerGroup() == null ? "none" : record.peerGroup().label())
                );
            }
        }
    }
}
