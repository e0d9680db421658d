package org.nowstart.fundrank.service.ranking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.nowstart.fundrank.data.dto.PeerGroupKey;
import org.nowstart.fundrank.data.dto.ScoreRecord;
import org.nowstart.fundrank.data.exception.InvalidInputException;
import org.nowstart.fundrank.data.property.ScoringProperties;
import org.nowstart.fundrank.data.type.DataStatus;
import org.nowstart.fundrank.data.type.Recommendation;
import org.nowstart.fundrank.data.type.ReturnScoringMethod;

class PeerRankingEngineTest {

    private static final LocalDate SCORE_DATE = LocalDate.of(2024, 6, 28);
    private static final PeerGroupKey GROUP = PeerGroupKey.of("Equity", "Large Cap");

    private final PeerRankingEngine engine = engine(false);

    @Test
    void rank_assignsRanksQuartilesAndRecommendations() {
        double[] totals = {90, 85, 80, 75, 70, 60, 50};
        List<ScoreRecord> records = new ArrayList<>();
        for (int i = totals.length - 1; i >= 0; i--) {
            records.add(record("F" + (i + 1), totals[i], DataStatus.COMPLETE));
        }

        List<ScoreRecord> ranked = engine.rank(records);

        assertThat(ranked).extracting(ScoreRecord::fundId).containsExactly("F1", "F2", "F3", "F4", "F5", "F6", "F7");
        assertThat(ranked).extracting(ScoreRecord::rank).containsExactly(1, 2, 3, 4, 5, 6, 7);
        assertThat(ranked).extracting(ScoreRecord::quartile).containsExactly(1, 1, 2, 2, 3, 3, 4);
        assertThat(ranked).extracting(ScoreRecord::peerGroupSize).containsOnly(7);
        assertThat(ranked.get(0).percentile()).isCloseTo(100.0 / 7, within(1e-9));
        assertThat(ranked.get(6).percentile()).isCloseTo(100.0, within(1e-9));
        assertThat(ranked).extracting(ScoreRecord::recommendation).containsExactly(
                Recommendation.STRONG_BUY,
                Recommendation.STRONG_BUY,
                Recommendation.STRONG_BUY,
                Recommendation.STRONG_BUY,
                Recommendation.STRONG_BUY,
                Recommendation.BUY,
                Recommendation.HOLD
        );
    }

    @Test
    void rank_breaksTiesByFundId() {
        List<ScoreRecord> ranked = engine.rank(List.of(
                record("C", 70, DataStatus.COMPLETE),
                record("A", 70, DataStatus.COMPLETE),
                record("B", 80, DataStatus.COMPLETE)
        ));

        assertThat(ranked).extracting(ScoreRecord::fundId).containsExactly("B", "A", "C");
        assertThat(ranked).extracting(ScoreRecord::rank).containsExactly(1, 2, 3);
    }

    @Test
    void rank_excludesInsufficientDataByDefault() {
        List<ScoreRecord> ranked = engine.rank(List.of(
                record("A", 60, DataStatus.COMPLETE),
                record("B", 95, DataStatus.INSUFFICIENT_DATA).withRanking(1, 1, 50.0, 2, Recommendation.STRONG_BUY),
                record("C", 55, DataStatus.PARTIAL)
        ));

        assertThat(ranked).extracting(ScoreRecord::fundId).containsExactly("A", "C", "B");
        assertThat(ranked.get(0).peerGroupSize()).isEqualTo(2);
        assertThat(ranked.get(2).isRanked()).isFalse();
        assertThat(ranked.get(2).quartile()).isNull();
        assertThat(ranked.get(2).recommendation()).isNull();
    }

    @Test
    void rank_includesInsufficientDataWhenConfigured() {
        List<ScoreRecord> ranked = engine(true).rank(List.of(
                record("A", 60, DataStatus.COMPLETE),
                record("B", 10, DataStatus.INSUFFICIENT_DATA)
        ));

        assertThat(ranked).allMatch(ScoreRecord::isRanked);
        assertThat(ranked).extracting(ScoreRecord::rank).containsExactly(1, 2);
    }

    @Test
    void rank_producesPermutationOfRanks() {
        List<ScoreRecord> records = new ArrayList<>();
        for (int i = 0; i < 23; i++) {
            records.add(record(String.format("F%02d", i), (i * 37) % 100, DataStatus.COMPLETE));
        }

        List<ScoreRecord> ranked = engine.rank(records);

        assertThat(ranked).extracting(ScoreRecord::rank)
                .containsExactlyInAnyOrderElementsOf(IntStream.rangeClosed(1, 23).boxed().toList());
        for (int i = 1; i < ranked.size(); i++) {
            assertThat(ranked.get(i).total()).isLessThanOrEqualTo(ranked.get(i - 1).total());
            assertThat(ranked.get(i).quartile()).isGreaterThanOrEqualTo(ranked.get(i - 1).quartile());
        }
    }

    @Test
    void rank_rejectsMixedPeerGroups() {
        ScoreRecord other = new ScoreRecord(
                "X",
                SCORE_DATE,
                PeerGroupKey.of("Debt", null),
                0,
                0,
                0,
                0,
                50,
                DataStatus.COMPLETE,
                Map.of(),
                null,
                null,
                null,
                null,
                null
        );

        assertThatThrownBy(() -> engine.rank(List.of(record("A", 60, DataStatus.COMPLETE), other)))
                .isInstanceOf(InvalidInputException.class)
                .hasFieldOrPropertyWithValue("code", InvalidInputException.INVALID_PEER_GROUP);
    }

    @Test
    void rank_returnsEmptyForEmptyInput() {
        assertThat(engine.rank(List.of())).isEmpty();
    }

    @Test
    void quartile_usesCeilingBoundaries() {
        assertThat(PeerRankingEngine.quartile(1, 1)).isEqualTo(1);
        assertThat(PeerRankingEngine.quartile(1, 2)).isEqualTo(1);
        assertThat(PeerRankingEngine.quartile(2, 2)).isEqualTo(3);
        assertThat(PeerRankingEngine.quartile(3, 4)).isEqualTo(3);
        assertThat(PeerRankingEngine.quartile(4, 4)).isEqualTo(4);
        assertThat(PeerRankingEngine.quartile(3, 10)).isEqualTo(1);
        assertThat(PeerRankingEngine.quartile(4, 10)).isEqualTo(2);
    }

    private static PeerRankingEngine engine(boolean rankInsufficientData) {
        ScoringProperties properties = new ScoringProperties(
                ReturnScoringMethod.PERCENTILE,
                5,
                15,
                15,
                rankInsufficientData,
                25,
                8,
                "-"
        );
        return new PeerRankingEngine(new RecommendationClassifier(properties), properties);
    }

    private static ScoreRecord record(String fundId, double total, DataStatus status) {
        return new ScoreRecord(
                fundId,
                SCORE_DATE,
                GROUP,
                0,
                0,
                0,
                0,
                total,
                status,
                Map.of(),
                null,
                null,
                null,
                null,
                null
        );
    }
}
