package org.nowstart.fundrank.service.ranking;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.fundrank.data.dto.PeerGroupKey;
import org.nowstart.fundrank.data.dto.ScoreRecord;
import org.nowstart.fundrank.service.source.ScoreRecordStore;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class PeerRankingService {

    private final ScoreRecordStore scoreRecordStore;
    private final PeerRankingEngine peerRankingEngine;

    public List<ScoreRecord> rankPeerGroup(String category, String subcategory, LocalDate scoreDate) {
        PeerGroupKey peerGroup = PeerGroupKey.of(category, subcategory);
        List<ScoreRecord> records = scoreRecordStore.findByPeerGroup(scoreDate, peerGroup);
        List<ScoreRecord> ranked = peerRankingEngine.rank(records);
        scoreRecordStore.saveAll(ranked);

        long rankedCount = ranked.stream().filter(ScoreRecord::isRanked).count();
        log.info(
                "event=peer_group_ranked group={} scoreDate={} records={} ranked={}",
                peerGroup.label(),
                scoreDate,
                records.size(),
                rankedCount
        );
        return ranked;
    }

    /**
     * Ranks every peer group that has records on the score date. Returns the number of groups ranked.
     */
    public int rankAllPeerGroups(LocalDate scoreDate) {
        Set<PeerGroupKey> peerGroups = new LinkedHashSet<>();
        scoreRecordStore.findByScoreDate(scoreDate).stream()
                .map(ScoreRecord::peerGroup)
                .filter(Objects::nonNull)
                .forEach(peerGroups::add);

        int rankedGroups = 0;
        for (PeerGroupKey peerGroup : peerGroups) {
            try {
                rankPeerGroup(peerGroup.category(), peerGroup.subcategory(), scoreDate);
                rankedGroups++;
            } catch (Exception e) {
                log.error("Failed to rank peer group={} scoreDate={}", peerGroup.label(), scoreDate, e);
            }
        }
        return rankedGroups;
    }
}
