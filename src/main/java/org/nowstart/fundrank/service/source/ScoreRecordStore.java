package org.nowstart.fundrank.service.source;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.nowstart.fundrank.data.dto.PeerGroupKey;
import org.nowstart.fundrank.data.dto.ScoreRecord;

/**
 * Persistence of score records keyed by (fund, score date). Saving replaces any record with the same key.
 */
public interface ScoreRecordStore {

    void save(ScoreRecord record);

    void saveAll(List<ScoreRecord> records);

    Optional<ScoreRecord> find(String fundId, LocalDate scoreDate);

    List<ScoreRecord> findByScoreDate(LocalDate scoreDate);

    List<ScoreRecord> findByPeerGroup(LocalDate scoreDate, PeerGroupKey peerGroup);

    Optional<LocalDate> findLatestScoreDate();
}
