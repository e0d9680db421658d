package org.nowstart.fundrank.service.source;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.nowstart.fundrank.data.dto.PeerGroupKey;
import org.nowstart.fundrank.data.dto.ScoreRecord;
import org.nowstart.fundrank.data.entity.FundScore;
import org.nowstart.fundrank.data.type.ScoreComponent;
import org.nowstart.fundrank.repository.FundScoreRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
public class JpaScoreRecordStore implements ScoreRecordStore {

    private static final int SCORE_SCALE = 4;

    private final FundScoreRepository fundScoreRepository;

    @Override
    @Transactional
    public void save(ScoreRecord record) {
        fundScoreRepository.save(toEntity(record));
    }

    @Override
    @Transactional
    public void saveAll(List<ScoreRecord> records) {
        fundScoreRepository.saveAll(records.stream().map(this::toEntity).toList());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ScoreRecord> find(String fundId, LocalDate scoreDate) {
        return fundScoreRepository.findByIdFundIdAndIdScoreDate(fundId, scoreDate).map(JpaScoreRecordStore::toRecord);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScoreRecord> findByScoreDate(LocalDate scoreDate) {
        return fundScoreRepository.findByIdScoreDate(scoreDate).stream()
                .map(JpaScoreRecordStore::toRecord)
                .sorted(Comparator.comparing(ScoreRecord::fundId))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LocalDate> findLatestScoreDate() {
        return fundScoreRepository.findFirstByOrderByIdScoreDateDesc().map(score -> score.getId().scoreDate());
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScoreRecord> findByPeerGroup(LocalDate scoreDate, PeerGroupKey peerGroup) {
        List<FundScore> rows = peerGroup.subcategory() == null
                ? fundScoreRepository.findByIdScoreDateAndCategoryAndSubcategoryIsNull(scoreDate, peerGroup.category())
                : fundScoreRepository.findByIdScoreDateAndCategoryAndSubcategory(
                        scoreDate,
                        peerGroup.category(),
                        peerGroup.subcategory()
                );
        return rows.stream()
                .map(JpaScoreRecordStore::toRecord)
                .sorted(Comparator.comparing(ScoreRecord::fundId))
                .toList();
    }

    private FundScore toEntity(ScoreRecord record) {
        FundScore.FundScoreKey key = new FundScore.FundScoreKey(record.fundId(), record.scoreDate());
        FundScore entity = fundScoreRepository.findById(key)
                .orElseGet(() -> FundScore.builder().id(key).build());

        entity.setCategory(record.peerGroup() == null ? null : record.peerGroup().category());
        entity.setSubcategory(record.peerGroup() == null ? null : record.peerGroup().subcategory());
        entity.setReturnsTotal(toDecimal(record.returnsTotal()));
        entity.setRiskTotal(toDecimal(record.riskTotal()));
        entity.setFundamentalsTotal(toDecimal(record.fundamentalsTotal()));
        entity.setOtherTotal(toDecimal(record.otherTotal()));
        entity.setTotal(toDecimal(record.total()));
        entity.setStatus(record.status());
        entity.getComponents().clear();
        record.components().forEach((component, points) -> entity.getComponents().put(component, toDecimal(points)));
        entity.setPeerRank(record.rank());
        entity.setQuartile(record.quartile());
        entity.setPercentile(record.percentile() == null ? null : toDecimal(record.percentile()));
        entity.setPeerGroupSize(record.peerGroupSize());
        entity.setRecommendation(record.recommendation());
        return entity;
    }

    static ScoreRecord toRecord(FundScore entity) {
        Map<ScoreComponent, Double> components = new EnumMap<>(ScoreComponent.class);
        entity.getComponents().forEach((component, points) -> components.put(component, toDouble(points)));
        PeerGroupKey peerGroup = entity.getCategory() == null
                ? null
                : PeerGroupKey.of(entity.getCategory(), entity.getSubcategory());

        return new ScoreRecord(
                entity.getId().fundId(),
                entity.getId().scoreDate(),
                peerGroup,
                toDouble(entity.getReturnsTotal()),
                toDouble(entity.getRiskTotal()),
                toDouble(entity.getFundamentalsTotal()),
                toDouble(entity.getOtherTotal()),
                toDouble(entity.getTotal()),
                entity.getStatus(),
                components,
                entity.getPeerRank(),
                entity.getQuartile(),
                entity.getPercentile() == null ? null : entity.getPercentile().doubleValue(),
                entity.getPeerGroupSize(),
                entity.getRecommendation()
        );
    }

    private static BigDecimal toDecimal(double value) {
        return BigDecimal.valueOf(value).setScale(SCORE_SCALE, RoundingMode.HALF_UP);
    }

    private static double toDouble(BigDecimal value) {
        return value == null ? 0.0 : value.doubleValue();
    }
}
