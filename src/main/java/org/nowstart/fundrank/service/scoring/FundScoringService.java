package org.nowstart.fundrank.service.scoring;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.fundrank.data.dto.CompositeScore;
import org.nowstart.fundrank.data.dto.FundAttributes;
import org.nowstart.fundrank.data.dto.MetricSet;
import org.nowstart.fundrank.data.dto.ScoreRecord;
import org.nowstart.fundrank.data.exception.FundrankException;
import org.nowstart.fundrank.data.exception.InvalidInputException;
import org.nowstart.fundrank.data.property.ScoringProperties;
import org.nowstart.fundrank.data.type.ReturnScoringMethod;
import org.nowstart.fundrank.service.metrics.FundMetricsService;
import org.nowstart.fundrank.service.source.FundAttributesReader;
import org.nowstart.fundrank.service.source.ScoreRecordStore;
import org.nowstart.fundrank.service.source.UpstreamCallExecutor;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RefreshScope
@RequiredArgsConstructor
public class FundScoringService {

    private final FundMetricsService fundMetricsService;
    private final FundAttributesReader fundAttributesReader;
    private final UpstreamCallExecutor upstreamCallExecutor;
    private final CompositeScorer compositeScorer;
    private final ScoreRecordStore scoreRecordStore;
    private final ScoringProperties scoringProperties;

    /**
     * Scores one fund for the score date and replaces any stored record for the same key.
     * The stored record is unranked until its peer group is ranked again.
     */
    public ScoreRecord computeScore(String fundId, LocalDate scoreDate) {
        FundAttributes attributes = fundMetricsService.requireAttributes(fundId);
        requireCurrentScoreDate(scoreDate);
        MetricSet metrics = fundMetricsService.computeMetrics(attributes, scoreDate);
        PeerReturnDistribution peers = loadPeerDistribution(attributes, metrics, scoreDate);

        ScoreRecord record = score(attributes, metrics, peers, scoreDate);
        scoreRecordStore.save(record);
        log.info(
                "event=fund_scored fund={} scoreDate={} total={} status={}",
                fundId,
                scoreDate,
                record.total(),
                record.status()
        );
        return record;
    }

    /**
     * Records of a score date older than the latest stored one are history and are never rewritten.
     * The latest date itself can be scored again.
     */
    public void requireCurrentScoreDate(LocalDate scoreDate) {
        Optional<LocalDate> latest = scoreRecordStore.findLatestScoreDate();
        if (latest.isPresent() && scoreDate.isBefore(latest.get())) {
            throw new InvalidInputException(
                    InvalidInputException.HISTORICAL_SCORE_DATE,
                    "Score date " + scoreDate + " is older than the latest stored score date " + latest.get()
            );
        }
    }

    public ScoreRecord score(
            FundAttributes attributes,
            MetricSet metrics,
            PeerReturnDistribution peers,
            LocalDate scoreDate
    ) {
        CompositeScore score = compositeScorer.score(metrics, attributes, peers, scoreDate);
        return ScoreRecord.unranked(
                attributes.fundId(),
                scoreDate,
                attributes.hasPeerGroup() ? attributes.peerGroup() : null,
                score
        );
    }

    private PeerReturnDistribution loadPeerDistribution(FundAttributes attributes, MetricSet metrics, LocalDate scoreDate) {
        if (scoringProperties.returnMethod() != ReturnScoringMethod.PERCENTILE || !attributes.hasPeerGroup()) {
            return PeerReturnDistribution.empty();
        }

        List<FundAttributes> members = upstreamCallExecutor.call(
                "peer_group_members group=" + attributes.peerGroup().label(),
                () -> fundAttributesReader.readPeerGroupMembers(attributes.peerGroup())
        );

        List<MetricSet> peerMetrics = new ArrayList<>();
        peerMetrics.add(metrics);
        for (FundAttributes member : members) {
            if (member.fundId().equals(attributes.fundId())) {
                continue;
            }
            try {
                peerMetrics.add(fundMetricsService.computeMetrics(member, scoreDate));
            } catch (FundrankException e) {
                log.warn(
                        "Skipping peer in return distribution. fund={}, peer={}, code={}",
                        attributes.fundId(),
                        member.fundId(),
                        e.getCode(),
                        e
                );
            }
        }
        return PeerReturnDistribution.of(peerMetrics);
    }
}
