package org.nowstart.fundrank.service.batch;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.fundrank.config.ExecutorConfig;
import org.nowstart.fundrank.data.dto.BatchScoringSummary;
import org.nowstart.fundrank.data.dto.FundAttributes;
import org.nowstart.fundrank.data.dto.FundFailure;
import org.nowstart.fundrank.data.dto.MetricSet;
import org.nowstart.fundrank.data.dto.PeerGroupKey;
import org.nowstart.fundrank.data.dto.ScoreRecord;
import org.nowstart.fundrank.data.exception.FundrankException;
import org.nowstart.fundrank.data.property.ScoringProperties;
import org.nowstart.fundrank.data.type.DataStatus;
import org.nowstart.fundrank.data.type.ReturnScoringMethod;
import org.nowstart.fundrank.service.metrics.FundMetricsService;
import org.nowstart.fundrank.service.ranking.PeerRankingService;
import org.nowstart.fundrank.service.scoring.FundScoringService;
import org.nowstart.fundrank.service.scoring.PeerReturnDistribution;
import org.nowstart.fundrank.service.source.FundAttributesReader;
import org.nowstart.fundrank.service.source.ScoreRecordStore;
import org.nowstart.fundrank.service.source.UpstreamCallExecutor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Scores every active fund for a score date, then ranks every peer group.
 *
 * <p>Metrics are computed for all funds first so peer return distributions are complete. Records are then
 * scored and written one batch at a time; a cancelled run stops between batches and skips ranking, leaving
 * only fully written batches behind.
 */
@Slf4j
@Service
public class BatchScoringService {

    static final String UNEXPECTED_ERROR = "unexpected_error";
    static final String WRITE_FAILED = "write_failed";

    private final FundAttributesReader fundAttributesReader;
    private final UpstreamCallExecutor upstreamCallExecutor;
    private final FundMetricsService fundMetricsService;
    private final FundScoringService fundScoringService;
    private final ScoreRecordStore scoreRecordStore;
    private final PeerRankingService peerRankingService;
    private final ScoringProperties scoringProperties;
    private final ExecutorService scoringExecutor;

    public BatchScoringService(
            FundAttributesReader fundAttributesReader,
            UpstreamCallExecutor upstreamCallExecutor,
            FundMetricsService fundMetricsService,
            FundScoringService fundScoringService,
            ScoreRecordStore scoreRecordStore,
            PeerRankingService peerRankingService,
            ScoringProperties scoringProperties,
            @Qualifier(ExecutorConfig.SCORING_EXECUTOR) ExecutorService scoringExecutor
    ) {
        this.fundAttributesReader = fundAttributesReader;
        this.upstreamCallExecutor = upstreamCallExecutor;
        this.fundMetricsService = fundMetricsService;
        this.fundScoringService = fundScoringService;
        this.scoreRecordStore = scoreRecordStore;
        this.peerRankingService = peerRankingService;
        this.scoringProperties = scoringProperties;
        this.scoringExecutor = scoringExecutor;
    }

    public BatchScoringSummary scoreAll(LocalDate scoreDate) {
        return scoreAll(scoreDate, () -> false);
    }

    public BatchScoringSummary scoreAll(LocalDate scoreDate, BooleanSupplier cancellationRequested) {
        fundScoringService.requireCurrentScoreDate(scoreDate);
        List<FundAttributes> funds = upstreamCallExecutor.call("active_funds", fundAttributesReader::readActiveFunds);
        List<List<FundAttributes>> batches = partition(funds, scoringProperties.batchSize());
        log.info("event=batch_scoring_started scoreDate={} funds={} batches={}", scoreDate, funds.size(), batches.size());

        List<FundFailure> failures = new ArrayList<>();
        Map<String, MetricSet> metricsByFund = new HashMap<>();
        for (List<FundAttributes> batch : batches) {
            if (cancellationRequested.getAsBoolean()) {
                return finish(scoreDate, funds.size(), 0, 0, failures, 0, 0, true);
            }
            metricsByFund.putAll(computeMetrics(batch, scoreDate, failures));
        }

        Map<PeerGroupKey, PeerReturnDistribution> distributions = peerDistributions(funds, metricsByFund);

        int completedBatches = 0;
        int succeeded = 0;
        int insufficientData = 0;
        for (List<FundAttributes> batch : batches) {
            if (cancellationRequested.getAsBoolean()) {
                return finish(scoreDate, funds.size(), succeeded, insufficientData, failures, completedBatches, 0, true);
            }

            List<ScoreRecord> records = scoreBatch(batch, metricsByFund, distributions, scoreDate, failures);
            try {
                scoreRecordStore.saveAll(records);
            } catch (RuntimeException e) {
                log.error("Failed to write score batch. scoreDate={}, batch={}, records={}", scoreDate, completedBatches + 1, records.size(), e);
                records.forEach(record -> failures.add(new FundFailure(record.fundId(), WRITE_FAILED, e.getMessage())));
                continue;
            }

            completedBatches++;
            succeeded += records.size();
            insufficientData += (int) records.stream().filter(record -> record.status() == DataStatus.INSUFFICIENT_DATA).count();
            log.info(
                    "event=score_batch_written scoreDate={} batch={}/{} records={}",
                    scoreDate,
                    completedBatches,
                    batches.size(),
                    records.size()
            );
        }

        int rankedGroups = peerRankingService.rankAllPeerGroups(scoreDate);
        return finish(scoreDate, funds.size(), succeeded, insufficientData, failures, completedBatches, rankedGroups, false);
    }

    private Map<String, MetricSet> computeMetrics(List<FundAttributes> batch, LocalDate scoreDate, List<FundFailure> failures) {
        Map<String, CompletableFuture<MetricSet>> futures = new LinkedHashMap<>();
        for (FundAttributes fund : batch) {
            futures.put(fund.fundId(), CompletableFuture.supplyAsync(
                    () -> fundMetricsService.computeMetrics(fund, scoreDate),
                    scoringExecutor
            ));
        }

        Map<String, MetricSet> metrics = new LinkedHashMap<>();
        futures.forEach((fundId, future) -> {
            try {
                metrics.put(fundId, future.join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.warn("Failed to compute metrics. fund={}, scoreDate={}", fundId, scoreDate, cause);
                failures.add(failure(fundId, cause));
            }
        });
        return metrics;
    }

    private Map<PeerGroupKey, PeerReturnDistribution> peerDistributions(
            List<FundAttributes> funds,
            Map<String, MetricSet> metricsByFund
    ) {
        Map<PeerGroupKey, PeerReturnDistribution> distributions = new HashMap<>();
        if (scoringProperties.returnMethod() != ReturnScoringMethod.PERCENTILE) {
            return distributions;
        }

        Map<PeerGroupKey, List<MetricSet>> metricsByGroup = new HashMap<>();
        for (FundAttributes fund : funds) {
            MetricSet metrics = metricsByFund.get(fund.fundId());
            if (metrics != null && fund.hasPeerGroup()) {
                metricsByGroup.computeIfAbsent(fund.peerGroup(), key -> new ArrayList<>()).add(metrics);
            }
        }
        metricsByGroup.forEach((group, metrics) -> distributions.put(group, PeerReturnDistribution.of(metrics)));
        return distributions;
    }

    private List<ScoreRecord> scoreBatch(
            List<FundAttributes> batch,
            Map<String, MetricSet> metricsByFund,
            Map<PeerGroupKey, PeerReturnDistribution> distributions,
            LocalDate scoreDate,
            List<FundFailure> failures
    ) {
        List<ScoreRecord> records = new ArrayList<>(batch.size());
        for (FundAttributes fund : batch) {
            MetricSet metrics = metricsByFund.get(fund.fundId());
            if (metrics == null) {
                continue;
            }
            PeerReturnDistribution peers = fund.hasPeerGroup()
                    ? distributions.getOrDefault(fund.peerGroup(), PeerReturnDistribution.empty())
                    : PeerReturnDistribution.empty();
            try {
                records.add(fundScoringService.score(fund, metrics, peers, scoreDate));
            } catch (RuntimeException e) {
                log.warn("Failed to score fund={}, scoreDate={}", fund.fundId(), scoreDate, e);
                failures.add(failure(fund.fundId(), e));
            }
        }
        return records;
    }

    private BatchScoringSummary finish(
            LocalDate scoreDate,
            int requested,
            int succeeded,
            int insufficientData,
            List<FundFailure> failures,
            int completedBatches,
            int rankedGroups,
            boolean cancelled
    ) {
        BatchScoringSummary summary = new BatchScoringSummary(
                scoreDate,
                requested,
                succeeded,
                insufficientData,
                failures,
                completedBatches,
                rankedGroups,
                cancelled
        );
        log.info(
                "event=batch_scoring_finished scoreDate={} requested={} succeeded={} insufficientData={} failed={} completedBatches={} rankedGroups={} cancelled={}",
                scoreDate,
                requested,
                succeeded,
                insufficientData,
                summary.failed(),
                completedBatches,
                rankedGroups,
                cancelled
        );
        return summary;
    }

    private static FundFailure failure(String fundId, Throwable error) {
        String code = error instanceof FundrankException fundrankException ? fundrankException.getCode() : UNEXPECTED_ERROR;
        return new FundFailure(fundId, code, error.getMessage());
    }

    static <T> List<List<T>> partition(List<T> items, int size) {
        int batchSize = Math.max(1, size);
        List<List<T>> batches = new ArrayList<>();
        for (int start = 0; start < items.size(); start += batchSize) {
            batches.add(List.copyOf(items.subList(start, Math.min(items.size(), start + batchSize))));
        }
        return batches;
    }
}
