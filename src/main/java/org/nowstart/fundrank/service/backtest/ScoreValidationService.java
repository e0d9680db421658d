package org.nowstart.fundrank.service.backtest;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.fundrank.data.dto.NavObservation;
import org.nowstart.fundrank.data.dto.PeerGroupKey;
import org.nowstart.fundrank.data.dto.ScoreRecord;
import org.nowstart.fundrank.data.dto.ScoreValidationReport;
import org.nowstart.fundrank.data.exception.FundrankException;
import org.nowstart.fundrank.data.exception.InvalidInputException;
import org.nowstart.fundrank.data.type.Recommendation;
import org.nowstart.fundrank.service.metrics.ReturnStatistics;
import org.nowstart.fundrank.service.source.NavSeries;
import org.nowstart.fundrank.service.source.NavSeriesReader;
import org.nowstart.fundrank.service.source.ScoreRecordStore;
import org.nowstart.fundrank.service.source.UpstreamCallExecutor;
import org.springframework.stereotype.Service;

/**
 * Checks how well stored scores of a past score date predicted the following returns.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScoreValidationService {

    static final int DATE_TOLERANCE_DAYS = 10;
    private static final int MIN_CORRELATION_SAMPLE = 3;

    private final ScoreRecordStore scoreRecordStore;
    private final NavSeriesReader navSeriesReader;
    private final UpstreamCallExecutor upstreamCallExecutor;

    public ScoreValidationReport validateScores(LocalDate scoreDate, int horizonDays, PeerGroupKey peerGroup) {
        if (scoreDate == null || horizonDays <= 0) {
            throw new InvalidInputException(InvalidInputException.INVALID_DATE_RANGE, "Score date and a positive horizon are required");
        }

        List<ScoreRecord> records = (peerGroup == null
                ? scoreRecordStore.findByScoreDate(scoreDate)
                : scoreRecordStore.findByPeerGroup(scoreDate, peerGroup)).stream()
                .filter(ScoreRecord::isRanked)
                .toList();

        List<ScoredReturn> samples = new ArrayList<>();
        for (ScoreRecord record : records) {
            try {
                Double forwardReturn = forwardReturnPct(record.fundId(), scoreDate, horizonDays);
                if (forwardReturn != null) {
                    samples.add(new ScoredReturn(record, forwardReturn));
                }
            } catch (FundrankException e) {
                log.warn("Skipping fund in score validation. fund={}, code={}", record.fundId(), e.getCode(), e);
            }
        }

        Map<Integer, Double> byQuartile = new TreeMap<>(meanForwardReturn(samples, sample -> sample.record().quartile()));
        Map<Recommendation, Double> byRecommendation = new EnumMap<>(Recommendation.class);
        byRecommendation.putAll(meanForwardReturn(samples, sample -> sample.record().recommendation()));

        Boolean topQuartileOutperformed = (byQuartile.containsKey(1) && byQuartile.containsKey(4))
                ? byQuartile.get(1) > byQuartile.get(4)
                : null;

        ScoreValidationReport report = new ScoreValidationReport(
                scoreDate,
                horizonDays,
                peerGroup,
                samples.size(),
                correlation(samples),
                byQuartile,
                byRecommendation,
                topQuartileOutperformed
        );
        log.info(
                "event=score_validation scoreDate={} horizonDays={} sample={} correlation={} topQuartileOutperformed={}",
                scoreDate,
                horizonDays,
                report.sampleSize(),
                report.scoreReturnCorrelation(),
                topQuartileOutperformed
        );
        return report;
    }

    private Double forwardReturnPct(String fundId, LocalDate scoreDate, int horizonDays) {
        LocalDate targetDate = scoreDate.plusDays(horizonDays);
        List<NavObservation> series = upstreamCallExecutor.call(
                "nav_series fund=" + fundId,
                () -> navSeriesReader.readNavSeries(
                        fundId,
                        scoreDate.minusDays(DATE_TOLERANCE_DAYS),
                        targetDate.plusDays(DATE_TOLERANCE_DAYS)
                )
        );

        NavObservation base = NavSeries.closestObservation(series, scoreDate, DATE_TOLERANCE_DAYS, NavSeries.LATEST);
        NavObservation target = NavSeries.closestObservation(series, targetDate, DATE_TOLERANCE_DAYS, NavSeries.LATEST);
        if (base == null || target == null || !target.date().isAfter(base.date())) {
            return null;
        }
        return (target.value() / base.value() - 1.0) * 100.0;
    }

    private static <K> Map<K, Double> meanForwardReturn(List<ScoredReturn> samples, Function<ScoredReturn, K> key) {
        return samples.stream()
                .filter(sample -> key.apply(sample) != null)
                .collect(Collectors.groupingBy(key, Collectors.averagingDouble(ScoredReturn::forwardReturn)));
    }

    private static Double correlation(List<ScoredReturn> samples) {
        if (samples.size() < MIN_CORRELATION_SAMPLE) {
            return null;
        }
        double[] scores = samples.stream().mapToDouble(sample -> sample.record().total()).toArray();
        double[] returns = samples.stream().mapToDouble(ScoredReturn::forwardReturn).toArray();
        double denominator = ReturnStatistics.sampleStdev(scores) * ReturnStatistics.sampleStdev(returns);
        if (!Double.isFinite(denominator) || denominator == 0.0) {
            return null;
        }
        return ReturnStatistics.finiteOrNull(ReturnStatistics.sampleCovariance(scores, returns) / denominator);
    }

    private record ScoredReturn(ScoreRecord record, double forwardReturn) {
    }
}
