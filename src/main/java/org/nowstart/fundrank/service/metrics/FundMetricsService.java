package org.nowstart.fundrank.service.metrics;

import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.fundrank.data.dto.FundAttributes;
import org.nowstart.fundrank.data.dto.MetricSet;
import org.nowstart.fundrank.data.dto.NavObservation;
import org.nowstart.fundrank.data.exception.InvalidInputException;
import org.nowstart.fundrank.data.type.ReturnPeriod;
import org.nowstart.fundrank.service.source.BenchmarkSeriesReader;
import org.nowstart.fundrank.service.source.FundAttributesReader;
import org.nowstart.fundrank.service.source.NavSeriesReader;
import org.nowstart.fundrank.service.source.UpstreamCallExecutor;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class FundMetricsService {

    // 5Y 수익률 기준일 허용 범위까지 포함
    private static final int HISTORY_DAYS = ReturnPeriod.YEAR_5.getLookbackDays() + ReturnPeriod.YEAR_5.getToleranceDays();
    private static final int BENCHMARK_HISTORY_DAYS = 400;

    private final FundAttributesReader fundAttributesReader;
    private final NavSeriesReader navSeriesReader;
    private final BenchmarkSeriesReader benchmarkSeriesReader;
    private final UpstreamCallExecutor upstreamCallExecutor;
    private final NavMetricsCalculator navMetricsCalculator;

    public MetricSet computeMetrics(String fundId, LocalDate asOf) {
        return computeMetrics(requireAttributes(fundId), asOf);
    }

    public MetricSet computeMetrics(FundAttributes attributes, LocalDate asOf) {
        String fundId = attributes.fundId();
        List<NavObservation> navSeries = upstreamCallExecutor.call(
                "nav_series fund=" + fundId,
                () -> navSeriesReader.readNavSeries(fundId, asOf.minusDays(HISTORY_DAYS), asOf)
        );

        List<NavObservation> benchmarkSeries = List.of();
        String benchmarkName = attributes.benchmarkName();
        if (benchmarkName != null && !benchmarkName.isBlank()) {
            benchmarkSeries = upstreamCallExecutor.call(
                    "benchmark_series name=" + benchmarkName,
                    () -> benchmarkSeriesReader.readBenchmarkSeries(benchmarkName, asOf.minusDays(BENCHMARK_HISTORY_DAYS), asOf)
            );
        }

        MetricSet metrics = navMetricsCalculator.calculate(fundId, asOf, navSeries, benchmarkSeries);
        log.debug(
                "event=fund_metrics fund={} asOf={} sufficient={} observations={} periods={}",
                fundId,
                asOf,
                metrics.sufficient(),
                metrics.observationCount(),
                metrics.periodReturns().keySet()
        );
        return metrics;
    }

    public FundAttributes requireAttributes(String fundId) {
        return upstreamCallExecutor.call(
                        "fund_attributes fund=" + fundId,
                        () -> fundAttributesReader.readFundAttributes(fundId)
                )
                .orElseThrow(() -> new InvalidInputException(InvalidInputException.UNKNOWN_FUND, "Unknown fund id: " + fundId));
    }
}
