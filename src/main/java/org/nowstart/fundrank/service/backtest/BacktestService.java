package org.nowstart.fundrank.service.backtest;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.fundrank.config.ExecutorConfig;
import org.nowstart.fundrank.data.dto.AllocationWeight;
import org.nowstart.fundrank.data.dto.BacktestRequest;
import org.nowstart.fundrank.data.dto.BacktestResult;
import org.nowstart.fundrank.data.dto.NavObservation;
import org.nowstart.fundrank.data.dto.PeerGroupKey;
import org.nowstart.fundrank.data.dto.PortfolioAllocation;
import org.nowstart.fundrank.data.dto.ScoreRecord;
import org.nowstart.fundrank.data.entity.ModelPortfolio;
import org.nowstart.fundrank.data.exception.FundrankException;
import org.nowstart.fundrank.data.exception.InvalidInputException;
import org.nowstart.fundrank.data.exception.UpstreamUnavailableException;
import org.nowstart.fundrank.data.property.BacktestProperties;
import org.nowstart.fundrank.data.type.RebalancePeriod;
import org.nowstart.fundrank.repository.ModelPortfolioAllocationRepository;
import org.nowstart.fundrank.repository.ModelPortfolioRepository;
import org.nowstart.fundrank.service.source.BenchmarkSeriesReader;
import org.nowstart.fundrank.service.source.FundAttributesReader;
import org.nowstart.fundrank.service.source.NavSeriesReader;
import org.nowstart.fundrank.service.source.ScoreRecordStore;
import org.nowstart.fundrank.service.source.UpstreamCallExecutor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class BacktestService {

    private final BacktestRequestValidationService backtestRequestValidationService;
    private final FundAttributesReader fundAttributesReader;
    private final NavSeriesReader navSeriesReader;
    private final BenchmarkSeriesReader benchmarkSeriesReader;
    private final UpstreamCallExecutor upstreamCallExecutor;
    private final BacktestSimulator backtestSimulator;
    private final ModelPortfolioRepository modelPortfolioRepository;
    private final ModelPortfolioAllocationRepository modelPortfolioAllocationRepository;
    private final ScoreRecordStore scoreRecordStore;
    private final BacktestProperties backtestProperties;
    private final ExecutorService navFetchExecutor;

    public BacktestService(
            BacktestRequestValidationService backtestRequestValidationService,
            FundAttributesReader fundAttributesReader,
            NavSeriesReader navSeriesReader,
            BenchmarkSeriesReader benchmarkSeriesReader,
            UpstreamCallExecutor upstreamCallExecutor,
            BacktestSimulator backtestSimulator,
            ModelPortfolioRepository modelPortfolioRepository,
            ModelPortfolioAllocationRepository modelPortfolioAllocationRepository,
            ScoreRecordStore scoreRecordStore,
            BacktestProperties backtestProperties,
            @Qualifier(ExecutorConfig.NAV_FETCH_EXECUTOR) ExecutorService navFetchExecutor
    ) {
        this.backtestRequestValidationService = backtestRequestValidationService;
        this.fundAttributesReader = fundAttributesReader;
        this.navSeriesReader = navSeriesReader;
        this.benchmarkSeriesReader = benchmarkSeriesReader;
        this.upstreamCallExecutor = upstreamCallExecutor;
        this.backtestSimulator = backtestSimulator;
        this.modelPortfolioRepository = modelPortfolioRepository;
        this.modelPortfolioAllocationRepository = modelPortfolioAllocationRepository;
        this.scoreRecordStore = scoreRecordStore;
        this.backtestProperties = backtestProperties;
        this.navFetchExecutor = navFetchExecutor;
    }

    public BacktestResult runBacktest(
            PortfolioAllocation allocation,
            LocalDate start,
            LocalDate end,
            BigDecimal initialAmount,
            RebalancePeriod rebalancePeriod,
            String benchmarkName
    ) {
        return runBacktest(new BacktestRequest(allocation, start, end, initialAmount, rebalancePeriod, benchmarkName));
    }

    public BacktestResult runBacktest(BacktestRequest request) {
        backtestRequestValidationService.validate(request);
        requireKnownFunds(request.allocation());

        LocalDate fetchStart = request.startDate().minusDays(backtestProperties.navLookbackDays());
        Map<String, List<NavObservation>> navSeries = fetchNavSeries(request.allocation(), fetchStart, request.endDate());
        List<NavObservation> benchmarkSeries = request.benchmarkName() == null
                ? List.of()
                : upstreamCallExecutor.call(
                        "benchmark_series name=" + request.benchmarkName(),
                        () -> benchmarkSeriesReader.readBenchmarkSeries(request.benchmarkName(), fetchStart, request.endDate())
                );

        return backtestSimulator.simulate(request, navSeries, benchmarkSeries);
    }

    public BacktestResult runModelPortfolioBacktest(
            Long portfolioId,
            LocalDate start,
            LocalDate end,
            BigDecimal initialAmount,
            RebalancePeriod rebalancePeriod,
            String benchmarkName
    ) {
        ModelPortfolio portfolio = modelPortfolioRepository.findById(portfolioId)
                .orElseThrow(() -> new InvalidInputException(
                        InvalidInputException.UNKNOWN_PORTFOLIO,
                        "Unknown model portfolio id: " + portfolioId
                ));
        List<AllocationWeight> weights = modelPortfolioAllocationRepository.findByPortfolioIdOrderByFundIdAsc(portfolioId).stream()
                .map(row -> new AllocationWeight(row.getFundId(), row.getWeight()))
                .toList();

        return runBacktest(new PortfolioAllocation(portfolio.getName(), weights), start, end, initialAmount, rebalancePeriod, benchmarkName);
    }

    /**
     * Backtests an equal-weight basket of the funds ranked in {@code quartile} of a peer group on the score date.
     */
    public BacktestResult runQuartileBacktest(
            PeerGroupKey peerGroup,
            LocalDate scoreDate,
            int quartile,
            LocalDate start,
            LocalDate end,
            BigDecimal initialAmount,
            RebalancePeriod rebalancePeriod,
            String benchmarkName
    ) {
        if (quartile < 1 || quartile > 4) {
            throw new InvalidInputException(InvalidInputException.INVALID_ALLOCATION, "Quartile must be between 1 and 4: " + quartile);
        }

        List<String> fundIds = scoreRecordStore.findByPeerGroup(scoreDate, peerGroup).stream()
                .filter(record -> record.quartile() != null && record.quartile() == quartile)
                .map(ScoreRecord::fundId)
                .sorted()
                .toList();
        if (fundIds.isEmpty()) {
            throw new InvalidInputException(
                    InvalidInputException.INVALID_ALLOCATION,
                    "No ranked funds in quartile " + quartile + " of " + peerGroup.label() + " on " + scoreDate
            );
        }

        BigDecimal weight = BigDecimal.ONE.divide(BigDecimal.valueOf(fundIds.size()), 10, RoundingMode.HALF_UP);
        List<AllocationWeight> weights = fundIds.stream()
                .map(fundId -> new AllocationWeight(fundId, weight))
                .toList();
        String name = "Q" + quartile + " " + peerGroup.label() + " " + scoreDate;

        return runBacktest(new PortfolioAllocation(name, weights), start, end, initialAmount, rebalancePeriod, benchmarkName);
    }

    private void requireKnownFunds(PortfolioAllocation allocation) {
        for (AllocationWeight weight : allocation.weights()) {
            boolean known = upstreamCallExecutor.call(
                    "fund_attributes fund=" + weight.fundId(),
                    () -> fundAttributesReader.readFundAttributes(weight.fundId())
            ).isPresent();
            if (!known) {
                throw new InvalidInputException(InvalidInputException.UNKNOWN_FUND, "Unknown fund id: " + weight.fundId());
            }
        }
    }

    private Map<String, List<NavObservation>> fetchNavSeries(PortfolioAllocation allocation, LocalDate start, LocalDate end) {
        Map<String, CompletableFuture<List<NavObservation>>> futures = new LinkedHashMap<>();
        for (AllocationWeight weight : allocation.weights()) {
            String fundId = weight.fundId();
            futures.put(fundId, CompletableFuture.supplyAsync(
                    () -> upstreamCallExecutor.call(
                            "nav_series fund=" + fundId,
                            () -> navSeriesReader.readNavSeries(fundId, start, end)
                    ),
                    navFetchExecutor
            ));
        }

        // 전체 조회에 하나의 마감 시각 적용
        long deadline = System.nanoTime() + backtestProperties.fetchTimeout().toNanos();
        Map<String, List<NavObservation>> navSeries = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<List<NavObservation>>> entry : futures.entrySet()) {
            try {
                long remainingNanos = Math.max(0L, deadline - System.nanoTime());
                navSeries.put(entry.getKey(), entry.getValue().get(remainingNanos, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                cancelAll(futures);
                throw new UpstreamUnavailableException("Timed out reading NAV series. fund=" + entry.getKey(), e);
            } catch (ExecutionException e) {
                cancelAll(futures);
                if (e.getCause() instanceof FundrankException fundrankException) {
                    throw fundrankException;
                }
                throw new UpstreamUnavailableException("Failed to read NAV series. fund=" + entry.getKey(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelAll(futures);
                throw new UpstreamUnavailableException("Interrupted while reading NAV series. fund=" + entry.getKey(), e);
            }
        }
        return navSeries;
    }

    private void cancelAll(Map<String, CompletableFuture<List<NavObservation>>> futures) {
        futures.values().forEach(future -> future.cancel(true));
        log.warn("Cancelled pending NAV series reads. funds={}", futures.keySet());
    }
}
