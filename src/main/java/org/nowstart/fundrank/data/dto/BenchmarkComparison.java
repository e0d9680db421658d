package org.nowstart.fundrank.data.dto;

public record BenchmarkComparison(
        String benchmarkName,
        double benchmarkReturnPct,
        Double alphaPct,
        Double beta,
        Double trackingErrorPct,
        Double informationRatio,
        Double upCapturePct,
        Double downCapturePct
) {
}
