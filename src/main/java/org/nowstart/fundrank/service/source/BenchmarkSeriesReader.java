package org.nowstart.fundrank.service.source;

import java.time.LocalDate;
import java.util.List;
import org.nowstart.fundrank.data.dto.NavObservation;

/**
 * Source of benchmark index levels, same ordering contract as {@link NavSeriesReader}.
 */
public interface BenchmarkSeriesReader {

    List<NavObservation> readBenchmarkSeries(String benchmarkName, LocalDate start, LocalDate end);
}
