package org.nowstart.fundrank.service.source;

import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.fundrank.data.dto.NavObservation;
import org.nowstart.fundrank.data.entity.BenchmarkPoint;
import org.nowstart.fundrank.repository.BenchmarkPointRepository;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JpaBenchmarkSeriesReader implements BenchmarkSeriesReader {

    private final BenchmarkPointRepository benchmarkPointRepository;

    @Override
    public List<NavObservation> readBenchmarkSeries(String benchmarkName, LocalDate start, LocalDate end) {
        List<NavObservation> rows = benchmarkPointRepository.findByIdBenchmarkNameAndIdPointDateBetweenOrderByIdPointDateAsc(
                        benchmarkName,
                        NavSeries.lowerBound(start),
                        NavSeries.upperBound(end)
                ).stream()
                .map(this::toObservation)
                .toList();
        return NavSeries.normalize("benchmark=" + benchmarkName, rows);
    }

    private NavObservation toObservation(BenchmarkPoint point) {
        double value = point.getIndexValue() == null ? Double.NaN : point.getIndexValue().doubleValue();
        return new NavObservation(point.getId().pointDate(), value);
    }
}
