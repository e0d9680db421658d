package org.nowstart.fundrank.repository;

import java.time.LocalDate;
import java.util.List;
import org.nowstart.fundrank.data.entity.BenchmarkPoint;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BenchmarkPointRepository extends JpaRepository<BenchmarkPoint, BenchmarkPoint.BenchmarkPointKey> {

    List<BenchmarkPoint> findByIdBenchmarkNameAndIdPointDateBetweenOrderByIdPointDateAsc(
            String benchmarkName,
            LocalDate start,
            LocalDate end
    );
}
