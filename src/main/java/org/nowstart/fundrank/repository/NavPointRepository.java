package org.nowstart.fundrank.repository;

import java.time.LocalDate;
import java.util.List;
import org.nowstart.fundrank.data.entity.NavPoint;
import org.springframework.data.jpa.repository.JpaRepository;

public interface NavPointRepository extends JpaRepository<NavPoint, NavPoint.NavPointKey> {

    List<NavPoint> findByIdFundIdAndIdNavDateBetweenOrderByIdNavDateAsc(String fundId, LocalDate start, LocalDate end);
}
