package org.nowstart.fundrank.service.source;

import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.fundrank.data.dto.NavObservation;
import org.nowstart.fundrank.data.entity.NavPoint;
import org.nowstart.fundrank.repository.NavPointRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "fundrank.nav-source", name = "provider", havingValue = "DATABASE", matchIfMissing = true)
public class JpaNavSeriesReader implements NavSeriesReader {

    private final NavPointRepository navPointRepository;

    @Override
    public List<NavObservation> readNavSeries(String fundId, LocalDate start, LocalDate end) {
        List<NavObservation> rows = navPointRepository.findByIdFundIdAndIdNavDateBetweenOrderByIdNavDateAsc(
                        fundId,
                        NavSeries.lowerBound(start),
                        NavSeries.upperBound(end)
                ).stream()
                .map(this::toObservation)
                .toList();
        return NavSeries.normalize("fund=" + fundId, rows);
    }

    private NavObservation toObservation(NavPoint point) {
        double value = point.getNavValue() == null ? Double.NaN : point.getNavValue().doubleValue();
        return new NavObservation(point.getId().navDate(), value);
    }
}
