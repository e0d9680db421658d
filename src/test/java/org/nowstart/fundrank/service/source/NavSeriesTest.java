package org.nowstart.fundrank.service.source;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.fundrank.data.dto.NavObservation;

class NavSeriesTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 1);

    @Test
    void normalize_dropsInvalidRowsSortsAndKeepsFirstDuplicate() {
        List<NavObservation> rows = Arrays.asList(
                new NavObservation(DAY.plusDays(2), 12.0),
                new NavObservation(DAY, 10.0),
                null,
                new NavObservation(DAY.plusDays(1), -1.0),
                new NavObservation(DAY.plusDays(1), Double.NaN),
                new NavObservation(DAY.plusDays(2), 99.0),
                new NavObservation(null, 11.0)
        );

        List<NavObservation> normalized = NavSeries.normalize("test", rows);

        assertThat(normalized).containsExactly(
                new NavObservation(DAY, 10.0),
                new NavObservation(DAY.plusDays(2), 12.0)
        );
    }

    @Test
    void normalize_returnsEmptyForMissingRows() {
        assertThat(NavSeries.normalize("test", null)).isEmpty();
        assertThat(NavSeries.normalize("test", List.of())).isEmpty();
    }

    @Test
    void closestObservation_prefersEarlierObservationOnTie() {
        List<NavObservation> series = List.of(
                new NavObservation(DAY.minusDays(3), 9.0),
                new NavObservation(DAY.plusDays(3), 11.0),
                new NavObservation(DAY.plusDays(20), 12.0)
        );

        assertThat(NavSeries.closestObservation(series, DAY, 5, DAY.plusDays(20)))
                .isEqualTo(new NavObservation(DAY.minusDays(3), 9.0));
    }

    @Test
    void closestObservation_respectsToleranceAndExclusiveEnd() {
        List<NavObservation> series = List.of(
                new NavObservation(DAY.minusDays(6), 9.0),
                new NavObservation(DAY.plusDays(2), 11.0)
        );

        assertThat(NavSeries.closestObservation(series, DAY, 5, DAY.plusDays(2))).isNull();
        assertThat(NavSeries.closestObservation(series, DAY, 6, DAY.plusDays(2)))
                .isEqualTo(new NavObservation(DAY.minusDays(6), 9.0));
    }

    @Test
    void bounds_fallBackToOpenRange() {
        assertThat(NavSeries.lowerBound(null)).isEqualTo(NavSeries.EARLIEST);
        assertThat(NavSeries.upperBound(null)).isEqualTo(NavSeries.LATEST);
        assertThat(NavSeries.lowerBound(DAY)).isEqualTo(DAY);
    }
}
