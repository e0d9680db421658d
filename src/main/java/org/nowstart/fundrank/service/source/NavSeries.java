package org.nowstart.fundrank.service.source;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.fundrank.data.dto.NavObservation;

@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class NavSeries {

    public static final LocalDate EARLIEST = LocalDate.of(1900, 1, 1);
    public static final LocalDate LATEST = LocalDate.of(9999, 12, 31);

    public static LocalDate lowerBound(LocalDate start) {
        return start == null ? EARLIEST : start;
    }

    public static LocalDate upperBound(LocalDate end) {
        return end == null ? LATEST : end;
    }

    /**
     * Drops invalid values, sorts by date and keeps the first observation of a duplicated date.
     */
    public static List<NavObservation> normalize(String source, List<NavObservation> rows) {
        if (rows == null || rows.isEmpty()) {
            return List.of();
        }

        List<NavObservation> sorted = rows.stream()
                .filter(row -> row != null && row.isValid())
                .sorted(Comparator.comparing(NavObservation::date))
                .toList();

        List<NavObservation> normalized = new ArrayList<>(sorted.size());
        for (NavObservation row : sorted) {
            if (!normalized.isEmpty() && normalized.get(normalized.size() - 1).date().equals(row.date())) {
                continue;
            }
            normalized.add(row);
        }

        int dropped = rows.size() - normalized.size();
        if (dropped > 0) {
            log.warn("Dropped malformed or duplicate series rows. source={}, rawCount={}, dropped={}", source, rows.size(), dropped);
        }
        return List.copyOf(normalized);
    }

    /**
     * Observation closest to {@code target} within the tolerance and strictly before {@code exclusiveEnd}.
     * Ties resolve to the earlier observation. Expects a normalized series.
     */
    public static NavObservation closestObservation(
            List<NavObservation> series,
            LocalDate target,
            int toleranceDays,
            LocalDate exclusiveEnd
    ) {
        NavObservation closest = null;
        long closestDistance = Long.MAX_VALUE;
        for (NavObservation point : series) {
            if (!point.date().isBefore(exclusiveEnd)) {
                break;
            }
            long distance = Math.abs(ChronoUnit.DAYS.between(target, point.date()));
            if (distance <= toleranceDays && distance < closestDistance) {
                closest = point;
                closestDistance = distance;
            }
        }
        return closest;
    }
}
