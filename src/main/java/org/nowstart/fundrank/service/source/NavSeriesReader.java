package org.nowstart.fundrank.service.source;

import java.time.LocalDate;
import java.util.List;
import org.nowstart.fundrank.data.dto.NavObservation;

/**
 * Source of fund NAV history.
 */
public interface NavSeriesReader {

    /**
     * Returns the fund's NAV observations ordered by date, one per date, only positive values.
     *
     * @param fundId scheme code
     * @param start  inclusive lower bound, {@code null} for the whole history
     * @param end    inclusive upper bound, {@code null} for the whole history
     */
    List<NavObservation> readNavSeries(String fundId, LocalDate start, LocalDate end);
}
