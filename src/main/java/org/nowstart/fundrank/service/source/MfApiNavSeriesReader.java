package org.nowstart.fundrank.service.source;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.fundrank.data.dto.MfApiNavHistoryResponse;
import org.nowstart.fundrank.data.dto.NavObservation;
import org.nowstart.fundrank.repository.MfApiFeignClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "fundrank.nav-source", name = "provider", havingValue = "MFAPI")
public class MfApiNavSeriesReader implements NavSeriesReader {

    private static final DateTimeFormatter NAV_DATE_FORMAT = DateTimeFormatter.ofPattern("dd-MM-yyyy");

    private final MfApiFeignClient mfApiFeignClient;

    @Override
    public List<NavObservation> readNavSeries(String fundId, LocalDate start, LocalDate end) {
        MfApiNavHistoryResponse response = mfApiFeignClient.getNavHistory(fundId);
        if (response == null || response.data() == null || response.data().isEmpty()) {
            log.warn("No NAV rows received from mfapi. fund={}", fundId);
            return List.of();
        }

        LocalDate lower = NavSeries.lowerBound(start);
        LocalDate upper = NavSeries.upperBound(end);
        List<NavObservation> rows = response.data().stream()
                .map(row -> toObservation(fundId, row))
                .filter(Objects::nonNull)
                .filter(row -> !row.date().isBefore(lower) && !row.date().isAfter(upper))
                .toList();
        return NavSeries.normalize("mfapi fund=" + fundId, rows);
    }

    private NavObservation toObservation(String fundId, MfApiNavHistoryResponse.NavRow row) {
        if (row == null || row.date() == null || row.nav() == null) {
            return null;
        }

        try {
            return new NavObservation(
                    LocalDate.parse(row.date().trim(), NAV_DATE_FORMAT),
                    new BigDecimal(row.nav().trim()).doubleValue()
            );
        } catch (DateTimeParseException | NumberFormatException e) {
            log.warn("Failed to parse mfapi NAV row. fund={}, row={}", fundId, row, e);
            return null;
        }
    }
}
