package org.nowstart.fundrank.service.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.fundrank.data.dto.MfApiNavHistoryResponse;
import org.nowstart.fundrank.data.dto.MfApiNavHistoryResponse.NavRow;
import org.nowstart.fundrank.data.dto.NavObservation;
import org.nowstart.fundrank.repository.MfApiFeignClient;

@ExtendWith(MockitoExtension.class)
class MfApiNavSeriesReaderTest {

    @Mock
    private MfApiFeignClient mfApiFeignClient;

    @InjectMocks
    private MfApiNavSeriesReader reader;

    @Test
    void readNavSeries_parsesSortsAndFiltersRows() {
        when(mfApiFeignClient.getNavHistory("120503")).thenReturn(new MfApiNavHistoryResponse(
                new MfApiNavHistoryResponse.Meta("AMC", "Open Ended", "Equity Scheme - Large Cap Fund", 120503, "Large Cap Fund"),
                List.of(
                        new NavRow("03-01-2024", "101.2500"),
                        new NavRow("02-01-2024", "100.5000"),
                        new NavRow("02-01-2024", "99.0000"),
                        new NavRow("2024-01-04", "102.0"),
                        new NavRow("05-01-2024", "n/a"),
                        new NavRow("31-12-2023", "99.7500"),
                        new NavRow("06-01-2024", "0")
                ),
                "SUCCESS"
        ));

        List<NavObservation> series = reader.readNavSeries("120503", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

        assertThat(series).containsExactly(
                new NavObservation(LocalDate.of(2024, 1, 2), 100.5),
                new NavObservation(LocalDate.of(2024, 1, 3), 101.25)
        );
    }

    @Test
    void readNavSeries_returnsEmptyWhenSchemeHasNoData() {
        when(mfApiFeignClient.getNavHistory("999999")).thenReturn(new MfApiNavHistoryResponse(null, List.of(), "SUCCESS"));

        assertThat(reader.readNavSeries("999999", null, null)).isEmpty();
    }
}
