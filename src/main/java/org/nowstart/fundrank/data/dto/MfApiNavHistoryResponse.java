package org.nowstart.fundrank.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MfApiNavHistoryResponse(
        Meta meta,
        List<NavRow> data,
        String status
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Meta(
            String fund_house,
            String scheme_type,
            String scheme_category,
            Integer scheme_code,
            String scheme_name
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NavRow(
            String date,
            String nav
    ) {
    }
}
