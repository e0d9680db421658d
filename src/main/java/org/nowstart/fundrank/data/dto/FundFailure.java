package org.nowstart.fundrank.data.dto;

public record FundFailure(
        String fundId,
        String code,
        String message
) {
}
