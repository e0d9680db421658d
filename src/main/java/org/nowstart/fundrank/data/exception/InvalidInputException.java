package org.nowstart.fundrank.data.exception;

public class InvalidInputException extends FundrankException {

    public static final String INVALID_ALLOCATION = "invalid_allocation";
    public static final String INVALID_DATE_RANGE = "invalid_date_range";
    public static final String INVALID_AMOUNT = "invalid_amount";
    public static final String UNKNOWN_FUND = "unknown_fund";
    public static final String UNKNOWN_PORTFOLIO = "unknown_portfolio";
    public static final String INVALID_PEER_GROUP = "invalid_peer_group";
    public static final String HISTORICAL_SCORE_DATE = "historical_score_date";

    public InvalidInputException(String code, String message) {
        super(code, message);
    }
}
