package org.nowstart.fundrank.data.type;

public enum ReturnScoringMethod {
    STEP,
    PERCENTILE
}
