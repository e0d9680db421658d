package org.nowstart.fundrank.data.type;

public enum SubScoreGroup {
    RETURNS,
    RISK,
    FUNDAMENTALS,
    OTHER
}
