package org.nowstart.fundrank.data.type;

public enum Recommendation {
    STRONG_BUY,
    BUY,
    HOLD,
    SELL,
    STRONG_SELL;

    public boolean isAtLeast(Recommendation other) {
        return ordinal() <= other.ordinal();
    }
}
