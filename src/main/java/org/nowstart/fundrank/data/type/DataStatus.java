package org.nowstart.fundrank.data.type;

public enum DataStatus {
    COMPLETE,
    PARTIAL,
    INSUFFICIENT_DATA
}
