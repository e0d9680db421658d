package org.nowstart.fundrank.data.type;

public enum NavSourceProvider {
    DATABASE,
    MFAPI
}
