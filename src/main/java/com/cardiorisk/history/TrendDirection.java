package com.cardiorisk.history;

public enum TrendDirection {
    IMPROVING,
    STABLE,
    WORSENING
}
