package com.cardiorisk.history;

import java.time.Instant;

public final class VitalSignPoint {
    public final Instant timestamp;
    public final double value;
    public final boolean normal;

    public VitalSignPoint(Instant timestamp, double value, boolean normal) {
        this.timestamp = timestamp;
        this.value = value;
        this.normal = normal;
    }
}
