package com.cardiorisk.history;

import java.util.function.Function;

/**
 * Vital signs tracked over time, with the range shown as normal on trend
 * charts. The ranges are display ranges and are stricter than the scoring
 * tiers.
 */
public enum VitalSign {
    SYSTOLIC_BP("systolicBP", 90, 120, r -> toDouble(r.systolicBP)),
    DIASTOLIC_BP("diastolicBP", 60, 80, r -> toDouble(r.diastolicBP)),
    HEART_RATE("heartRate", 60, 100, r -> toDouble(r.heartRate)),
    OXYGEN_SATURATION("oxygenSaturation", 95, 100, r -> toDouble(r.oxygenSaturation)),
    TEMPERATURE("temperature", 36.1, 37.2, r -> r.temperature);

    private final String key;
    private final double normalMin;
    private final double normalMax;
    private final Function<AssessmentRecord, Double> reading;

    VitalSign(String key, double normalMin, double normalMax, Function<AssessmentRecord, Double> reading) {
        this.key = key;
        this.normalMin = normalMin;
        this.normalMax = normalMax;
        this.reading = reading;
    }

    public String key() {
        return key;
    }

    public boolean isNormal(double value) {
        return value >= normalMin && value <= normalMax;
    }

    /** The reading stored on the record, or null when it was not measured. */
    public Double readingOf(AssessmentRecord record) {
        return reading.apply(record);
    }

    private static Double toDouble(Integer value) {
        return value != null ? value.doubleValue() : null;
    }
}
