package com.cardiorisk.scoring;

/**
 * Physiologically plausible ranges. A reading outside its range is a form
 * or device error and is treated as not measured.
 */
public final class VitalSignBounds {

    public static final int MIN_AGE = 0;
    public static final int MAX_AGE = 120;

    public static final int MIN_SYSTOLIC = 50;
    public static final int MAX_SYSTOLIC = 300;
    public static final int MIN_DIASTOLIC = 30;
    public static final int MAX_DIASTOLIC = 200;
    public static final int MIN_HEART_RATE = 30;
    public static final int MAX_HEART_RATE = 250;
    public static final int MIN_OXYGEN_SATURATION = 70;
    public static final int MAX_OXYGEN_SATURATION = 100;
    public static final double MIN_TEMPERATURE = 30.0;
    public static final double MAX_TEMPERATURE = 45.0;

    private VitalSignBounds() {
    }

    public static boolean plausibleSystolic(Integer value) {
        return value != null && value >= MIN_SYSTOLIC && value <= MAX_SYSTOLIC;
    }

    public static boolean plausibleDiastolic(Integer value) {
        return value != null && value >= MIN_DIASTOLIC && value <= MAX_DIASTOLIC;
    }

    public static boolean plausibleHeartRate(Integer value) {
        return value != null && value >= MIN_HEART_RATE && value <= MAX_HEART_RATE;
    }

    public static boolean plausibleOxygenSaturation(Integer value) {
        return value != null && value >= MIN_OXYGEN_SATURATION && value <= MAX_OXYGEN_SATURATION;
    }

    public static boolean plausibleTemperature(Double value) {
        return value != null && !value.isNaN() && value >= MIN_TEMPERATURE && value <= MAX_TEMPERATURE;
    }

    public static int clampAge(int age) {
        return Math.max(MIN_AGE, Math.min(MAX_AGE, age));
    }
}
