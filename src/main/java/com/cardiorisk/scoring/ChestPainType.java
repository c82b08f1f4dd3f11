package com.cardiorisk.scoring;

/**
 * Reported character of chest pain. PRESSURE, CRUSHING and TYPICAL are the
 * ischaemic-sounding presentations; the rest are treated as less concerning.
 */
public enum ChestPainType {
    NONE,
    SHARP,
    BURNING,
    ACHING,
    OTHER,
    PRESSURE,
    CRUSHING,
    TYPICAL;

    public boolean isPresent() {
        return this != NONE;
    }

    public boolean isPressureLike() {
        return this == PRESSURE || this == CRUSHING;
    }
}
