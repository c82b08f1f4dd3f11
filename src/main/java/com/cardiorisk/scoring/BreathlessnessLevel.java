package com.cardiorisk.scoring;

public enum BreathlessnessLevel {
    NONE,
    MILD,
    MODERATE,
    SEVERE;

    public boolean isPresent() {
        return this != NONE;
    }
}
