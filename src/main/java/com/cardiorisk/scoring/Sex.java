package com.cardiorisk.scoring;

public enum Sex {
    MALE,
    FEMALE
}
