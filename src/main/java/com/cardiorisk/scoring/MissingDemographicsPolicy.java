package com.cardiorisk.scoring;

/**
 * What the engine does when age or sex is missing.
 */
public enum MissingDemographicsPolicy {
    /** Return a precondition failure naming the missing fields. */
    REJECT,
    /** Score as if age were 0 and sex contributed no risk. Matches the behaviour of the legacy mobile form. */
    LEGACY_DEFAULT
}
