package com.cardiorisk.history;

import com.cardiorisk.scoring.RiskFactor;

/**
 * How often a risk factor was declared across a patient's history and
 * whether it still applies.
 */
public final class RiskFactorContribution {

    public enum Status {
        /** Declared in most recent assessments. */
        CONTRIBUTOR("Currently affecting your heart health."),
        /** Declared before, absent from the latest assessment. */
        IMPROVED("Great! This risk factor has been addressed."),
        /** Declared in the past but not recently. */
        STABLE("Well managed and stable.");

        private final String description;

        Status(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    public final RiskFactor factor;
    public final int occurrences;
    public final Status status;

    public RiskFactorContribution(RiskFactor factor, int occurrences, Status status) {
        this.factor = factor;
        this.occurrences = occurrences;
        this.status = status;
    }
}
