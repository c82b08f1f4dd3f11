package com.cardiorisk.scoring;

import java.util.List;

/**
 * Required demographics were missing from the input.
 */
public final class PreconditionFailure {
    public final List<String> missingFields;
    public final String message;

    public PreconditionFailure(List<String> missingFields) {
        this.missingFields = List.copyOf(missingFields);
        this.message = "Required field missing: " + String.join(", ", this.missingFields);
    }

    @Override
    public String toString() {
        return message;
    }
}
