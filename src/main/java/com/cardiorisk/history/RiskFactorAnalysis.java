package com.cardiorisk.history;

import java.util.List;

/**
 * Risk factors grouped by status, most frequent first.
 */
public final class RiskFactorAnalysis {
    public final List<RiskFactorContribution> contributors;   // at most 5
    public final List<RiskFactorContribution> improved;       // at most 3
    public final List<RiskFactorContribution> stable;         // at most 3

    public RiskFactorAnalysis(List<RiskFactorContribution> contributors,
                              List<RiskFactorContribution> improved,
                              List<RiskFactorContribution> stable) {
        this.contributors = List.copyOf(contributors);
        this.improved = List.copyOf(improved);
        this.stable = List.copyOf(stable);
    }

    public static RiskFactorAnalysis empty() {
        return new RiskFactorAnalysis(List.of(), List.of(), List.of());
    }
}
