package com.cardiorisk.history;

import com.cardiorisk.scoring.RiskCategory;

import java.time.Instant;

public final class RiskTrendStats {
    public final double averageRiskScore;
    public final TrendDirection trendDirection;
    public final double changePercent;      // absolute value
    public final int totalAssessments;
    public final Instant lastAssessment;    // null when there is no history
    public final RiskCategory mostCommonCategory;  // null when there is no history

    public RiskTrendStats(double averageRiskScore, TrendDirection trendDirection, double changePercent,
                          int totalAssessments, Instant lastAssessment, RiskCategory mostCommonCategory) {
        this.averageRiskScore = averageRiskScore;
        this.trendDirection = trendDirection;
        this.changePercent = changePercent;
        this.totalAssessments = totalAssessments;
        this.lastAssessment = lastAssessment;
        this.mostCommonCategory = mostCommonCategory;
    }

    public static RiskTrendStats empty() {
        return new RiskTrendStats(0, TrendDirection.STABLE, 0, 0, null, null);
    }
}
