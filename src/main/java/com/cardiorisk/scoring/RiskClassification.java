package com.cardiorisk.scoring;

/**
 * Position of an assessment in the 5x5 likelihood/impact matrix.
 */
public final class RiskClassification {
    public final LikelihoodLevel likelihood;
    public final ImpactLevel impact;
    public final int finalRiskScore;
    public final RiskCategory category;
    public final HeatmapPosition heatmapPosition;

    public RiskClassification(LikelihoodLevel likelihood, ImpactLevel impact, int finalRiskScore,
                              RiskCategory category, HeatmapPosition heatmapPosition) {
        this.likelihood = likelihood;
        this.impact = impact;
        this.finalRiskScore = finalRiskScore;
        this.category = category;
        this.heatmapPosition = heatmapPosition;
    }
}
