package com.cardiorisk.scoring;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of a successful assessment. Read-only; consumed by the
 * presentation layer, the history store and report exporters.
 */
public final class AssessmentResult {

    public static final String SAFETY_MESSAGE =
        "If you experience severe chest pain, fainting, or difficulty breathing, seek emergency care immediately.";

    public final int likelihoodScore;
    public final LikelihoodLevel likelihoodLevel;
    public final int impactScore;
    public final ImpactLevel impactLevel;
    public final int finalRiskScore;
    public final RiskCategory riskCategory;
    public final HeatmapPosition heatmapPosition;
    public final String recommendedAction;
    public final String colorCode;
    public final String explanation;
    public final List<Recommendation> recommendations;
    public final String safetyMessage;

    public AssessmentResult(RiskClassification classification, RecommendationPlan plan) {
        this.likelihoodScore = classification.likelihood.score();
        this.likelihoodLevel = classification.likelihood;
        this.impactScore = classification.impact.score();
        this.impactLevel = classification.impact;
        this.finalRiskScore = classification.finalRiskScore;
        this.riskCategory = classification.category;
        this.heatmapPosition = classification.heatmapPosition;
        this.recommendedAction = plan.recommendedAction;
        this.colorCode = plan.colorCode;
        this.explanation = plan.explanation;
        this.recommendations = plan.recommendations;
        this.safetyMessage = SAFETY_MESSAGE;
    }

    /** Default-language advice text, in order. */
    public List<String> recommendationTexts() {
        return recommendations.stream().map(Recommendation::text).collect(Collectors.toList());
    }

    /** Canonical advice keys for translation, in order. */
    public List<String> recommendationKeys() {
        return recommendations.stream().map(Recommendation::key).collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AssessmentResult)) return false;
        AssessmentResult that = (AssessmentResult) o;
        return likelihoodScore == that.likelihoodScore
            && impactScore == that.impactScore
            && finalRiskScore == that.finalRiskScore
            && likelihoodLevel == that.likelihoodLevel
            && impactLevel == that.impactLevel
            && riskCategory == that.riskCategory
            && heatmapPosition.equals(that.heatmapPosition)
            && recommendedAction.equals(that.recommendedAction)
            && colorCode.equals(that.colorCode)
            && explanation.equals(that.explanation)
            && recommendations.equals(that.recommendations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(likelihoodScore, impactScore, finalRiskScore, riskCategory,
            heatmapPosition, recommendedAction, explanation, recommendations);
    }

    @Override
    public String toString() {
        return String.format("AssessmentResult{likelihood=%d (%s), impact=%d (%s), final=%d, category=%s, heatmap=%s}",
            likelihoodScore, likelihoodLevel.label(), impactScore, impactLevel.label(),
            finalRiskScore, riskCategory.label(), heatmapPosition);
    }
}
