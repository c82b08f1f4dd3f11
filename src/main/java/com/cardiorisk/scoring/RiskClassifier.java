package com.cardiorisk.scoring;

import java.util.Objects;

/**
 * Combines likelihood and impact into the final 1..25 score and its band.
 */
public class RiskClassifier {

    public RiskClassification classify(LikelihoodLevel likelihood, ImpactLevel impact) {
        Objects.requireNonNull(likelihood, "likelihood");
        Objects.requireNonNull(impact, "impact");
        int finalScore = likelihood.score() * impact.score();
        return new RiskClassification(
            likelihood,
            impact,
            finalScore,
            RiskCategory.forScore(finalScore),
            new HeatmapPosition(likelihood.score() - 1, impact.score() - 1));
    }

    public RiskClassification classify(int likelihoodScore, int impactScore) {
        return classify(LikelihoodLevel.fromScore(likelihoodScore), ImpactLevel.fromScore(impactScore));
    }
}
