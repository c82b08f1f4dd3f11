package com.cardiorisk.scoring;

import java.util.List;

public final class RecommendationPlan {
    public final String recommendedAction;
    public final String colorCode;
    public final String explanation;
    public final List<Recommendation> recommendations;

    public RecommendationPlan(String recommendedAction, String colorCode, String explanation,
                              List<Recommendation> recommendations) {
        this.recommendedAction = recommendedAction;
        this.colorCode = colorCode;
        this.explanation = explanation;
        this.recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }
}
