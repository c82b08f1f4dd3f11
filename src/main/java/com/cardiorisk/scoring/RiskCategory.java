package com.cardiorisk.scoring;

/**
 * Bands over the 1..25 likelihood x impact product. Each band carries the
 * directive shown to the patient.
 */
public enum RiskCategory {
    LOW("Low", 1, 5, "Self-care / monitor symptoms", "Green"),
    MILD("Mild", 6, 10, "Monitor symptoms and follow heart-health tips", "Yellow-green"),
    MODERATE("Moderate", 11, 15, "Consult doctor within 48 hours", "Yellow-orange"),
    HIGH("High", 16, 20, "Seek medical attention within 6-24 hours", "Orange-red"),
    CRITICAL("Critical", 21, 25, "Go to emergency room immediately", "Red");

    private final String label;
    private final int minScore;
    private final int maxScore;
    private final String recommendedAction;
    private final String colorCode;

    RiskCategory(String label, int minScore, int maxScore, String recommendedAction, String colorCode) {
        this.label = label;
        this.minScore = minScore;
        this.maxScore = maxScore;
        this.recommendedAction = recommendedAction;
        this.colorCode = colorCode;
    }

    public String label() {
        return label;
    }

    public String recommendedAction() {
        return recommendedAction;
    }

    public String colorCode() {
        return colorCode;
    }

    public boolean contains(int finalRiskScore) {
        return finalRiskScore >= minScore && finalRiskScore <= maxScore;
    }

    public static RiskCategory forScore(int finalRiskScore) {
        for (RiskCategory category : values()) {
            if (category.contains(finalRiskScore)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Final risk score must be between 1 and 25: " + finalRiskScore);
    }
}
