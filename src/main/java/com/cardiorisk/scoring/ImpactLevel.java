package com.cardiorisk.scoring;

/**
 * Severity of physiological impact, scored 1 to 5.
 */
public enum ImpactLevel {
    NEGLIGIBLE(1, "Negligible"),
    LOW(2, "Low"),
    MODERATE(3, "Moderate"),
    SIGNIFICANT(4, "Significant"),
    CRITICAL(5, "Critical");

    private final int score;
    private final String label;

    ImpactLevel(int score, String label) {
        this.score = score;
        this.label = label;
    }

    public int score() {
        return score;
    }

    public String label() {
        return label;
    }

    public static ImpactLevel fromScore(int score) {
        for (ImpactLevel level : values()) {
            if (level.score == score) {
                return level;
            }
        }
        throw new IllegalArgumentException("Impact score must be between 1 and 5: " + score);
    }
}
