package com.cardiorisk.scoring;

/**
 * Likelihood of a cardiac event, scored 1 to 5.
 */
public enum LikelihoodLevel {
    IMPROBABLE(1, "Improbable"),
    REMOTE(2, "Remote"),
    OCCASIONAL(3, "Occasional"),
    PROBABLE(4, "Probable"),
    VERY_PROBABLE(5, "Very Probable");

    private final int score;
    private final String label;

    LikelihoodLevel(int score, String label) {
        this.score = score;
        this.label = label;
    }

    public int score() {
        return score;
    }

    public String label() {
        return label;
    }

    public static LikelihoodLevel fromScore(int score) {
        for (LikelihoodLevel level : values()) {
            if (level.score == score) {
                return level;
            }
        }
        throw new IllegalArgumentException("Likelihood score must be between 1 and 5: " + score);
    }
}
