package com.cardiorisk.scoring;

/**
 * Cardiovascular risk factors. Declaration order is the order in which
 * risk-factor recommendations are emitted.
 */
public enum RiskFactor {
    HYPERTENSION("Hypertension", true),
    DIABETES("Diabetes", true),
    CHRONIC_KIDNEY_DISEASE("Chronic kidney disease", true),
    HIGH_CHOLESTEROL("High cholesterol", true),
    SMOKING("Smoking", true),
    OBESITY("Obesity", false),
    FAMILY_HISTORY("Family history", false),
    PREVIOUS_HEART_DISEASE("Previous heart disease", true);

    private final String label;
    private final boolean major;

    RiskFactor(String label, boolean major) {
        this.label = label;
        this.major = major;
    }

    public String label() {
        return label;
    }

    /** Major factors count towards the likelihood bonus for multiple risk factors. */
    public boolean isMajor() {
        return major;
    }
}
