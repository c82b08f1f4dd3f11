package com.cardiorisk.scoring;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a classification into the directive, explanation and advice list
 * shown to the patient.
 *
 * Advice is ordered in three fixed groups: category-level lines, then one
 * line per abnormal measured vital sign, then one line per declared risk
 * factor. Absent fields simply produce no line.
 */
public class RecommendationGenerator {

    static final int CRITICAL_SYSTOLIC = 180;
    static final int CRITICAL_DIASTOLIC = 110;
    static final int ELEVATED_SYSTOLIC = 140;
    static final int ELEVATED_DIASTOLIC = 90;
    static final int LOW_SYSTOLIC = 90;
    static final int HIGH_HEART_RATE = 100;
    static final int LOW_HEART_RATE = 50;
    static final int NORMAL_OXYGEN_SATURATION = 95;
    static final double FEVER_CELSIUS = 38.0;

    public RecommendationPlan generate(RiskClassification classification, PatientAssessmentInput input) {
        Objects.requireNonNull(classification, "classification");
        return new RecommendationPlan(
            recommendedAction(classification.category),
            classification.category.colorCode(),
            explanation(classification, input),
            recommendations(classification.category, classification.finalRiskScore, input));
    }

    public String recommendedAction(RiskCategory category) {
        return category.recommendedAction();
    }

    public List<Recommendation> recommendations(RiskCategory category, int finalRiskScore,
                                                PatientAssessmentInput input) {
        if (!category.contains(finalRiskScore)) {
            throw new IllegalArgumentException(
                "Score " + finalRiskScore + " does not belong to category " + category);
        }
        List<Recommendation> out = new ArrayList<>(categoryAdvice(category));
        addVitalSignAdvice(input, out);
        for (RiskFactor factor : RiskFactor.values()) {
            if (input.hasRiskFactor(factor)) {
                out.add(Recommendation.forRiskFactor(factor));
            }
        }
        return List.copyOf(out);
    }

    private List<Recommendation> categoryAdvice(RiskCategory category) {
        return switch (category) {
            case LOW -> List.of(
                Recommendation.HEADLINE_LOW,
                Recommendation.MONITOR_SYMPTOMS);
            case MILD -> List.of(
                Recommendation.HEADLINE_MILD,
                Recommendation.MONITOR_SYMPTOMS,
                Recommendation.HEART_HEALTHY_DIET,
                Recommendation.REGULAR_EXERCISE);
            case MODERATE -> List.of(
                Recommendation.HEADLINE_MODERATE,
                Recommendation.BOOK_CONSULTATION,
                Recommendation.HEART_HEALTHY_DIET,
                Recommendation.WEIGHT_MANAGEMENT,
                Recommendation.REGULAR_CHECKUPS,
                Recommendation.MEDICATION_ADHERENCE);
            case HIGH -> List.of(
                Recommendation.HEADLINE_HIGH,
                Recommendation.URGENT_ASSESSMENT,
                Recommendation.AVOID_EXERTION,
                Recommendation.MEDICATION_ADHERENCE);
            case CRITICAL -> List.of(
                Recommendation.HEADLINE_CRITICAL,
                Recommendation.CALL_EMERGENCY,
                Recommendation.DO_NOT_DRIVE,
                Recommendation.AVOID_EXERTION);
        };
    }

    private void addVitalSignAdvice(PatientAssessmentInput input, List<Recommendation> out) {
        Integer systolic = input.systolicBP;
        Integer diastolic = input.diastolicBP;
        if ((systolic != null && systolic >= CRITICAL_SYSTOLIC) || (diastolic != null && diastolic >= CRITICAL_DIASTOLIC)) {
            out.add(Recommendation.BLOOD_PRESSURE_CRITICAL);
        } else if ((systolic != null && systolic >= ELEVATED_SYSTOLIC) || (diastolic != null && diastolic >= ELEVATED_DIASTOLIC)) {
            out.add(Recommendation.BLOOD_PRESSURE_ELEVATED);
        } else if (systolic != null && systolic < LOW_SYSTOLIC) {
            out.add(Recommendation.BLOOD_PRESSURE_LOW);
        }

        if (input.heartRate != null) {
            if (input.heartRate >= HIGH_HEART_RATE) {
                out.add(Recommendation.HEART_RATE_HIGH);
            } else if (input.heartRate <= LOW_HEART_RATE) {
                out.add(Recommendation.HEART_RATE_LOW);
            }
        }

        if (input.oxygenSaturation != null && input.oxygenSaturation < NORMAL_OXYGEN_SATURATION) {
            out.add(Recommendation.OXYGEN_LOW);
        }

        if (input.temperature != null && input.temperature >= FEVER_CELSIUS) {
            out.add(Recommendation.FEVER);
        }
    }

    public String explanation(RiskClassification classification, PatientAssessmentInput input) {
        List<String> factors = new ArrayList<>();

        int likelihood = classification.likelihood.score();
        if (likelihood >= 4) {
            factors.add("your symptom pattern suggests a cardiac condition");
        } else if (likelihood == 3) {
            factors.add("your symptom pattern may indicate a cardiac condition");
        }

        int impact = classification.impact.score();
        if (impact >= 4) {
            factors.add("the physiological impact appears critical");
        } else if (impact == 3) {
            factors.add("the physiological impact shows concerning signs");
        }

        if (input.chestPainType == ChestPainType.TYPICAL) {
            factors.add("you reported typical chest pain symptoms");
        } else if (input.chestPainType.isPressureLike()) {
            factors.add("you reported concerning chest pain");
        }
        if (input.chestPainType.isPresent() && input.chestPainMinutes() > ImpactScorer.PERSISTENT_CHEST_PAIN_MINUTES) {
            factors.add("your chest pain has lasted over 20 minutes");
        }
        if (input.shortnessOfBreathLevel == BreathlessnessLevel.SEVERE) {
            factors.add("you have severe shortness of breath");
        }
        if (input.syncope || input.fainting) {
            factors.add("you experienced syncope or fainting");
        }

        if (factors.isEmpty()) {
            return "Based on your current symptoms and vital signs, your risk level has been assessed as "
                + classification.category.label() + ".";
        }
        return "Based on your assessment: " + String.join(", ", factors)
            + ". This places you in the " + classification.category.label() + " risk category.";
    }
}
