package com.cardiorisk.scoring;

/**
 * Scores the likelihood of a cardiac event from symptoms, risk factors and
 * demographics.
 *
 * Evidence is accumulated as points from a base of 1.0 and mapped onto the
 * five likelihood bands. Every contribution is non-negative, so adding a
 * symptom or risk factor never lowers the result.
 */
public class LikelihoodScorer {

    static final double BASE_POINTS = 1.0;
    static final int TYPICAL_PAIN_MIN_DURATION = 10;
    static final int PALPITATION_TACHYCARDIA_RATE = 120;
    static final int MAJOR_RISK_FACTOR_THRESHOLD = 2;
    static final int MALE_AGE_THRESHOLD = 55;
    static final int FEMALE_AGE_THRESHOLD = 65;

    public LikelihoodLevel score(PatientAssessmentInput input) {
        return LikelihoodLevel.fromScore(toBand(points(input)));
    }

    double points(PatientAssessmentInput input) {
        double points = BASE_POINTS;
        points += chestPainPoints(input);
        points += breathlessnessPoints(input.shortnessOfBreathLevel);

        if (input.syncope || input.fainting) {
            points += 2;
        }
        if (input.neurologicalSymptoms) {
            points += 2;
        }

        if (input.palpitations) {
            boolean tachycardic = input.heartRate != null && input.heartRate > PALPITATION_TACHYCARDIA_RATE;
            points += tachycardic ? 1.0 : 0.5;
        }

        // Autonomic features that accompany ischaemic pain
        if (input.sweating) points += 0.5;
        if (input.dizziness) points += 0.5;
        if (input.nausea) points += 0.5;

        long majorFactors = input.riskFactors.stream().filter(RiskFactor::isMajor).count();
        if (majorFactors >= MAJOR_RISK_FACTOR_THRESHOLD) {
            points += 1;
        }

        if (isAgeSexRisk(input)) {
            points += 1;
        }
        return points;
    }

    private double chestPainPoints(PatientAssessmentInput input) {
        ChestPainType type = input.chestPainType;
        if (!type.isPresent()) {
            return 0;
        }

        double points;
        boolean typicalPressurePain = type.isPressureLike()
            && input.chestPainMinutes() > TYPICAL_PAIN_MIN_DURATION
            && input.chestPainRadiation
            && input.chestPainExertional;

        if (type == ChestPainType.TYPICAL || typicalPressurePain) {
            points = 2.0;
        } else if (type.isPressureLike()) {
            points = 1.5;
        } else {
            points = 0.5;
        }

        if (input.chestPainExertional) points += 0.5;
        if (input.chestPainRadiation) points += 0.5;
        return points;
    }

    private double breathlessnessPoints(BreathlessnessLevel level) {
        return switch (level) {
            case SEVERE -> 2;
            case MODERATE -> 1;
            default -> 0;
        };
    }

    private boolean isAgeSexRisk(PatientAssessmentInput input) {
        if (input.age == null || input.sex == null) {
            return false;
        }
        return (input.sex == Sex.MALE && input.age >= MALE_AGE_THRESHOLD)
            || (input.sex == Sex.FEMALE && input.age >= FEMALE_AGE_THRESHOLD);
    }

    static int toBand(double points) {
        if (points <= 1) return 1;
        if (points <= 3) return 2;
        if (points <= 5) return 3;
        if (points <= 7) return 4;
        return 5;
    }
}
