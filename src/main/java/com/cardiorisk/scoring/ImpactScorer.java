package com.cardiorisk.scoring;

/**
 * Scores the physiological impact of the presentation.
 *
 * Each measured vital sign is placed in a severity tier and the worst tier
 * wins. Acute symptoms (prolonged chest pain, severe breathlessness, leg
 * swelling, fever with cardiorespiratory symptoms) are scored separately and
 * can raise the result. A vital sign that was not measured contributes
 * nothing; it is never assumed to be abnormal.
 */
public class ImpactScorer {

    static final int PERSISTENT_CHEST_PAIN_MINUTES = 20;
    static final double SYMPTOMATIC_FEVER = 38.5;

    public ImpactLevel score(PatientAssessmentInput input) {
        int tier = Math.max(worstVitalTier(input), acuteSymptomTier(input));
        return ImpactLevel.fromScore(clamp(tier));
    }

    int worstVitalTier(PatientAssessmentInput input) {
        int tier = 1;
        if (input.systolicBP != null) tier = Math.max(tier, systolicTier(input.systolicBP));
        if (input.diastolicBP != null) tier = Math.max(tier, diastolicTier(input.diastolicBP));
        if (input.heartRate != null) tier = Math.max(tier, heartRateTier(input.heartRate));
        if (input.oxygenSaturation != null) tier = Math.max(tier, oxygenSaturationTier(input.oxygenSaturation));
        if (input.temperature != null && !input.temperature.isNaN()) {
            tier = Math.max(tier, temperatureTier(input.temperature));
        }
        return tier;
    }

    int acuteSymptomTier(PatientAssessmentInput input) {
        double points = 1.0;

        boolean chestPain = input.chestPainType.isPresent();
        if (chestPain && input.chestPainMinutes() > PERSISTENT_CHEST_PAIN_MINUTES) {
            points += 2;
        }
        if (input.shortnessOfBreathLevel == BreathlessnessLevel.SEVERE) {
            points += 2;
        }
        if (input.legSwelling) {
            points += 1;
        }
        boolean fever = input.temperature != null && input.temperature > SYMPTOMATIC_FEVER;
        if (fever && (chestPain || input.shortnessOfBreathLevel.isPresent())) {
            points += 1;
        }

        if (points <= 1) return 1;
        if (points <= 2) return 2;
        if (points <= 4) return 3;
        if (points <= 6) return 4;
        return 5;
    }

    static int systolicTier(int systolic) {
        if (systolic < 90 || systolic > 180) return 5;
        if (systolic >= 160) return 4;
        if (systolic >= 140) return 3;
        if (systolic >= 130) return 2;
        return 1;
    }

    static int diastolicTier(int diastolic) {
        if (diastolic > 120) return 5;
        if (diastolic >= 110) return 4;
        if (diastolic >= 90 || diastolic < 50) return 3;
        if (diastolic >= 80) return 2;
        return 1;
    }

    static int heartRateTier(int heartRate) {
        if (heartRate < 40 || heartRate > 130) return 5;
        if (heartRate < 50 || heartRate > 120) return 4;
        if (heartRate > 100) return 3;
        if (heartRate < 60 || heartRate > 90) return 2;
        return 1;
    }

    static int oxygenSaturationTier(int saturation) {
        if (saturation < 90) return 5;
        if (saturation < 92) return 4;
        if (saturation < 95) return 3;
        return 1;
    }

    static int temperatureTier(double celsius) {
        if (celsius >= 40.0 || celsius < 35.0) return 4;
        if (celsius > 38.5) return 3;
        if (celsius > 37.5) return 2;
        return 1;
    }

    private static int clamp(int tier) {
        return Math.max(1, Math.min(5, tier));
    }
}
