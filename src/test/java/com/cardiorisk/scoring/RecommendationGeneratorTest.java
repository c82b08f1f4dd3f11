package com.cardiorisk.scoring;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecommendationGeneratorTest {

    private final RecommendationGenerator generator = new RecommendationGenerator();
    private final RiskClassifier classifier = new RiskClassifier();

    private static PatientAssessmentInput.Builder patient() {
        return PatientAssessmentInput.builder().age(52).sex(Sex.MALE);
    }

    @Test
    void criticalActionIsEmergencyRoom() {
        assertThat(generator.recommendedAction(RiskCategory.CRITICAL))
            .isEqualTo("Go to emergency room immediately");
    }

    @Test
    @DisplayName("Category advice comes first, then vital signs, then risk factors")
    void adviceIsGroupedInFixedOrder() {
        PatientAssessmentInput input = patient()
            .systolicBP(150).diastolicBP(95)
            .oxygenSaturation(93)
            .riskFactor(RiskFactor.SMOKING)
            .riskFactor(RiskFactor.DIABETES)
            .build();

        List<Recommendation> advice = generator.recommendations(RiskCategory.MODERATE, 12, input);

        assertThat(advice).containsExactly(
            Recommendation.HEADLINE_MODERATE,
            Recommendation.BOOK_CONSULTATION,
            Recommendation.HEART_HEALTHY_DIET,
            Recommendation.WEIGHT_MANAGEMENT,
            Recommendation.REGULAR_CHECKUPS,
            Recommendation.MEDICATION_ADHERENCE,
            Recommendation.BLOOD_PRESSURE_ELEVATED,
            Recommendation.OXYGEN_LOW,
            Recommendation.RISK_DIABETES,
            Recommendation.RISK_SMOKING);
    }

    @Test
    void unmeasuredVitalsProduceNoAdvice() {
        List<Recommendation> advice = generator.recommendations(RiskCategory.LOW, 1, patient().build());

        assertThat(advice).containsExactly(Recommendation.HEADLINE_LOW, Recommendation.MONITOR_SYMPTOMS);
    }

    @Test
    void criticalBloodPressureReplacesElevatedLine() {
        PatientAssessmentInput input = patient().systolicBP(185).diastolicBP(100).build();

        List<Recommendation> advice = generator.recommendations(RiskCategory.HIGH, 16, input);

        assertThat(advice).contains(Recommendation.BLOOD_PRESSURE_CRITICAL)
            .doesNotContain(Recommendation.BLOOD_PRESSURE_ELEVATED);
    }

    @Test
    void heartRateAndFeverLines() {
        PatientAssessmentInput fast = patient().heartRate(110).temperature(38.2).build();
        PatientAssessmentInput slow = patient().heartRate(48).build();

        assertThat(generator.recommendations(RiskCategory.MILD, 8, fast))
            .contains(Recommendation.HEART_RATE_HIGH, Recommendation.FEVER);
        assertThat(generator.recommendations(RiskCategory.MILD, 8, slow))
            .contains(Recommendation.HEART_RATE_LOW);
    }

    @Test
    void criticalAdviceTellsPatientNotToDrive() {
        List<Recommendation> advice = generator.recommendations(RiskCategory.CRITICAL, 25, patient().build());

        assertThat(advice).startsWith(Recommendation.HEADLINE_CRITICAL, Recommendation.CALL_EMERGENCY)
            .contains(Recommendation.DO_NOT_DRIVE);
    }

    @Test
    void rejectsScoreOutsideCategory() {
        assertThatThrownBy(() -> generator.recommendations(RiskCategory.LOW, 12, patient().build()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("12");
    }

    @Test
    void everyRiskFactorHasAdvice() {
        for (RiskFactor factor : RiskFactor.values()) {
            Recommendation recommendation = Recommendation.forRiskFactor(factor);
            assertThat(recommendation.key()).startsWith("riskFactor.");
            assertThat(recommendation.text()).isNotBlank();
        }
    }

    @Test
    void explanationNamesTheContributingFindings() {
        PatientAssessmentInput input = patient()
            .chestPainType(ChestPainType.TYPICAL)
            .chestPainDurationMinutes(30)
            .shortnessOfBreathLevel(BreathlessnessLevel.SEVERE)
            .build();
        RiskClassification classification = classifier.classify(4, 4);

        String explanation = generator.explanation(classification, input);

        assertThat(explanation)
            .startsWith("Based on your assessment:")
            .contains("typical chest pain")
            .contains("over 20 minutes")
            .contains("severe shortness of breath")
            .endsWith("This places you in the High risk category.");
    }

    @Test
    void pressurePainIsNotDescribedAsTypical() {
        PatientAssessmentInput input = patient().chestPainType(ChestPainType.PRESSURE).build();

        String explanation = generator.explanation(classifier.classify(2, 1), input);

        assertThat(explanation)
            .contains("you reported concerning chest pain")
            .doesNotContain("typical");
    }

    @Test
    void explanationFallsBackToCategoryOnly() {
        RiskClassification classification = classifier.classify(1, 1);

        assertThat(generator.explanation(classification, patient().build()))
            .isEqualTo("Based on your current symptoms and vital signs, your risk level has been assessed as Low.");
    }

    @Test
    void planCarriesDirectiveAndColor() {
        RiskClassification classification = classifier.classify(2, 3);

        RecommendationPlan plan = generator.generate(classification, patient().build());

        assertThat(plan.recommendedAction).isEqualTo("Monitor symptoms and follow heart-health tips");
        assertThat(plan.colorCode).isEqualTo("Yellow-green");
        assertThat(plan.recommendations).first().isEqualTo(Recommendation.HEADLINE_MILD);
    }
}
