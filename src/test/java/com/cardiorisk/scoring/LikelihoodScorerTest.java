package com.cardiorisk.scoring;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;

class LikelihoodScorerTest {

    private final LikelihoodScorer scorer = new LikelihoodScorer();

    private static PatientAssessmentInput.Builder male(int age) {
        return PatientAssessmentInput.builder().age(age).sex(Sex.MALE);
    }

    @Test
    @DisplayName("No symptoms or risk factors scores the lowest level")
    void noEvidenceIsImprobable() {
        LikelihoodLevel level = scorer.score(male(45).build());

        assertThat(level).isEqualTo(LikelihoodLevel.IMPROBABLE);
        assertThat(level.score()).isEqualTo(1);
        assertThat(level.label()).isEqualTo("Improbable");
    }

    @Test
    @DisplayName("Typical exertional pain with severe breathlessness and syncope is very probable")
    void classicPresentationIsVeryProbable() {
        PatientAssessmentInput input = male(60)
            .chestPainType(ChestPainType.TYPICAL)
            .chestPainExertional(true)
            .shortnessOfBreathLevel(BreathlessnessLevel.SEVERE)
            .syncope(true)
            .build();

        assertThat(scorer.score(input).score()).isEqualTo(5);
    }

    @Test
    void classicPresentationIsVeryProbableForWomenBelowAgeThreshold() {
        PatientAssessmentInput input = PatientAssessmentInput.builder()
            .age(60).sex(Sex.FEMALE)
            .chestPainType(ChestPainType.TYPICAL)
            .chestPainExertional(true)
            .shortnessOfBreathLevel(BreathlessnessLevel.SEVERE)
            .syncope(true)
            .build();

        assertThat(scorer.score(input)).isEqualTo(LikelihoodLevel.VERY_PROBABLE);
    }

    @Test
    void everySymptomPresentIsClampedToFive() {
        PatientAssessmentInput.Builder b = male(80)
            .chestPainType(ChestPainType.CRUSHING)
            .chestPainDurationMinutes(45)
            .chestPainRadiation(true)
            .chestPainExertional(true)
            .shortnessOfBreathLevel(BreathlessnessLevel.SEVERE)
            .palpitations(true)
            .heartRate(140)
            .syncope(true)
            .fainting(true)
            .neurologicalSymptoms(true)
            .sweating(true)
            .dizziness(true)
            .nausea(true);
        for (RiskFactor factor : RiskFactor.values()) {
            b.riskFactor(factor);
        }

        assertThat(scorer.score(b.build())).isEqualTo(LikelihoodLevel.VERY_PROBABLE);
    }

    @Test
    void missingDemographicsDoNotFail() {
        PatientAssessmentInput input = PatientAssessmentInput.builder().build();

        assertThat(scorer.score(input)).isEqualTo(LikelihoodLevel.IMPROBABLE);
    }

    @Nested
    @DisplayName("Chest pain")
    class ChestPain {

        @Test
        void pressurePainWithoutTypicalFeaturesIsRemote() {
            PatientAssessmentInput input = male(40).chestPainType(ChestPainType.PRESSURE).build();

            assertThat(scorer.points(input)).isEqualTo(2.5);
            assertThat(scorer.score(input)).isEqualTo(LikelihoodLevel.REMOTE);
        }

        @Test
        void pressurePainWithAllTypicalFeaturesIsScoredAsTypical() {
            PatientAssessmentInput input = male(40)
                .chestPainType(ChestPainType.PRESSURE)
                .chestPainDurationMinutes(15)
                .chestPainRadiation(true)
                .chestPainExertional(true)
                .build();

            assertThat(scorer.points(input)).isEqualTo(4.0);
            assertThat(scorer.score(input)).isEqualTo(LikelihoodLevel.OCCASIONAL);
        }

        @Test
        void sharpPainScoresLessThanPressurePain() {
            double sharp = scorer.points(male(40).chestPainType(ChestPainType.SHARP).build());
            double pressure = scorer.points(male(40).chestPainType(ChestPainType.PRESSURE).build());

            assertThat(sharp).isLessThan(pressure);
        }

        @Test
        void modifiersAreIgnoredWithoutChestPain() {
            PatientAssessmentInput input = male(40)
                .chestPainType(ChestPainType.NONE)
                .chestPainDurationMinutes(60)
                .chestPainRadiation(true)
                .chestPainExertional(true)
                .build();

            assertThat(scorer.points(input)).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("History and demographics")
    class History {

        @Test
        void twoMajorRiskFactorsAddAPoint() {
            PatientAssessmentInput input = male(40)
                .riskFactor(RiskFactor.DIABETES)
                .riskFactor(RiskFactor.SMOKING)
                .build();

            assertThat(scorer.points(input)).isEqualTo(2.0);
        }

        @Test
        void minorRiskFactorsDoNotCountTowardsTheBonus() {
            PatientAssessmentInput input = male(40)
                .riskFactor(RiskFactor.OBESITY)
                .riskFactor(RiskFactor.FAMILY_HISTORY)
                .build();

            assertThat(scorer.points(input)).isEqualTo(1.0);
        }

        @Test
        void ageThresholdDependsOnSex() {
            PatientAssessmentInput man = male(55).build();
            PatientAssessmentInput woman60 = PatientAssessmentInput.builder().age(60).sex(Sex.FEMALE).build();
            PatientAssessmentInput woman65 = PatientAssessmentInput.builder().age(65).sex(Sex.FEMALE).build();

            assertThat(scorer.points(man)).isEqualTo(2.0);
            assertThat(scorer.points(woman60)).isEqualTo(1.0);
            assertThat(scorer.points(woman65)).isEqualTo(2.0);
        }

        @Test
        void palpitationsWeighMoreWithTachycardia() {
            double withoutRate = scorer.points(male(40).palpitations(true).build());
            double normalRate = scorer.points(male(40).palpitations(true).heartRate(80).build());
            double fastRate = scorer.points(male(40).palpitations(true).heartRate(130).build());

            assertThat(withoutRate).isEqualTo(1.5);
            assertThat(normalRate).isEqualTo(1.5);
            assertThat(fastRate).isEqualTo(2.0);
        }
    }

    @Test
    @DisplayName("Adding any symptom or risk factor never lowers the score")
    void scoreIsMonotonic() {
        List<UnaryOperator<PatientAssessmentInput.Builder>> additions = List.of(
            b -> b.chestPainRadiation(true),
            b -> b.chestPainExertional(true),
            b -> b.palpitations(true),
            b -> b.syncope(true),
            b -> b.fainting(true),
            b -> b.neurologicalSymptoms(true),
            b -> b.legSwelling(true),
            b -> b.sweating(true),
            b -> b.dizziness(true),
            b -> b.nausea(true),
            b -> b.riskFactor(RiskFactor.HYPERTENSION),
            b -> b.riskFactor(RiskFactor.SMOKING),
            b -> b.riskFactor(RiskFactor.OBESITY),
            b -> b.shortnessOfBreathLevel(BreathlessnessLevel.SEVERE)
        );
        List<PatientAssessmentInput> bases = List.of(
            male(30).build(),
            male(58).chestPainType(ChestPainType.PRESSURE).chestPainDurationMinutes(12).build(),
            PatientAssessmentInput.builder().age(70).sex(Sex.FEMALE)
                .shortnessOfBreathLevel(BreathlessnessLevel.MODERATE)
                .riskFactor(RiskFactor.DIABETES)
                .build(),
            male(45).chestPainType(ChestPainType.SHARP).palpitations(true).heartRate(125).build()
        );

        for (PatientAssessmentInput base : bases) {
            for (UnaryOperator<PatientAssessmentInput.Builder> addition : additions) {
                PatientAssessmentInput more = addition.apply(base.toBuilder()).build();
                assertThat(scorer.points(more)).isGreaterThanOrEqualTo(scorer.points(base));
                assertThat(scorer.score(more).score()).isGreaterThanOrEqualTo(scorer.score(base).score());
            }
        }
    }

    @Test
    void chestPainTypesAreOrderedBySeverity() {
        double previous = 0;
        for (ChestPainType type : List.of(ChestPainType.NONE, ChestPainType.SHARP,
                ChestPainType.PRESSURE, ChestPainType.TYPICAL)) {
            double points = scorer.points(male(40).chestPainType(type).build());
            assertThat(points).isGreaterThanOrEqualTo(previous);
            previous = points;
        }
    }
}
